package com.github.pdolif.pulldispatcher;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Counting gate that bounds the number of messages in flight.
 * Every successful {@link #acquire()} must be paired with exactly one {@link #release()}.
 */
public class AdmissionGate {

    private final int capacity;
    private final Semaphore slots;

    public AdmissionGate(int capacity, String name, Metrics metrics) {
        if (capacity <= 0) throw new IllegalArgumentException("Capacity must be greater than 0");
        if (name == null) throw new IllegalArgumentException("Name cannot be null");
        if (metrics == null) throw new IllegalArgumentException("Metrics cannot be null");
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);

        metrics.registerGauge("pull.dispatcher.in.flight.messages", this, AdmissionGate::inFlight,
                "Number of messages currently admitted for processing", "dispatcherName", name);
    }

    public AdmissionGate(int capacity) {
        this(capacity, "admission-gate", Metrics.disabled());
    }

    /**
     * Blocks until a slot is free and takes it.
     * @throws InterruptedException if interrupted while waiting; no slot is taken in that case
     */
    public void acquire() throws InterruptedException {
        slots.acquire();
    }

    public void release() {
        slots.release();
    }

    /**
     * Waits until no slot is taken, without blocking later acquisitions once it returns.
     * @param timeout Maximum time to wait
     * @return true if the gate was idle before the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        if (!slots.tryAcquire(capacity, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        slots.release(capacity);
        return true;
    }

    public int inFlight() {
        return capacity - slots.availablePermits();
    }

    public int capacity() {
        return capacity;
    }
}
