package com.github.pdolif.pulldispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Processes one fetched message under an admission slot that was acquired by the fetch loop.
 * <p>
 * The ordering key is derived first, then the key lock is taken and the handler runs under a deadline. The message is
 * acknowledged on success and negatively acknowledged otherwise. The admission slot is released on every exit path.
 */
class MessageProcessor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    static final String PROCESSED_COUNTER = "pull.dispatcher.messages.processed";

    private final String name;
    private final QueueMessage message;
    private final DispatcherConfig config;
    private final KeyLockRegistry keyLockRegistry;
    private final AdmissionGate admissionGate;
    private final ScheduledExecutorService deadlineScheduler;
    private final Metrics metrics;

    MessageProcessor(QueueMessage message, DispatcherConfig config, KeyLockRegistry keyLockRegistry,
                     AdmissionGate admissionGate, ScheduledExecutorService deadlineScheduler, Metrics metrics) {
        this.name = config.name();
        this.message = message;
        this.config = config;
        this.keyLockRegistry = keyLockRegistry;
        this.admissionGate = admissionGate;
        this.deadlineScheduler = deadlineScheduler;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        try {
            var outcome = process();
            metrics.incrementCounter(PROCESSED_COUNTER, "Number of messages processed by outcome",
                    "dispatcherName", name, "outcome", outcome.tagValue());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure while processing message on subject {}", name, message.subject(), e);
        } finally {
            admissionGate.release();
        }
    }

    ProcessingOutcome process() {
        OrderingKey orderingKey;
        try {
            orderingKey = OrderingKey.of(config.handler().orderingKey(message));
        } catch (Exception e) {
            log.error("[{}] Failed to get ordering key for message on subject {}. Nacking message.",
                    name, message.subject(), e);
            nack(config.keyExtractionNackDelay());
            return ProcessingOutcome.NACKED_KEY_EXTRACTION_FAILED;
        }

        try (var keyLock = keyLockRegistry.lock(orderingKey)) {
            log.debug("[{}] Processing message on subject {} with {}", name, message.subject(), keyLock.orderingKey());
            return processLocked(orderingKey);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for lock of {}. Nacking message.", name, orderingKey);
            nack(config.keyExtractionNackDelay());
            return ProcessingOutcome.NACKED_INTERRUPTED;
        }
    }

    private ProcessingOutcome processLocked(OrderingKey orderingKey) {
        var deadline = Deadline.after(config.handlerTimeout());
        Exception failure = null;
        boolean timedOut;
        var watchdog = new DeadlineWatchdog(Thread.currentThread());
        try {
            watchdog.schedule(deadlineScheduler, config.handlerTimeout());
        } catch (RejectedExecutionException e) {
            // the deadline is still checked once the handler returns
            log.warn("[{}] Deadline scheduler rejected watchdog for message on subject {}, handler will not be "
                    + "interrupted", name, message.subject());
        }
        try {
            config.handler().process(message, deadline);
        } catch (Exception e) {
            failure = e;
        } finally {
            timedOut = watchdog.finish() || deadline.isExpired();
        }

        if (timedOut) {
            var timeout = new HandlerTimeoutException("Handler did not finish within " + config.handlerTimeout(),
                    failure);
            log.error("[{}] Handler timed out processing message on subject {} with {}. Nacking message.",
                    name, message.subject(), orderingKey, timeout);
            nack(config.handlerFailureNackDelay());
            return ProcessingOutcome.NACKED_HANDLER_TIMEOUT;
        }
        if (failure != null) {
            log.error("[{}] Handler failed to process message on subject {} with {}. Nacking message.",
                    name, message.subject(), orderingKey, failure);
            nack(config.handlerFailureNackDelay());
            return ProcessingOutcome.NACKED_HANDLER_FAILED;
        }

        try {
            message.ack();
        } catch (AckException e) {
            log.error("[{}] Failed to ack message on subject {}", name, message.subject(), e);
            return ProcessingOutcome.ACK_FAILED;
        }
        log.debug("[{}] Successfully processed and acked message on subject {} with {}",
                name, message.subject(), orderingKey);
        return ProcessingOutcome.ACKED;
    }

    private void nack(Duration redeliveryDelay) {
        try {
            message.nack(redeliveryDelay);
        } catch (AckException e) {
            log.warn("[{}] Failed to nack message on subject {}", name, message.subject(), e);
        }
    }

    /**
     * Interrupts the handler thread once the deadline has passed, unless the handler finished before.
     */
    private static final class DeadlineWatchdog {

        private final Thread handlerThread;
        private ScheduledFuture<?> scheduled;
        private boolean finished;
        private boolean fired;

        private DeadlineWatchdog(Thread handlerThread) {
            this.handlerThread = handlerThread;
        }

        private void schedule(ScheduledExecutorService scheduler, Duration timeout) {
            scheduled = scheduler.schedule(this::fire, timeout.toNanos(), TimeUnit.NANOSECONDS);
        }

        private synchronized void fire() {
            if (!finished) {
                fired = true;
                handlerThread.interrupt();
            }
        }

        /**
         * @return true if the deadline passed while the handler was running
         */
        private synchronized boolean finish() {
            if (finished) {
                return fired;
            }
            finished = true;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            if (fired) {
                // clear the interrupt raised for the handler
                Thread.interrupted();
            }
            return fired;
        }
    }
}
