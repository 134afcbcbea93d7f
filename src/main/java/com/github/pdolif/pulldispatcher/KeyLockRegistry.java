package com.github.pdolif.pulldispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out exclusive locks per {@link OrderingKey}.
 * <p>
 * A lock entry only exists while at least one caller holds or waits for its key. The entry is removed when the last
 * holder releases it, so the number of entries is bounded by the number of messages in flight and not by the number
 * of distinct keys ever seen. Waiters for the same key acquire the lock in arrival order.
 */
public class KeyLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(KeyLockRegistry.class);

    private final String name;
    private final ConcurrentHashMap<OrderingKey, Entry> entriesPerKey = new ConcurrentHashMap<>();

    public KeyLockRegistry(String name, Metrics metrics) {
        if (name == null) throw new IllegalArgumentException("Name cannot be null");
        if (metrics == null) throw new IllegalArgumentException("Metrics cannot be null");
        this.name = name;

        metrics.registerGaugeForMap("pull.dispatcher.key.locks.count", entriesPerKey,
                "Number of ordering keys that are currently locked or awaited", "dispatcherName", name);
    }

    public KeyLockRegistry(String name) {
        this(name, Metrics.disabled());
    }

    /**
     * Blocks until the lock for the given key is held by the calling thread.
     * @param orderingKey Key to lock
     * @return Held lock, to be closed by the same thread. A no-op lock for {@link OrderingKey#none()}.
     * @throws InterruptedException if interrupted while waiting; the lock is not held in that case
     */
    public KeyLock lock(OrderingKey orderingKey) throws InterruptedException {
        if (orderingKey == null) throw new IllegalArgumentException("OrderingKey cannot be null");
        if (orderingKey.isNone()) {
            return KeyLock.NONE;
        }

        var entry = entriesPerKey.compute(orderingKey, (key, existing) -> {
            var registered = (existing == null) ? new Entry() : existing;
            registered.users++;
            return registered;
        });

        try {
            entry.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            unregister(orderingKey);
            throw e;
        }
        return new HeldKeyLock(orderingKey, entry);
    }

    /**
     * @return Number of keys that are currently held or awaited
     */
    public int size() {
        return entriesPerKey.size();
    }

    private void unregister(OrderingKey orderingKey) {
        entriesPerKey.compute(orderingKey, (key, entry) -> {
            if (entry == null) {
                log.warn("[{}] No lock entry found for ordering key {}", name, orderingKey);
                return null;
            }
            entry.users--;
            // drop the entry once nobody holds or waits for it
            return entry.users == 0 ? null : entry;
        });
    }

    /**
     * Lock held for one ordering key. Closing it releases the key for the next waiter.
     */
    public interface KeyLock extends AutoCloseable {

        KeyLock NONE = new KeyLock() {
            @Override
            public OrderingKey orderingKey() {
                return OrderingKey.none();
            }

            @Override
            public void close() {}
        };

        OrderingKey orderingKey();

        @Override
        void close();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per key compute
        private int users;
    }

    private final class HeldKeyLock implements KeyLock {

        private final OrderingKey orderingKey;
        private final Entry entry;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private HeldKeyLock(OrderingKey orderingKey, Entry entry) {
            this.orderingKey = orderingKey;
            this.entry = entry;
        }

        @Override
        public OrderingKey orderingKey() {
            return orderingKey;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                // unlock before unregistering, a new entry must never coexist with a held one
                entry.lock.unlock();
                unregister(orderingKey);
            }
        }
    }
}
