package com.github.pdolif.pulldispatcher;

import java.time.Duration;
import java.util.List;

/**
 * Pull subscription bound to a durable consumer.
 * Only the fetch loop of a dispatcher and its stop operation touch a subscription.
 */
public interface PullSubscription extends AutoCloseable {

    /**
     * Fetches up to {@code maxMessages} messages, waiting at most {@code maxWait} for messages to become available.
     * @return Fetched messages in delivery order, empty if none arrived within {@code maxWait}
     * @throws FetchException on a transient failure to fetch
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    List<QueueMessage> fetch(int maxMessages, Duration maxWait) throws FetchException, InterruptedException;

    /**
     * Closes the subscription. The durable consumer itself is kept.
     */
    @Override
    void close() throws DispatcherException;
}
