package com.github.pdolif.pulldispatcher;

/**
 * Durable, at-least-once, pull style message queue used by an {@link OrderedPullDispatcher}.
 */
public interface MessageQueue {

    /**
     * Registers the durable consumer described by the given settings, or binds to it when it already exists with
     * matching settings, and opens a pull subscription on it.
     * @param settings Consumer settings
     * @return Open pull subscription
     * @throws SetupException if the consumer could not be registered or the subscription could not be opened
     */
    PullSubscription subscribe(ConsumerSettings settings) throws SetupException;
}
