package com.github.pdolif.pulldispatcher;

import java.time.Duration;
import java.util.Map;

/**
 * A message fetched from a {@link PullSubscription}.
 * The dispatcher treats subject and payload as opaque and finalizes every message exactly once,
 * either with {@link #ack()} or with {@link #nack(Duration)}.
 */
public interface QueueMessage {

    /**
     * @return Subject (topic) the message was published on
     */
    String subject();

    byte[] payload();

    /**
     * @return Application properties (headers) of the message, empty if there are none
     */
    Map<String, String> properties();

    /**
     * @return Delivery attempt of this instance of the message, starting at 1
     */
    int deliveryAttempt();

    /**
     * Acknowledges successful processing. The queue will not redeliver the message.
     * @throws AckException if the acknowledgement could not be sent
     */
    void ack() throws AckException;

    /**
     * Signals that the message was not processed and asks the queue to redeliver it after the given delay.
     * @param redeliveryDelay Delay before the message is redelivered
     * @throws AckException if the negative acknowledgement could not be sent
     */
    void nack(Duration redeliveryDelay) throws AckException;
}
