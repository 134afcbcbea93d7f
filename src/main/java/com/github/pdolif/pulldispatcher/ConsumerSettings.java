package com.github.pdolif.pulldispatcher;

import java.time.Duration;

/**
 * Settings of the durable consumer registered by a dispatcher.
 * Consumers are always registered with explicit acknowledgement.
 * @param stream Stream (namespace) the subject belongs to
 * @param subject Subject filter of the consumer
 * @param durableName Name of the durable consumer
 * @param batchSize Maximum number of messages per fetch
 * @param maxWait Maximum time a fetch waits for messages
 * @param maxDeliveries Maximum number of delivery attempts per message
 */
public record ConsumerSettings(String stream, String subject, String durableName, int batchSize, Duration maxWait,
                               int maxDeliveries) {

    public static ConsumerSettings from(DispatcherConfig config) {
        return new ConsumerSettings(config.stream(), config.subject(), config.durableName(), config.batchSize(),
                config.maxWait(), DispatcherConfig.MAX_DELIVERIES);
    }
}
