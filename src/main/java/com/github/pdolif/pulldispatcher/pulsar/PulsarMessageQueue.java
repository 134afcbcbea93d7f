package com.github.pdolif.pulldispatcher.pulsar;

import com.github.pdolif.pulldispatcher.ConsumerSettings;
import com.github.pdolif.pulldispatcher.MessageQueue;
import com.github.pdolif.pulldispatcher.PullSubscription;
import com.github.pdolif.pulldispatcher.SetupException;
import org.apache.pulsar.client.api.BatchReceivePolicy;
import org.apache.pulsar.client.api.DeadLetterPolicy;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.Schema;
import org.apache.pulsar.client.api.SubscriptionInitialPosition;
import org.apache.pulsar.client.api.SubscriptionMode;
import org.apache.pulsar.client.api.SubscriptionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * {@link MessageQueue} on Apache Pulsar.
 * <p>
 * The stream of the consumer settings is the Pulsar namespace ({@code tenant/namespace}) and the subject is a topic in
 * that namespace. A fully qualified subject ({@code persistent://tenant/namespace/topic}) is used as is. The durable
 * consumer is a durable {@link SubscriptionType#Shared} subscription, so several dispatchers can share it. Negative
 * acknowledgements with a delay go through the retry letter topic and messages that reach the maximum number of
 * deliveries are moved to the dead letter topic.
 */
public class PulsarMessageQueue implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(PulsarMessageQueue.class);

    private final PulsarClient pulsarClient;

    public PulsarMessageQueue(PulsarClient pulsarClient) {
        if (pulsarClient == null) throw new IllegalArgumentException("PulsarClient cannot be null");
        this.pulsarClient = pulsarClient;
    }

    @Override
    public PullSubscription subscribe(ConsumerSettings settings) throws SetupException {
        if (settings == null) throw new IllegalArgumentException("ConsumerSettings cannot be null");
        var topic = topicName(settings);
        try {
            var consumer = pulsarClient.newConsumer(Schema.BYTES)
                    .topic(topic)
                    .subscriptionName(settings.durableName())
                    .subscriptionType(SubscriptionType.Shared)
                    .subscriptionMode(SubscriptionMode.Durable)
                    .subscriptionInitialPosition(SubscriptionInitialPosition.Earliest)
                    .batchReceivePolicy(BatchReceivePolicy.builder()
                            .maxNumMessages(settings.batchSize())
                            .timeout(Math.toIntExact(settings.maxWait().toMillis()), TimeUnit.MILLISECONDS)
                            .build())
                    .enableRetry(true)
                    .deadLetterPolicy(DeadLetterPolicy.builder()
                            // the first delivery is not a redelivery
                            .maxRedeliverCount(settings.maxDeliveries() - 1)
                            .build())
                    .subscribe();
            log.info("Subscribed to topic {} with durable subscription {}", topic, settings.durableName());
            return new PulsarPullSubscription(consumer);
        } catch (PulsarClientException e) {
            throw new SetupException("Failed to subscribe to subject " + settings.subject() + " in stream "
                    + settings.stream(), e);
        }
    }

    static String topicName(ConsumerSettings settings) {
        var subject = settings.subject();
        if (subject.startsWith("persistent://") || subject.startsWith("non-persistent://")) {
            return subject;
        }
        return "persistent://" + settings.stream() + "/" + subject;
    }
}
