package com.github.pdolif.pulldispatcher.pulsar;

import com.github.pdolif.pulldispatcher.AckException;
import com.github.pdolif.pulldispatcher.QueueMessage;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.PulsarClientException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link QueueMessage} wrapping a Pulsar {@link Message}.
 * Messages that come back through the retry letter topic report the topic they were originally published on.
 */
public class PulsarQueueMessage implements QueueMessage {

    static final String REAL_TOPIC_PROPERTY = "REAL_TOPIC";
    static final String RECONSUME_TIMES_PROPERTY = "RECONSUMETIMES";

    private final Consumer<byte[]> consumer;
    private final Message<byte[]> message;

    PulsarQueueMessage(Consumer<byte[]> consumer, Message<byte[]> message) {
        this.consumer = consumer;
        this.message = message;
    }

    /**
     * @return The underlying Pulsar message, e.g. to derive an ordering key from its key or ordering key
     */
    public Message<byte[]> getPulsarMessage() {
        return message;
    }

    @Override
    public String subject() {
        var realTopic = message.getProperty(REAL_TOPIC_PROPERTY);
        return (realTopic != null) ? realTopic : message.getTopicName();
    }

    @Override
    public byte[] payload() {
        return message.getData();
    }

    @Override
    public Map<String, String> properties() {
        var properties = message.getProperties();
        return (properties == null) ? Map.of() : properties;
    }

    @Override
    public int deliveryAttempt() {
        return 1 + message.getRedeliveryCount() + reconsumeTimes();
    }

    @Override
    public void ack() throws AckException {
        try {
            consumer.acknowledge(message);
        } catch (PulsarClientException e) {
            throw new AckException("Failed to acknowledge message " + message.getMessageId(), e);
        }
    }

    @Override
    public void nack(Duration redeliveryDelay) throws AckException {
        try {
            consumer.reconsumeLater(message, redeliveryDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (PulsarClientException e) {
            throw new AckException("Failed to negatively acknowledge message " + message.getMessageId(), e);
        }
    }

    private int reconsumeTimes() {
        var reconsumeTimes = message.getProperty(RECONSUME_TIMES_PROPERTY);
        if (reconsumeTimes == null) {
            return 0;
        }
        try {
            return Integer.parseInt(reconsumeTimes);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return "PulsarQueueMessage{" +
                "messageId=" + message.getMessageId() +
                ", subject=" + subject() +
                '}';
    }
}
