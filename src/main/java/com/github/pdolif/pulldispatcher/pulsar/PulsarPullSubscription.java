package com.github.pdolif.pulldispatcher.pulsar;

import com.github.pdolif.pulldispatcher.DispatcherException;
import com.github.pdolif.pulldispatcher.FetchException;
import com.github.pdolif.pulldispatcher.PullSubscription;
import com.github.pdolif.pulldispatcher.QueueMessage;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.Messages;
import org.apache.pulsar.client.api.PulsarClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link PullSubscription} backed by a Pulsar {@link Consumer}.
 * Batch size and max wait of a fetch are those of the consumer's batch receive policy, which is built from the same
 * consumer settings the dispatcher fetches with.
 */
class PulsarPullSubscription implements PullSubscription {

    private final Consumer<byte[]> consumer;

    PulsarPullSubscription(Consumer<byte[]> consumer) {
        this.consumer = consumer;
    }

    @Override
    public List<QueueMessage> fetch(int maxMessages, Duration maxWait) throws FetchException, InterruptedException {
        Messages<byte[]> messages;
        try {
            messages = consumer.batchReceive();
        } catch (PulsarClientException e) {
            if (e.getCause() instanceof InterruptedException || Thread.interrupted()) {
                throw new InterruptedException("Interrupted while fetching from " + consumer.getTopic());
            }
            throw new FetchException("Failed to fetch messages from " + consumer.getTopic(), e);
        }
        // a consumer that is being closed returns no batch
        if (messages == null || messages.size() == 0) {
            return List.of();
        }

        var fetched = new ArrayList<QueueMessage>(messages.size());
        for (Message<byte[]> message : messages) {
            fetched.add(new PulsarQueueMessage(consumer, message));
        }
        return fetched;
    }

    @Override
    public void close() throws DispatcherException {
        try {
            consumer.close();
        } catch (PulsarClientException e) {
            throw new DispatcherException("Failed to close consumer of " + consumer.getTopic(), e);
        }
    }
}
