package com.github.pdolif.pulldispatcher;

/**
 * Processing logic supplied by the application.
 * Implementations are called concurrently from multiple processor threads.
 */
public interface MessageHandler {

    /**
     * Derives the ordering key of a message. Messages with the same key are never processed concurrently.
     * @param message Message to classify
     * @return Ordering key, empty or null if the message has no ordering constraint
     * @throws Exception if the message cannot be classified; it is then redelivered after a short delay
     */
    String orderingKey(QueueMessage message) throws Exception;

    /**
     * Processes a single message. Returning normally acknowledges the message.
     * The processing thread is interrupted once the deadline has passed.
     * @param message Message to process
     * @param deadline Point in time by which processing must be finished
     * @throws Exception if processing failed; the message is then redelivered after a longer delay
     */
    void process(QueueMessage message, Deadline deadline) throws Exception;
}
