package com.github.pdolif.pulldispatcher;

/**
 * Terminal result of processing a single message.
 */
public enum ProcessingOutcome {
    /** Handler succeeded and the message was acknowledged. */
    ACKED,
    /** Handler succeeded but the acknowledgement could not be sent; the queue redelivers the message. */
    ACK_FAILED,
    /** The ordering key could not be derived; the message was nacked with the short delay. */
    NACKED_KEY_EXTRACTION_FAILED,
    /** The handler failed; the message was nacked with the long delay. */
    NACKED_HANDLER_FAILED,
    /** The handler exceeded its deadline; the message was nacked with the long delay. */
    NACKED_HANDLER_TIMEOUT,
    /** The processor was interrupted before the handler ran; the message was nacked with the short delay. */
    NACKED_INTERRUPTED;

    public boolean isAcked() {
        return this == ACKED;
    }

    String tagValue() {
        return name().toLowerCase();
    }
}
