package com.github.pdolif.pulldispatcher;

/**
 * Failure to send an acknowledgement or negative acknowledgement for a message.
 */
public class AckException extends DispatcherException {

    public AckException(String message) {
        super(message);
    }

    public AckException(String message, Throwable cause) {
        super(message, cause);
    }
}
