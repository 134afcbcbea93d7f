package com.github.pdolif.pulldispatcher;

/**
 * Thrown when the durable consumer or its pull subscription cannot be created. A dispatcher is never started partially.
 */
public class SetupException extends DispatcherException {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
