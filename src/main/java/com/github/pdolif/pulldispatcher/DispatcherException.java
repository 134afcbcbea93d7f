package com.github.pdolif.pulldispatcher;

/**
 * Base class of the checked exceptions raised by the dispatcher and its queue bindings.
 */
public class DispatcherException extends Exception {

    public DispatcherException(String message) {
        super(message);
    }

    public DispatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
