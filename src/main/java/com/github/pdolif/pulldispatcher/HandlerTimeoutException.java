package com.github.pdolif.pulldispatcher;

/**
 * Raised when a handler invocation did not finish before its deadline.
 */
public class HandlerTimeoutException extends DispatcherException {

    public HandlerTimeoutException(String message) {
        super(message);
    }

    public HandlerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
