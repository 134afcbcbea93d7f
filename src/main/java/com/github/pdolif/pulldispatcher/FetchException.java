package com.github.pdolif.pulldispatcher;

/**
 * Transient failure to fetch a batch. The fetch loop logs it and retries after a backoff.
 */
public class FetchException extends DispatcherException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
