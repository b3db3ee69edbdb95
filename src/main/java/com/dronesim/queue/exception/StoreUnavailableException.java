package com.dronesim.queue.exception;

/**
 * The backing store could not be reached. Callers may retry.
 */
public class StoreUnavailableException extends JobQueueException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
