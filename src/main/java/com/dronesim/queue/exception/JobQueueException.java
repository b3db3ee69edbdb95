package com.dronesim.queue.exception;

/**
 * Base type for failures raised by the job store, queue and registry.
 */
public class JobQueueException extends RuntimeException {

    public JobQueueException(String message) {
        super(message);
    }

    public JobQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
