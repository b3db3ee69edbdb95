package com.dronesim.queue.exception;

public class AlreadyQueuedException extends JobQueueException {

    public AlreadyQueuedException(String jobId) {
        super("Job already queued: " + jobId);
    }
}
