package com.dronesim.queue.exception;

/**
 * A concurrent writer changed the record between read and write.
 */
public class ConflictException extends JobQueueException {

    public ConflictException(String jobId) {
        super("Concurrent update of job " + jobId);
    }
}
