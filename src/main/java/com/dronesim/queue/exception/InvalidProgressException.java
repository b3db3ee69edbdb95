package com.dronesim.queue.exception;

public class InvalidProgressException extends JobQueueException {

    private final String jobId;
    private final int current;
    private final int requested;

    public InvalidProgressException(String jobId, int current, int requested) {
        super(String.format("Job %s progress %d is outside [%d, 100]", jobId, requested, current));
        this.jobId = jobId;
        this.current = current;
        this.requested = requested;
    }

    public String getJobId() {
        return jobId;
    }

    public int getCurrent() {
        return current;
    }

    public int getRequested() {
        return requested;
    }
}
