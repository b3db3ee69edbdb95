package com.dronesim.queue.exception;

import com.dronesim.queue.model.JobStatus;

public class InvalidTransitionException extends JobQueueException {

    private final String jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(String.format("Job %s cannot move from %s to %s", jobId, from.getValue(), to.getValue()));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
