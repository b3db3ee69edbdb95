package com.dronesim.queue.service;

import lombok.Value;

/**
 * Published after a job id lands in the queue.
 */
@Value
public class JobReadyEvent {
    String jobId;
}
