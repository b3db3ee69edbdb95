package com.dronesim.queue.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueEntry {
    private String jobId;
    private Instant enqueuedAt;
}
