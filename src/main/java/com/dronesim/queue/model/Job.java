package com.dronesim.queue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    private String id;
    private JobStatus status;
    private int progress;            // 0-100, non-decreasing once processing
    private Map<String, Object> config;
    private Map<String, Object> result;  // only when COMPLETED
    private String error;                // only when FAILED
    private Instant createdAt;
    private Instant updatedAt;

    // bumped by the store on every successful write
    private long version;

    public Job copy() {
        return toBuilder().build();
    }
}
