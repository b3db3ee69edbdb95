package com.dronesim.queue.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Worker-side update of a job. Every field is optional; the combination decides
 * which state machine operation is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobUpdateRequest {
    private JobStatus status;
    private Integer progress;
    private Map<String, Object> result;
    private String error;
}
