package com.dronesim.queue.model;

import lombok.Data;

import java.util.Map;

@Data
public class JobCreateRequest {
    private Map<String, Object> config;
}
