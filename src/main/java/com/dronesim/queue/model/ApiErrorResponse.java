package com.dronesim.queue.model;

import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class ApiErrorResponse {
    private int status;
    private String message;
}
