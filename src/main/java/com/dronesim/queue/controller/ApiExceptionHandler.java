package com.dronesim.queue.controller;

import com.dronesim.queue.exception.ConflictException;
import com.dronesim.queue.exception.InvalidConfigException;
import com.dronesim.queue.exception.InvalidProgressException;
import com.dronesim.queue.exception.InvalidTransitionException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.exception.StoreUnavailableException;
import com.dronesim.queue.model.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidConfigException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidConfig(InvalidConfigException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(JobNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Job not found");
    }

    @ExceptionHandler({InvalidTransitionException.class, InvalidProgressException.class})
    public ResponseEntity<ApiErrorResponse> handleStateViolation(RuntimeException e) {
        log.warn("Rejected job update: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleConflict(ConflictException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Job store unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Job store unavailable");
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status)
            .body(new ApiErrorResponse().setStatus(status.value()).setMessage(message));
    }
}
