package com.dronesim.queue.exception;

public class InvalidConfigException extends JobQueueException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
