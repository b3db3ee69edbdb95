package com.dronesim.queue.exception;

/**
 * The external simulation engine failed, timed out or produced no result.
 */
public class SimulationException extends Exception {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
