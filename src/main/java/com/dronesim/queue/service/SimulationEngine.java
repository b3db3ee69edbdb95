package com.dronesim.queue.service;

import com.dronesim.queue.exception.SimulationException;

import java.util.Map;

/**
 * The external computation that turns a job config into a result. Implementations
 * block for the whole run.
 */
public interface SimulationEngine {

    Map<String, Object> run(String jobId, Map<String, Object> config, ProgressListener progress)
        throws SimulationException, InterruptedException;
}
