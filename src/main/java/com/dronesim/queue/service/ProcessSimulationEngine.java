package com.dronesim.queue.service;

import com.dronesim.queue.config.SimulationProperties;
import com.dronesim.queue.exception.SimulationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the simulation as an external process.
 *
 * <p>The job config is written to the process's stdin as JSON and the job id is passed
 * as the last argument. On stdout the engine reports {@code PROGRESS <percent>} lines
 * and one {@code RESULT <json object>} line; anything else is logged.</p>
 */
@Slf4j
@Service
public class ProcessSimulationEngine implements SimulationEngine {

    static final String PROGRESS_PREFIX = "PROGRESS ";
    static final String RESULT_PREFIX = "RESULT ";

    private static final int OUTPUT_TAIL_LINES = 20;
    private static final long EXIT_GRACE_SECONDS = 5;
    private static final TypeReference<Map<String, Object>> RESULT_TYPE = new TypeReference<>() {
    };

    private final SimulationProperties.Engine settings;
    private final ObjectMapper mapper;
    private final ExecutorService outputReaders = Executors.newCachedThreadPool();

    public ProcessSimulationEngine(SimulationProperties properties, ObjectMapper mapper) {
        this.settings = properties.getEngine();
        this.mapper = mapper;
    }

    @Override
    public Map<String, Object> run(String jobId, Map<String, Object> config, ProgressListener progress)
        throws SimulationException, InterruptedException {
        List<String> command = new ArrayList<>(settings.getCommand());
        command.add(jobId);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(new File(settings.getWorkingDirectory()));
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SimulationException("Failed to start simulation engine: " + e.getMessage(), e);
        }

        try {
            CompletableFuture<EngineOutput> output = CompletableFuture.supplyAsync(
                () -> readOutput(jobId, process, progress), outputReaders);
            // an engine that never drains stdin must not hold the worker past the timeout
            CompletableFuture.runAsync(() -> writeConfig(jobId, process, config), outputReaders);

            Duration timeout = settings.getTimeout();
            EngineOutput engineOutput;
            try {
                engineOutput = output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new SimulationException("Simulation timed out after " + timeout);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                throw new SimulationException("Failed to read simulation output: " + cause.getMessage(), cause);
            }

            if (!process.waitFor(EXIT_GRACE_SECONDS, TimeUnit.SECONDS)) {
                throw new SimulationException("Simulation engine closed its output but did not exit");
            }
            if (process.exitValue() != 0) {
                throw new SimulationException(String.format("Simulation engine exited with code %d: %s",
                    process.exitValue(), engineOutput.tail()));
            }
            if (engineOutput.result == null) {
                throw new SimulationException("Simulation engine finished without a result");
            }
            return engineOutput.result;
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private void writeConfig(String jobId, Process process, Map<String, Object> config) {
        try (OutputStream stdin = process.getOutputStream()) {
            mapper.writeValue(stdin, config);
        } catch (IOException e) {
            // engines that take their input elsewhere may close stdin early
            log.warn("Could not pass config of job {} on stdin: {}", jobId, e.getMessage());
        }
    }

    private EngineOutput readOutput(String jobId, Process process, ProgressListener progress) {
        EngineOutput output = new EngineOutput();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(PROGRESS_PREFIX)) {
                    reportProgress(jobId, line.substring(PROGRESS_PREFIX.length()).trim(), progress);
                } else if (line.startsWith(RESULT_PREFIX)) {
                    output.result = mapper.readValue(line.substring(RESULT_PREFIX.length()), RESULT_TYPE);
                } else {
                    log.info("[{}] {}", jobId, line);
                    output.remember(line);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output;
    }

    private void reportProgress(String jobId, String value, ProgressListener progress) {
        int percent;
        try {
            percent = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed progress '{}' from job {}", value, jobId);
            return;
        }
        progress.onProgress(percent);
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    private static class EngineOutput {
        private Map<String, Object> result;
        private final Deque<String> lastLines = new ArrayDeque<>();

        void remember(String line) {
            if (lastLines.size() == OUTPUT_TAIL_LINES) {
                lastLines.removeFirst();
            }
            lastLines.addLast(line);
        }

        String tail() {
            return lastLines.isEmpty() ? "(no output)" : String.join("\n", lastLines);
        }
    }
}
