package com.dronesim.queue.service;

import com.dronesim.queue.config.SimulationProperties;
import com.dronesim.queue.exception.ConflictException;
import com.dronesim.queue.exception.InvalidProgressException;
import com.dronesim.queue.exception.InvalidTransitionException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.exception.SimulationException;
import com.dronesim.queue.exception.StoreUnavailableException;
import com.dronesim.queue.model.Job;
import com.dronesim.queue.store.JobQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single consumer of the job queue. Claims one job at a time, runs it through the
 * simulation engine and records progress and the outcome in the registry.
 *
 * <p>A job left in {@code processing} after the worker gave up on the registry is not
 * recovered here; it is logged for manual intervention.</p>
 */
@Slf4j
@Service
public class SimulationWorker {

    private final JobQueue jobQueue;
    private final JobRegistryService registry;
    private final SimulationEngine engine;
    private final SimulationProperties.Worker settings;

    private final ExecutorService loopExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "simulation-worker");
        thread.setDaemon(true);
        return thread;
    });
    private volatile boolean running;

    public SimulationWorker(JobQueue jobQueue, JobRegistryService registry, SimulationEngine engine,
                            SimulationProperties properties) {
        this.jobQueue = jobQueue;
        this.registry = registry;
        this.engine = engine;
        this.settings = properties.getWorker();
    }

    @PostConstruct
    public void start() {
        if (!settings.isEnabled()) {
            log.info("Simulation worker disabled");
            return;
        }
        running = true;
        loopExecutor.submit(this::runLoop);
    }

    @PreDestroy
    public void stop() {
        running = false;
        loopExecutor.shutdownNow();
        try {
            if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Simulation worker did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    @EventListener
    public void onJobReady(JobReadyEvent event) {
        log.debug("Job {} is ready, waking worker", event.getJobId());
        jobQueue.wakeUp();
    }

    void runLoop() {
        log.info("Simulation worker started, polling every {}", settings.getPollInterval());
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                processNext(settings.getPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (StoreUnavailableException e) {
                log.warn("Job queue unavailable: {}", e.getMessage());
                if (!pause(settings.getRetryBackoff())) {
                    Thread.currentThread().interrupt();
                }
            } catch (RuntimeException e) {
                log.error("Unexpected failure in simulation worker", e);
                if (!pause(settings.getRetryBackoff())) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        running = false;
        log.info("Simulation worker stopped");
    }

    /**
     * Claims and runs at most one job.
     *
     * @return whether a job was claimed
     */
    public boolean processNext(Duration timeout) throws InterruptedException {
        Optional<String> claimed = jobQueue.claimNext(timeout);
        if (claimed.isEmpty()) {
            return false;
        }
        String jobId = claimed.get();
        log.info("Claimed job {}", jobId);

        Job job;
        try {
            job = withRetry(jobId, "mark as processing", () -> registry.markProcessing(jobId));
        } catch (JobNotFoundException e) {
            log.warn("Job {} was deleted before processing started, skipping", jobId);
            return true;
        } catch (InvalidTransitionException e) {
            log.error("Claimed job {} is {} instead of pending, skipping", jobId, e.getFrom().getValue());
            return true;
        } catch (StoreUnavailableException | ConflictException e) {
            log.error("Gave up starting job {}; it stays pending and needs manual intervention", jobId, e);
            return true;
        }

        Map<String, Object> result;
        try {
            log.info("Starting simulation for job {}", jobId);
            result = engine.run(jobId, job.getConfig(), percent -> onProgress(jobId, percent));
        } catch (SimulationException e) {
            log.error("Simulation of job {} failed: {}", jobId, e.getMessage());
            finish(jobId, "mark as failed", () -> registry.fail(jobId, e.getMessage()));
            return true;
        } catch (InterruptedException e) {
            abortOnShutdown(jobId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Simulation engine crashed on job {}", jobId, e);
            finish(jobId, "mark as failed", () -> registry.fail(jobId, e.toString()));
            return true;
        }

        log.info("Finished simulation for job {}", jobId);
        finish(jobId, "complete", () -> registry.complete(jobId, result));
        return true;
    }

    private void onProgress(String jobId, int percent) {
        try {
            withRetry(jobId, "report progress", () -> registry.reportProgress(jobId, percent));
            log.debug("Job {} at {}%", jobId, percent);
        } catch (InvalidProgressException | InvalidTransitionException e) {
            log.error("Rejected progress report for job {}: {}", jobId, e.getMessage());
        } catch (JobNotFoundException e) {
            log.warn("Job {} was deleted while simulating", jobId);
        } catch (StoreUnavailableException | ConflictException e) {
            log.warn("Dropped progress {}% of job {}: {}", percent, jobId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void finish(String jobId, String action, Supplier<Job> call) throws InterruptedException {
        try {
            Job job = withRetry(jobId, action, call);
            log.info("Job {} is {}", jobId, job.getStatus().getValue());
        } catch (JobNotFoundException e) {
            log.warn("Job {} was deleted while simulating, outcome dropped", jobId);
        } catch (InvalidTransitionException e) {
            log.error("Could not {} job {}: {}", action, jobId, e.getMessage());
        } catch (StoreUnavailableException | ConflictException e) {
            log.error("Gave up trying to {} job {}; it stays processing and needs manual intervention",
                action, jobId, e);
        }
    }

    private void abortOnShutdown(String jobId) {
        try {
            registry.fail(jobId, "Simulation interrupted by worker shutdown");
        } catch (RuntimeException e) {
            log.error("Could not mark interrupted job {} as failed", jobId, e);
        }
    }

    private Job withRetry(String jobId, String action, Supplier<Job> call) throws InterruptedException {
        Duration backoff = settings.getRetryBackoff();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (StoreUnavailableException | ConflictException e) {
                if (attempt >= settings.getRetryAttempts()) {
                    throw e;
                }
                log.warn("Failed to {} job {} (attempt {}/{}), retrying in {}: {}",
                    action, jobId, attempt, settings.getRetryAttempts(), backoff, e.getMessage());
                Thread.sleep(backoff.toMillis());
                backoff = backoff.multipliedBy(2);
            }
        }
    }

    private static boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            return false;
        }
    }
}
