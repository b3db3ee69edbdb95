package com.dronesim.queue.service;

import com.dronesim.queue.config.SimulationProperties;
import com.dronesim.queue.exception.AlreadyQueuedException;
import com.dronesim.queue.exception.ConflictException;
import com.dronesim.queue.exception.InvalidConfigException;
import com.dronesim.queue.exception.InvalidProgressException;
import com.dronesim.queue.exception.InvalidTransitionException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.model.Job;
import com.dronesim.queue.model.JobStatus;
import com.dronesim.queue.model.JobUpdateRequest;
import com.dronesim.queue.store.JobQueue;
import com.dronesim.queue.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Creates, reads and deletes jobs and drives them through the
 * {@code pending -> processing -> completed | failed} state machine.
 *
 * <p>Every status change is a read-assert-write through
 * {@link JobStore#compareAndUpdate}, retried when a concurrent writer wins.</p>
 */
@Slf4j
@Service
public class JobRegistryService {

    static final String CLIENT_JOB_ID_KEY = "job_id";
    static final String DEFAULT_FAILURE_MESSAGE = "Simulation failed without an error message";

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final ApplicationEventPublisher eventPublisher;
    private final int conflictRetries;
    private Clock clock = Clock.systemUTC();

    public JobRegistryService(JobStore jobStore, JobQueue jobQueue,
                              ApplicationEventPublisher eventPublisher,
                              SimulationProperties properties) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.eventPublisher = eventPublisher;
        this.conflictRetries = properties.getStore().getConflictRetries();
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    public Job submit(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            throw new InvalidConfigException("Job config must be a non-empty document");
        }

        String jobId = resolveJobId(config);
        Instant now = clock.instant();
        Job job = Job.builder()
            .id(jobId)
            .status(JobStatus.PENDING)
            .progress(0)
            .config(frozenCopy(config))
            .createdAt(now)
            .updatedAt(now)
            .version(1)
            .build();

        if (!jobStore.insert(job)) {
            log.info("Job {} already submitted, returning existing record", jobId);
            // created and deleted again by someone else between our insert and this read
            return jobStore.get(jobId).orElseThrow(() -> new ConflictException(jobId));
        }

        try {
            jobQueue.enqueue(jobId);
        } catch (AlreadyQueuedException e) {
            log.debug("Duplicate enqueue of job {} ignored", jobId);
        }
        log.info("Submitted job {}", jobId);

        notifyJobReady(jobId);
        return job;
    }

    public Job get(String id) {
        return jobStore.get(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public List<Job> list() {
        return jobStore.list().stream()
            .sorted(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getId))
            .collect(Collectors.toList());
    }

    public Job markProcessing(String id) {
        return mutate(id, job -> {
            requireTransition(job, JobStatus.PROCESSING);
            job.setStatus(JobStatus.PROCESSING);
            job.setProgress(0);
            return job;
        });
    }

    public Job reportProgress(String id, int percent) {
        return mutate(id, job -> {
            if (job.getStatus() != JobStatus.PROCESSING) {
                throw new InvalidTransitionException(id, job.getStatus(), JobStatus.PROCESSING);
            }
            if (percent < job.getProgress() || percent > 100) {
                throw new InvalidProgressException(id, job.getProgress(), percent);
            }
            job.setProgress(percent);
            return job;
        });
    }

    public Job complete(String id, Map<String, Object> result) {
        return mutate(id, job -> {
            requireTransition(job, JobStatus.COMPLETED);
            job.setStatus(JobStatus.COMPLETED);
            job.setProgress(100);
            job.setResult(result == null ? Map.of() : frozenCopy(result));
            return job;
        });
    }

    public Job fail(String id, String error) {
        String message = error == null || error.isBlank() ? DEFAULT_FAILURE_MESSAGE : error;
        return mutate(id, job -> {
            requireTransition(job, JobStatus.FAILED);
            job.setStatus(JobStatus.FAILED);
            job.setError(message);
            return job;
        });
    }

    /**
     * Applies a worker-side update, mapping the requested fields onto the state machine
     * operations.
     */
    public Job applyUpdate(String id, JobUpdateRequest update) {
        JobStatus target = update.getStatus();
        if (target == null) {
            if (update.getProgress() == null) {
                return get(id);
            }
            return reportProgress(id, update.getProgress());
        }

        return switch (target) {
            case PENDING -> throw new InvalidTransitionException(id, get(id).getStatus(), JobStatus.PENDING);
            case PROCESSING -> {
                Job job = get(id);
                if (job.getStatus() == JobStatus.PENDING) {
                    job = markProcessing(id);
                }
                if (update.getProgress() != null) {
                    job = reportProgress(id, update.getProgress());
                } else if (job.getStatus() != JobStatus.PROCESSING) {
                    throw new InvalidTransitionException(id, job.getStatus(), JobStatus.PROCESSING);
                }
                yield job;
            }
            case COMPLETED -> complete(id, update.getResult());
            case FAILED -> fail(id, update.getError());
        };
    }

    public void delete(String id) {
        jobStore.delete(id);
        if (jobQueue.remove(id)) {
            log.info("Deleted job {} and its queue entry", id);
        } else {
            log.info("Deleted job {}", id);
        }
    }

    private Job mutate(String id, UnaryOperator<Job> mutation) {
        ConflictException lastConflict = null;
        for (int attempt = 1; attempt <= conflictRetries; attempt++) {
            try {
                return jobStore.compareAndUpdate(id, job -> {
                    Job updated = mutation.apply(job);
                    updated.setUpdatedAt(clock.instant());
                    return updated;
                });
            } catch (ConflictException e) {
                lastConflict = e;
                log.debug("Conflict updating job {} (attempt {}/{})", id, attempt, conflictRetries);
            }
        }
        throw lastConflict;
    }

    private void requireTransition(Job job, JobStatus next) {
        if (!job.getStatus().canTransitionTo(next)) {
            throw new InvalidTransitionException(job.getId(), job.getStatus(), next);
        }
    }

    private void notifyJobReady(String jobId) {
        try {
            eventPublisher.publishEvent(new JobReadyEvent(jobId));
        } catch (RuntimeException e) {
            // the worker still finds the job on its next poll
            log.warn("Failed to notify worker about job {}: {}", jobId, e.getMessage());
        }
    }

    /**
     * Deep copy whose nested maps and lists are unmodifiable, so neither the caller nor
     * a reader of the stored record can change it afterwards.
     */
    static Map<String, Object> frozenCopy(Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, freeze(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static String resolveJobId(Map<String, Object> config) {
        Object requested = config.get(CLIENT_JOB_ID_KEY);
        if (requested instanceof String id && !id.isBlank()) {
            return id;
        }
        return UUID.randomUUID().toString();
    }
}
