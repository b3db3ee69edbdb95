package com.dronesim.queue.store;

import com.dronesim.queue.exception.ConflictException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.model.Job;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Process-local store. Records do not survive a restart.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void put(Job job) {
        jobs.compute(job.getId(), (id, existing) -> {
            Job stored = job.copy();
            stored.setVersion(existing == null ? 1 : existing.getVersion() + 1);
            return stored;
        });
    }

    @Override
    public boolean insert(Job job) {
        Job stored = job.copy();
        stored.setVersion(1);
        return jobs.putIfAbsent(job.getId(), stored) == null;
    }

    @Override
    public Optional<Job> get(String id) {
        return Optional.ofNullable(jobs.get(id)).map(Job::copy);
    }

    @Override
    public List<Job> list() {
        return jobs.values().stream()
            .map(Job::copy)
            .collect(Collectors.toList());
    }

    @Override
    public void delete(String id) {
        if (jobs.remove(id) == null) {
            throw new JobNotFoundException(id);
        }
    }

    @Override
    public Job compareAndUpdate(String id, UnaryOperator<Job> mutation) {
        Job current = jobs.get(id);
        if (current == null) {
            throw new JobNotFoundException(id);
        }

        Job updated = mutation.apply(current.copy()).copy();
        updated.setId(id);
        updated.setVersion(current.getVersion() + 1);

        // every write bumps the version, so a racing writer makes the read snapshot unequal
        if (!jobs.replace(id, current, updated)) {
            throw new ConflictException(id);
        }
        return updated.copy();
    }
}
