package com.dronesim.queue.store;

import com.dronesim.queue.exception.ConflictException;
import com.dronesim.queue.exception.InvalidTransitionException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.model.Job;
import com.dronesim.queue.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
    }

    @Test
    void shouldReturnCopiesOfStoredRecords() {
        store.put(pendingJob("job-1"));

        Job read = store.get("job-1").orElseThrow();
        read.setStatus(JobStatus.FAILED);

        assertEquals(JobStatus.PENDING, store.get("job-1").orElseThrow().getStatus());
    }

    @Test
    void shouldReplaceRecordOnPut() {
        store.put(pendingJob("job-1"));
        Job replacement = pendingJob("job-1");
        replacement.setConfig(Map.of("scene", "field"));

        store.put(replacement);

        assertEquals(1, store.list().size());
        assertEquals("field", store.get("job-1").orElseThrow().getConfig().get("scene"));
    }

    @Test
    void shouldInsertOnlyWhenAbsent() {
        assertTrue(store.insert(pendingJob("job-1")));

        Job duplicate = pendingJob("job-1");
        duplicate.setStatus(JobStatus.FAILED);

        assertFalse(store.insert(duplicate));
        Job stored = store.get("job-1").orElseThrow();
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertEquals(1, stored.getVersion());
    }

    @Test
    void shouldFailToDeleteUnknownJob() {
        assertThrows(JobNotFoundException.class, () -> store.delete("missing"));
    }

    @Test
    void shouldApplyMutationAndBumpVersion() {
        store.put(pendingJob("job-1"));
        long before = store.get("job-1").orElseThrow().getVersion();

        Job updated = store.compareAndUpdate("job-1", job -> {
            job.setStatus(JobStatus.PROCESSING);
            return job;
        });

        assertEquals(JobStatus.PROCESSING, updated.getStatus());
        assertEquals(before + 1, updated.getVersion());
        assertEquals(JobStatus.PROCESSING, store.get("job-1").orElseThrow().getStatus());
    }

    @Test
    void shouldReportConflictWhenRecordChangesDuringMutation() {
        store.put(pendingJob("job-1"));

        assertThrows(ConflictException.class, () -> store.compareAndUpdate("job-1", job -> {
            store.compareAndUpdate("job-1", racing -> {
                racing.setProgress(10);
                return racing;
            });
            job.setStatus(JobStatus.FAILED);
            return job;
        }));

        Job stored = store.get("job-1").orElseThrow();
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertEquals(10, stored.getProgress());
    }

    @Test
    void shouldLeaveRecordUntouchedWhenMutationThrows() {
        store.put(pendingJob("job-1"));

        assertThrows(InvalidTransitionException.class, () -> store.compareAndUpdate("job-1", job -> {
            job.setProgress(50);
            throw new InvalidTransitionException("job-1", JobStatus.PENDING, JobStatus.COMPLETED);
        }));

        assertEquals(0, store.get("job-1").orElseThrow().getProgress());
    }

    @Test
    void shouldFailToUpdateUnknownJob() {
        assertThrows(JobNotFoundException.class, () -> store.compareAndUpdate("missing", job -> job));
    }

    private static Job pendingJob(String id) {
        Instant now = Instant.now();
        return Job.builder()
            .id(id)
            .status(JobStatus.PENDING)
            .config(Map.of("scene", "yard"))
            .createdAt(now)
            .updatedAt(now)
            .build();
    }
}
