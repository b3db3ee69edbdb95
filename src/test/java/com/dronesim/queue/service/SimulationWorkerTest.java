package com.dronesim.queue.service;

import com.dronesim.queue.config.SimulationProperties;
import com.dronesim.queue.exception.InvalidProgressException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.exception.SimulationException;
import com.dronesim.queue.exception.StoreUnavailableException;
import com.dronesim.queue.model.Job;
import com.dronesim.queue.model.JobStatus;
import com.dronesim.queue.store.JobQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimulationWorkerTest {

    private static final Map<String, Object> CONFIG = Map.of("scene", "yard", "drones", 2);

    @Mock
    private JobQueue jobQueue;

    @Mock
    private JobRegistryService registry;

    @Mock
    private SimulationEngine engine;

    private SimulationWorker worker;

    @BeforeEach
    void setUp() {
        SimulationProperties properties = new SimulationProperties();
        properties.getWorker().setEnabled(false);
        properties.getWorker().setRetryAttempts(3);
        properties.getWorker().setRetryBackoff(Duration.ofMillis(1));
        worker = new SimulationWorker(jobQueue, registry, engine, properties);
    }

    @Test
    void shouldReturnFalseWhenQueueIsEmpty() throws Exception {
        when(jobQueue.claimNext(any())).thenReturn(Optional.empty());

        assertFalse(worker.processNext(Duration.ofMillis(10)));
        verifyNoInteractions(registry, engine);
    }

    @Test
    void shouldCompleteJobAndForwardProgress() throws Exception {
        Map<String, Object> result = Map.of("cir", List.of(0.5, 0.25));
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1")).thenReturn(job(JobStatus.PROCESSING));
        when(registry.reportProgress(eq("job-1"), anyInt())).thenReturn(job(JobStatus.PROCESSING));
        when(registry.complete("job-1", result)).thenReturn(job(JobStatus.COMPLETED));
        when(engine.run(eq("job-1"), eq(CONFIG), any())).thenAnswer(invocation -> {
            ProgressListener listener = invocation.getArgument(2);
            listener.onProgress(25);
            listener.onProgress(75);
            return result;
        });

        assertTrue(worker.processNext(Duration.ZERO));

        verify(registry).reportProgress("job-1", 25);
        verify(registry).reportProgress("job-1", 75);
        verify(registry).complete("job-1", result);
        verify(registry, never()).fail(anyString(), anyString());
    }

    @Test
    void shouldFailJobWhenSimulationFails() throws Exception {
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1")).thenReturn(job(JobStatus.PROCESSING));
        when(engine.run(eq("job-1"), any(), any())).thenThrow(new SimulationException("scene not found"));
        when(registry.fail("job-1", "scene not found")).thenReturn(job(JobStatus.FAILED));

        assertTrue(worker.processNext(Duration.ZERO));

        verify(registry).fail("job-1", "scene not found");
        verify(registry, never()).complete(anyString(), any());
    }

    @Test
    void shouldFailJobWhenEngineCrashes() throws Exception {
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1")).thenReturn(job(JobStatus.PROCESSING));
        when(engine.run(eq("job-1"), any(), any())).thenThrow(new IllegalStateException("boom"));
        when(registry.fail(eq("job-1"), contains("boom"))).thenReturn(job(JobStatus.FAILED));

        assertTrue(worker.processNext(Duration.ZERO));

        verify(registry).fail(eq("job-1"), contains("boom"));
    }

    @Test
    void shouldSkipJobDeletedBeforeProcessing() throws Exception {
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1")).thenThrow(new JobNotFoundException("job-1"));

        assertTrue(worker.processNext(Duration.ZERO));

        verifyNoInteractions(engine);
    }

    @Test
    void shouldRetryTransientStoreFailures() throws Exception {
        Map<String, Object> result = Map.of("cir", List.of(1));
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1"))
            .thenThrow(new StoreUnavailableException("redis down", null))
            .thenReturn(job(JobStatus.PROCESSING));
        when(engine.run(eq("job-1"), any(), any())).thenReturn(result);
        when(registry.complete("job-1", result))
            .thenThrow(new StoreUnavailableException("redis down", null))
            .thenReturn(job(JobStatus.COMPLETED));

        assertTrue(worker.processNext(Duration.ZERO));

        verify(registry, times(2)).markProcessing("job-1");
        verify(registry, times(2)).complete("job-1", result);
    }

    @Test
    void shouldNotRunEngineWhenStoreStaysUnavailable() throws Exception {
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1")).thenThrow(new StoreUnavailableException("redis down", null));

        assertTrue(worker.processNext(Duration.ZERO));

        verify(registry, times(3)).markProcessing("job-1");
        verifyNoInteractions(engine);
    }

    @Test
    void shouldKeepRunningWhenProgressIsRejected() throws Exception {
        Map<String, Object> result = Map.of("cir", List.of(1));
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1")).thenReturn(job(JobStatus.PROCESSING));
        when(registry.reportProgress("job-1", 60)).thenReturn(job(JobStatus.PROCESSING));
        doThrow(new InvalidProgressException("job-1", 60, 40)).when(registry).reportProgress("job-1", 40);
        when(registry.complete("job-1", result)).thenReturn(job(JobStatus.COMPLETED));
        when(engine.run(eq("job-1"), any(), any())).thenAnswer(invocation -> {
            ProgressListener listener = invocation.getArgument(2);
            listener.onProgress(60);
            listener.onProgress(40);
            return result;
        });

        assertTrue(worker.processNext(Duration.ZERO));

        verify(registry).complete("job-1", result);
        verify(registry, never()).fail(anyString(), anyString());
    }

    @Test
    void shouldDropOutcomeOfJobDeletedWhileSimulating() throws Exception {
        Map<String, Object> result = Map.of("cir", List.of(1));
        when(jobQueue.claimNext(any())).thenReturn(Optional.of("job-1"));
        when(registry.markProcessing("job-1")).thenReturn(job(JobStatus.PROCESSING));
        when(engine.run(eq("job-1"), any(), any())).thenReturn(result);
        when(registry.complete("job-1", result)).thenThrow(new JobNotFoundException("job-1"));

        assertTrue(worker.processNext(Duration.ZERO));

        verify(registry).complete("job-1", result);
    }

    @Test
    void shouldWakeQueueWhenJobIsReady() {
        worker.onJobReady(new JobReadyEvent("job-1"));

        verify(jobQueue).wakeUp();
    }

    @Test
    void shouldBackOffAfterUnexpectedQueueFailure() throws Exception {
        SimulationProperties properties = new SimulationProperties();
        properties.getWorker().setPollInterval(Duration.ofMillis(10));
        properties.getWorker().setRetryBackoff(Duration.ofMillis(200));
        SimulationWorker looping = new SimulationWorker(jobQueue, registry, engine, properties);
        when(jobQueue.claimNext(any())).thenThrow(new IllegalStateException("corrupt queue entry"));

        looping.start();
        Thread.sleep(300);
        looping.stop();

        verify(jobQueue, atMost(4)).claimNext(any());
        verifyNoInteractions(registry, engine);
    }

    @Test
    void shouldNotStartWhenDisabled() {
        worker.start();

        assertFalse(worker.isRunning());
        worker.stop();
    }

    private static Job job(JobStatus status) {
        return Job.builder().id("job-1").status(status).config(CONFIG).build();
    }
}
