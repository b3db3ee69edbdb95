package com.dronesim.queue.controller;

import com.dronesim.queue.model.Job;
import com.dronesim.queue.model.JobCreateRequest;
import com.dronesim.queue.model.JobUpdateRequest;
import com.dronesim.queue.service.JobRegistryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
public class JobController {

    private final JobRegistryService registry;

    public JobController(JobRegistryService registry) {
        this.registry = registry;
    }

    @GetMapping("/")
    public ResponseEntity<?> root() {
        return ResponseEntity.ok(Map.of("message", "Simulation Job Queue Service"));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    @PostMapping("/jobs")
    public ResponseEntity<Job> createJob(@RequestBody JobCreateRequest request) {
        return ResponseEntity.ok(registry.submit(request.getConfig()));
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<Job>> listJobs() {
        return ResponseEntity.ok(registry.list());
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<Job> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(registry.get(jobId));
    }

    /**
     * Worker-side status update, not meant for end clients.
     */
    @PutMapping("/jobs/{jobId}")
    public ResponseEntity<Job> updateJob(@PathVariable String jobId, @RequestBody JobUpdateRequest update) {
        return ResponseEntity.ok(registry.applyUpdate(jobId, update));
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<?> deleteJob(@PathVariable String jobId) {
        registry.delete(jobId);
        return ResponseEntity.ok(Map.of("message", "Job deleted successfully"));
    }
}
