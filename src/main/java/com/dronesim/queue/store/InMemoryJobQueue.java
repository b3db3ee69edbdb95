package com.dronesim.queue.store;

import com.dronesim.queue.exception.AlreadyQueuedException;
import com.dronesim.queue.model.QueueEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

public class InMemoryJobQueue implements JobQueue {

    private final Deque<QueueEntry> entries = new ArrayDeque<>();
    private final Set<String> queuedIds = new HashSet<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    @Override
    public void enqueue(String jobId) {
        lock.lock();
        try {
            if (!queuedIds.add(jobId)) {
                throw new AlreadyQueuedException(jobId);
            }
            entries.addLast(new QueueEntry(jobId, Instant.now()));
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> claimNext(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (entries.isEmpty()) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            QueueEntry head = entries.pollFirst();
            queuedIds.remove(head.getJobId());
            return Optional.of(head.getJobId());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(String jobId) {
        lock.lock();
        try {
            if (!queuedIds.remove(jobId)) {
                return false;
            }
            entries.removeIf(entry -> entry.getJobId().equals(jobId));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QueueEntry> pending() {
        lock.lock();
        try {
            List<QueueEntry> snapshot = new ArrayList<>(entries.size());
            for (QueueEntry entry : entries) {
                snapshot.add(new QueueEntry(entry.getJobId(), entry.getEnqueuedAt()));
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void wakeUp() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
