package com.dronesim.queue.store;

import com.dronesim.queue.exception.AlreadyQueuedException;
import com.dronesim.queue.exception.StoreUnavailableException;
import com.dronesim.queue.model.QueueEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending ids in the list {@code <prefix>:queue}; the hash {@code <prefix>:queued}
 * maps each waiting id to its enqueue time and rejects duplicates. Enqueue, claim
 * and remove are Lua scripts, so each runs atomically on the server.
 *
 * <p>An empty queue is re-checked every {@code recheckInterval}; {@link #wakeUp()}
 * cuts the wait short.</p>
 */
@Slf4j
public class RedisJobQueue implements JobQueue {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> enqueueScript;
    private final RedisScript<String> claimScript;
    private final RedisScript<Long> removeScript;
    private final String keyPrefix;
    private final Duration recheckInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signalled = lock.newCondition();

    public RedisJobQueue(StringRedisTemplate redisTemplate,
                         RedisScript<Long> enqueueScript,
                         RedisScript<String> claimScript,
                         RedisScript<Long> removeScript,
                         String keyPrefix,
                         Duration recheckInterval) {
        this.redisTemplate = redisTemplate;
        this.enqueueScript = enqueueScript;
        this.claimScript = claimScript;
        this.removeScript = removeScript;
        this.keyPrefix = keyPrefix;
        this.recheckInterval = recheckInterval;
    }

    @Override
    public void enqueue(String jobId) {
        Long added;
        try {
            added = redisTemplate.execute(enqueueScript, keys(),
                jobId, Long.toString(Instant.now().toEpochMilli()));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to enqueue job " + jobId, e);
        }
        if (added == null || added == 0) {
            throw new AlreadyQueuedException(jobId);
        }
        wakeUp();
    }

    @Override
    public Optional<String> claimNext(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            String id = claimHead();
            if (id != null) {
                log.debug("Claimed job {} from {}", id, queueKey());
                return Optional.of(id);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            awaitSignal(Math.min(remaining, recheckInterval.toNanos()));
        }
    }

    @Override
    public boolean remove(String jobId) {
        Long removed;
        try {
            removed = redisTemplate.execute(removeScript, keys(), jobId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to remove job " + jobId + " from queue", e);
        }
        return removed != null && removed > 0;
    }

    @Override
    public List<QueueEntry> pending() {
        try {
            List<String> ids = redisTemplate.opsForList().range(queueKey(), 0, -1);
            if (ids == null || ids.isEmpty()) {
                return List.of();
            }
            List<Object> fields = new ArrayList<>(ids);
            List<Object> times = redisTemplate.opsForHash().multiGet(queuedKey(), fields);
            List<QueueEntry> entries = new ArrayList<>(ids.size());
            for (int i = 0; i < ids.size(); i++) {
                Object millis = times.get(i);
                Instant enqueuedAt = millis == null ? null : Instant.ofEpochMilli(Long.parseLong(millis.toString()));
                entries.add(new QueueEntry(ids.get(i), enqueuedAt));
            }
            return entries;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read queue", e);
        }
    }

    @Override
    public void wakeUp() {
        lock.lock();
        try {
            signalled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private String claimHead() {
        try {
            return redisTemplate.execute(claimScript, keys());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to claim from queue", e);
        }
    }

    private void awaitSignal(long nanos) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            signalled.await(nanos, TimeUnit.NANOSECONDS);
        } finally {
            lock.unlock();
        }
    }

    private List<String> keys() {
        return List.of(queueKey(), queuedKey());
    }

    private String queueKey() {
        return keyPrefix + ":queue";
    }

    private String queuedKey() {
        return keyPrefix + ":queued";
    }
}
