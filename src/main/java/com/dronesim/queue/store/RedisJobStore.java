package com.dronesim.queue.store;

import com.dronesim.queue.exception.ConflictException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.exception.StoreUnavailableException;
import com.dronesim.queue.model.Job;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Job records as JSON strings under {@code <prefix>:job:<id>}, with the set
 * {@code <prefix>:jobs} indexing the ids. Conditional writes use WATCH/MULTI/EXEC.
 */
@Slf4j
public class RedisJobStore implements JobStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper mapper;
    private final String keyPrefix;

    public RedisJobStore(StringRedisTemplate redisTemplate, ObjectMapper mapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.mapper = mapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void put(Job job) {
        String key = jobKey(job.getId());
        try {
            redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    Job stored = job.copy();
                    stored.setVersion(currentVersion(ops.opsForValue().get(key)) + 1);
                    ops.multi();
                    ops.opsForValue().set(key, write(stored));
                    ops.opsForSet().add(indexKey(), job.getId());
                    return ops.exec();
                }
            });
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to write job " + job.getId(), e);
        }
    }

    @Override
    public boolean insert(Job job) {
        String key = jobKey(job.getId());
        Job stored = job.copy();
        stored.setVersion(1);
        Boolean inserted;
        try {
            inserted = redisTemplate.opsForValue().setIfAbsent(key, write(stored));
            if (Boolean.TRUE.equals(inserted)) {
                redisTemplate.opsForSet().add(indexKey(), job.getId());
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to insert job " + job.getId(), e);
        }
        return Boolean.TRUE.equals(inserted);
    }

    @Override
    public Optional<Job> get(String id) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(jobKey(id))).map(this::read);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read job " + id, e);
        }
    }

    @Override
    public List<Job> list() {
        try {
            Set<String> ids = redisTemplate.opsForSet().members(indexKey());
            if (ids == null || ids.isEmpty()) {
                return List.of();
            }
            List<String> keys = ids.stream().map(this::jobKey).toList();
            List<String> values = redisTemplate.opsForValue().multiGet(keys);
            if (values == null) {
                return List.of();
            }
            List<Job> jobs = new ArrayList<>(values.size());
            values.stream().filter(Objects::nonNull).map(this::read).forEach(jobs::add);
            return jobs;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to list jobs", e);
        }
    }

    @Override
    public void delete(String id) {
        Boolean deleted;
        try {
            deleted = redisTemplate.delete(jobKey(id));
            redisTemplate.opsForSet().remove(indexKey(), id);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to delete job " + id, e);
        }
        if (!Boolean.TRUE.equals(deleted)) {
            throw new JobNotFoundException(id);
        }
    }

    @Override
    public Job compareAndUpdate(String id, UnaryOperator<Job> mutation) {
        String key = jobKey(id);
        Job[] written = new Job[1];
        List<Object> results;
        try {
            results = redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    String raw = ops.opsForValue().get(key);
                    Job updated;
                    try {
                        if (raw == null) {
                            throw new JobNotFoundException(id);
                        }
                        Job current = read(raw);
                        updated = mutation.apply(current.copy()).copy();
                        updated.setId(id);
                        updated.setVersion(current.getVersion() + 1);
                    } catch (RuntimeException e) {
                        ops.unwatch();
                        throw e;
                    }
                    ops.multi();
                    ops.opsForValue().set(key, write(updated));
                    written[0] = updated;
                    return ops.exec();
                }
            });
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to update job " + id, e);
        }

        // EXEC comes back empty when the watched key changed
        if (results == null || results.isEmpty()) {
            log.debug("Lost update race on job {}", id);
            throw new ConflictException(id);
        }
        return written[0];
    }

    private long currentVersion(String raw) {
        return raw == null ? 0 : read(raw).getVersion();
    }

    private Job read(String raw) {
        try {
            return mapper.readValue(raw, Job.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt job record: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Job job) {
        try {
            return mapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job " + job.getId() + " is not serializable", e);
        }
    }

    private String jobKey(String id) {
        return keyPrefix + ":job:" + id;
    }

    private String indexKey() {
        return keyPrefix + ":jobs";
    }
}
