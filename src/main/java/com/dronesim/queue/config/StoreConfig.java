package com.dronesim.queue.config;

import com.dronesim.queue.store.InMemoryJobQueue;
import com.dronesim.queue.store.InMemoryJobStore;
import com.dronesim.queue.store.JobQueue;
import com.dronesim.queue.store.JobStore;
import com.dronesim.queue.store.RedisJobQueue;
import com.dronesim.queue.store.RedisJobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

@Configuration
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "simulation.store", name = "type", havingValue = "memory", matchIfMissing = true)
    static class InMemory {

        @Bean
        public JobStore jobStore() {
            return new InMemoryJobStore();
        }

        @Bean
        public JobQueue jobQueue() {
            return new InMemoryJobQueue();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "simulation.store", name = "type", havingValue = "redis")
    static class Redis {

        @Bean
        public RedisScript<Long> enqueueScript() {
            return RedisScript.of(new ClassPathResource("scripts/enqueue.lua"), Long.class);
        }

        @Bean
        public RedisScript<String> claimScript() {
            return RedisScript.of(new ClassPathResource("scripts/claim.lua"), String.class);
        }

        @Bean
        public RedisScript<Long> removeScript() {
            return RedisScript.of(new ClassPathResource("scripts/remove.lua"), Long.class);
        }

        @Bean
        public JobStore jobStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                 SimulationProperties properties) {
            return new RedisJobStore(redisTemplate, objectMapper, properties.getStore().getKeyPrefix());
        }

        @Bean
        public JobQueue jobQueue(StringRedisTemplate redisTemplate,
                                 RedisScript<Long> enqueueScript,
                                 RedisScript<String> claimScript,
                                 RedisScript<Long> removeScript,
                                 SimulationProperties properties) {
            return new RedisJobQueue(redisTemplate, enqueueScript, claimScript, removeScript,
                properties.getStore().getKeyPrefix(), properties.getStore().getRecheckInterval());
        }
    }
}
