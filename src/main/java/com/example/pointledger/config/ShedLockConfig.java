package com.example.pointledger.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ShedLock configuration for the expiration sweep
 *
 * Only one instance sweeps at a time. An instance that finds the lock held
 * skips the run instead of waiting.
 *
 * Redis lock schema:
 * - key "job-lock:point-ledger:{job_name}"
 * - expires on its own after lockAtMostFor
 */
@Configuration
@EnableScheduling
@EnableSchedulerLock(defaultLockAtMostFor = "5m")
public class ShedLockConfig {

    /**
     * @param connectionFactory Redis connection factory (auto-configured by Spring Boot)
     * @return Redis-backed LockProvider
     */
    @Bean
    public LockProvider lockProvider(RedisConnectionFactory connectionFactory) {
        return new RedisLockProvider(connectionFactory, "point-ledger");
    }
}
