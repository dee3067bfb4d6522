package com.example.pointledger.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import java.time.Duration;

/**
 * Redis 快取配置
 *
 * 功能：
 * 1. 啟用 Spring Cache 框架 (@EnableCaching)
 * 2. 餘額快取 "balance"：key = userId，value = Long（JDK 序列化）
 * 3. TTL 300 秒，同時限制「批次到期但尚未被清掃」時快取值的陳舊時間
 * 4. 快取鍵格式：{cacheName}:{key}
 *
 * 帳本異動在事務提交後由 PointBalanceChangedListener 清除對應快取。
 */
@Configuration
@EnableCaching
public class RedisCacheConfig {

    static final Duration BALANCE_TTL = Duration.ofSeconds(300);

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        RedisCacheConfiguration cacheConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(BALANCE_TTL)
            .disableCachingNullValues()
            .computePrefixWith(cacheName -> cacheName + ":");

        return RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(cacheConfig)
            .build();
    }
}
