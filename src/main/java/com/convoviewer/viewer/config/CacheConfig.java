package com.convoviewer.viewer.config;

import com.convoviewer.viewer.cache.FileFingerprintService;
import com.convoviewer.viewer.cache.TieredCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class CacheConfig {

    @Value("${app.cache.hot.capacity:500}")
    private int hotCapacity;

    @Value("${app.cache.warm.capacity:100}")
    private int warmCapacity;

    @Value("${app.cache.index.capacity:20000}")
    private int indexCapacity;

    @Value("${app.cache.warm.ttl-seconds:30}")
    private long warmTtlSeconds;

    @Value("${app.cache.warm.sweep-interval-seconds:60}")
    private long sweepIntervalSeconds;

    @Bean(destroyMethod = "close")
    public TieredCacheManager tieredCacheManager(FileFingerprintService fingerprintService) {
        TieredCacheManager cache = new TieredCacheManager(
                hotCapacity,
                warmCapacity,
                indexCapacity,
                Duration.ofSeconds(warmTtlSeconds),
                fingerprintService,
                Clock.systemUTC());
        cache.startSweeper(Duration.ofSeconds(sweepIntervalSeconds));
        log.info("Cache configured: hot={}, warm={} (ttl {}s), index={}",
                hotCapacity, warmCapacity, warmTtlSeconds, indexCapacity);
        return cache;
    }
}
