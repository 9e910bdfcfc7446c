package com.photofeed.feedcache.health;

import com.photofeed.feedcache.cachestore.CacheStore;
import com.photofeed.feedcache.cachestore.FailOpenCacheStore;
import com.photofeed.feedcache.repository.ConnectionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 读路径健康检查：关系库 ping + 缓存读写往返
 * 缓存不可用只影响延迟，整体状态以关系库为准
 */
@Slf4j
@Component("feedCacheHealthIndicator")
@RequiredArgsConstructor
public class FeedCacheHealthIndicator implements HealthIndicator {

    private static final String PROBE_KEY = "health:probe";
    private static final Duration PROBE_TTL = Duration.ofSeconds(5);

    private final ConnectionManager connectionManager;
    private final CacheStore cacheStore;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean storeHealthy;

        // 1. 关系库
        try {
            storeHealthy = connectionManager.ping();
            details.put("store", storeHealthy ? "UP" : "DOWN");
        } catch (Exception e) {
            log.error("Store health check failed", e);
            storeHealthy = false;
            details.put("store", "DOWN");
            details.put("store_error", e.getMessage());
        }

        // 2. 缓存往返
        boolean cacheHealthy = checkCache();
        details.put("cache", cacheHealthy ? "UP" : "DEGRADED");
        if (cacheStore instanceof FailOpenCacheStore failOpen) {
            details.put("cache_circuit", failOpen.state().name());
        }

        return storeHealthy
            ? Health.up().withDetails(details).build()
            : Health.down().withDetails(details).build();
    }

    private boolean checkCache() {
        byte[] probe = String.valueOf(System.nanoTime()).getBytes(StandardCharsets.US_ASCII);
        cacheStore.set(PROBE_KEY, probe, PROBE_TTL);
        Optional<byte[]> value = cacheStore.get(PROBE_KEY);
        return value.isPresent() && Arrays.equals(probe, value.get());
    }
}
