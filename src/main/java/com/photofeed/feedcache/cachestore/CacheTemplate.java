package com.photofeed.feedcache.cachestore;

import com.photofeed.feedcache.exception.CacheBackendException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * 面向业务对象的缓存读写门面
 * 编解码 + 命中率指标（photofeed.cache.requests，tag: cache / result）
 */
@Slf4j
@Component
public class CacheTemplate {

    public static final String METRIC_REQUESTS = "photofeed.cache.requests";

    private static final byte[] MARKER = {1};

    private final CacheStore cacheStore;
    private final CacheCodec codec;
    private final MeterRegistry meterRegistry;

    public CacheTemplate(CacheStore cacheStore, CacheCodec codec, MeterRegistry meterRegistry) {
        this.cacheStore = cacheStore;
        this.codec = codec;
        this.meterRegistry = meterRegistry;
    }

    public <T> Optional<T> get(String cacheClass, String key, Class<T> type) {
        Optional<T> value = cacheStore.get(key).flatMap(payload -> codec.decode(key, payload, type));
        record(cacheClass, value.isPresent());
        if (value.isPresent()) {
            log.debug("Cache hit: cache={}, key={}", cacheClass, key);
        }
        return value;
    }

    public void put(String key, Object value, Duration ttl) {
        byte[] payload;
        try {
            payload = codec.encode(value);
        } catch (CacheBackendException e) {
            log.warn("Skip caching unencodable value: key={}", key, e);
            return;
        }
        cacheStore.set(key, payload, ttl);
    }

    /**
     * 原始字节读取，用于不走 JSON 的大载荷
     */
    public Optional<byte[]> getBytes(String cacheClass, String key) {
        Optional<byte[]> value = cacheStore.get(key);
        record(cacheClass, value.isPresent());
        return value;
    }

    public void putBytes(String key, byte[] value, Duration ttl) {
        cacheStore.set(key, value, ttl);
    }

    /**
     * 标记类条目（如负缓存）只关心是否存在
     */
    public boolean hasMarker(String key) {
        return cacheStore.get(key).isPresent();
    }

    public void putMarker(String key, Duration ttl) {
        cacheStore.set(key, MARKER, ttl);
    }

    public void invalidate(String key) {
        cacheStore.invalidate(key);
    }

    public void invalidatePrefix(String prefix) {
        cacheStore.invalidatePrefix(prefix);
    }

    private void record(String cacheClass, boolean hit) {
        Counter.builder(METRIC_REQUESTS)
            .description("Cache lookups by cache class and result")
            .tag("cache", cacheClass)
            .tag("result", hit ? "hit" : "miss")
            .register(meterRegistry)
            .increment();
    }
}
