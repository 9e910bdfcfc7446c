package com.photofeed.feedcache.cachestore;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.Weigher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 进程内缓存后端
 * 基于 Caffeine 的可变过期（每个条目自带 TTL），容量按字节权重限制
 */
public class CaffeineCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineCacheStore.class);

    private final Cache<String, CacheEntry> cache;
    private final Ticker ticker;

    public CaffeineCacheStore(long maximumWeightBytes, Ticker ticker) {
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
            .ticker(ticker)
            // 每个条目按写入时携带的 TTL 过期，读不续期
            .expireAfter(new Expiry<String, CacheEntry>() {
                @Override
                public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
                    return entry.ttlNanos();
                }

                @Override
                public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
                    return entry.ttlNanos();
                }

                @Override
                public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .maximumWeight(maximumWeightBytes)
            .weigher((Weigher<String, CacheEntry>) (key, entry) -> entry.weight(key))
            .removalListener((key, entry, cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Cache evicted due to size: key={}", key);
                }
            })
            .recordStats()
            .build();

        log.info("Caffeine cache store initialized: maximumWeight={} bytes", maximumWeightBytes);
    }

    @Override
    public Optional<byte[]> get(String key) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        // Caffeine 的过期清理是惰性的，这里按条目自身的时间再判一次
        if (entry.isExpired(ticker.read())) {
            cache.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.put(key, new CacheEntry(value, ticker.read(), ttl.toNanos()));
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidatePrefix(String prefix) {
        boolean removed = cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        log.debug("Prefix invalidated: prefix={}, removed={}", prefix, removed);
    }

    /**
     * 供 Micrometer CaffeineCacheMetrics 绑定
     */
    public Cache<String, CacheEntry> nativeCache() {
        return cache;
    }

    public long size() {
        return cache.estimatedSize();
    }
}
