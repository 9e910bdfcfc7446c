package com.photofeed.feedcache.cachestore;

import com.photofeed.feedcache.exception.CacheBackendException;
import net.spy.memcached.MemcachedClient;
import net.spy.memcached.internal.OperationFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Memcached 缓存后端
 * <p>
 * Memcached 不支持按前缀删除，这里给每个顶层命名空间（Key 中第一个 ':' 之前的部分）维护一个代数计数器，
 * 物理 Key 为 {@code g<代数>:<逻辑 Key>}。前缀失效即代数加一，旧代的条目不再可达，随 TTL 自然淘汰。
 * 因此前缀失效的粒度是整个命名空间。
 */
public class MemcachedCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(MemcachedCacheStore.class);

    /** 代数计数器 Key 前缀 */
    static final String GENERATION_PREFIX = "ns-gen:";

    /** 超过 30 天的过期时间 Memcached 按绝对 Unix 时间解释 */
    static final long MAX_RELATIVE_EXPIRATION_SECONDS = 30L * 24 * 60 * 60;

    private final MemcachedClient client;
    private final Duration opTimeout;
    private final Clock clock;

    public MemcachedCacheStore(MemcachedClient client, Duration opTimeout, Clock clock) {
        this.client = client;
        this.opTimeout = opTimeout;
        this.clock = clock;
    }

    @Override
    public Optional<byte[]> get(String key) {
        String physicalKey = physicalKey(key);
        Object value;
        try {
            value = client.get(physicalKey);
        } catch (RuntimeException e) {
            throw new CacheBackendException("Memcached get failed: " + key, e);
        }
        if (value instanceof byte[] bytes) {
            return Optional.of(bytes);
        }
        if (value != null) {
            log.warn("Unexpected memcached value type: key={}, type={}", key, value.getClass().getName());
        }
        return Optional.empty();
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        OperationFuture<Boolean> future = client.set(physicalKey(key), expiration(ttl), value);
        if (!Boolean.TRUE.equals(await(future, "set", key))) {
            log.debug("Memcached set not stored: key={}", key);
        }
    }

    @Override
    public void invalidate(String key) {
        await(client.delete(physicalKey(key)), "delete", key);
    }

    @Override
    public void invalidatePrefix(String prefix) {
        int sep = prefix.indexOf(':');
        if (sep <= 0) {
            // 前缀跨越多个命名空间，只能整体清空
            await(client.flush(), "flush", prefix);
            log.info("Memcached flushed for prefix: {}", prefix);
            return;
        }
        String namespace = prefix.substring(0, sep);
        long generation;
        try {
            generation = client.incr(GENERATION_PREFIX + namespace, 1L, clock.millis(), 0);
        } catch (RuntimeException e) {
            throw new CacheBackendException("Memcached generation bump failed: " + namespace, e);
        }
        if (generation < 0) {
            throw new CacheBackendException("Memcached generation bump rejected: " + namespace, null);
        }
        log.debug("Memcached namespace generation bumped: namespace={}, generation={}", namespace, generation);
    }

    /**
     * 计数器初值取当前毫秒，计数器被淘汰后重建的代数仍大于此前任何一代
     */
    String physicalKey(String key) {
        long generation;
        try {
            generation = client.incr(GENERATION_PREFIX + namespaceOf(key), 0L, clock.millis(), 0);
        } catch (RuntimeException e) {
            throw new CacheBackendException("Memcached generation read failed: " + key, e);
        }
        if (generation < 0) {
            throw new CacheBackendException("Memcached generation read rejected: " + key, null);
        }
        return "g" + generation + ":" + key;
    }

    static String namespaceOf(String key) {
        int sep = key.indexOf(':');
        return sep < 0 ? key : key.substring(0, sep);
    }

    /**
     * TTL 向上取整到秒，且不为 0（0 在 Memcached 中表示永不过期）
     */
    int expiration(Duration ttl) {
        long seconds = (ttl.toMillis() + 999) / 1000;
        if (seconds <= 0) {
            seconds = 1;
        }
        if (seconds > MAX_RELATIVE_EXPIRATION_SECONDS) {
            return (int) (clock.millis() / 1000 + seconds);
        }
        return (int) seconds;
    }

    private <T> T await(OperationFuture<T> future, String operation, String key) {
        try {
            return future.get(opTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CacheBackendException("Memcached " + operation + " interrupted: " + key, e);
        } catch (ExecutionException | TimeoutException e) {
            future.cancel(true);
            throw new CacheBackendException("Memcached " + operation + " failed: " + key, e);
        }
    }
}
