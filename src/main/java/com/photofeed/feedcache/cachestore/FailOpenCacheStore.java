package com.photofeed.feedcache.cachestore;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 缓存故障放行装饰器
 * 后端异常时读按未命中处理、写和失效按空操作处理；熔断打开期间直接跳过后端。
 * 缓存故障从不向调用方抛出。
 */
public class FailOpenCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(FailOpenCacheStore.class);

    private final CacheStore delegate;
    private final CircuitBreaker circuitBreaker;

    public FailOpenCacheStore(CacheStore delegate, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Cache circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()));
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            return circuitBreaker.executeSupplier(() -> delegate.get(key));
        } catch (CallNotPermittedException e) {
            log.debug("Cache circuit open, treating get as miss: key={}", key);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Cache get failed, treating as miss: key={}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        run("set", key, () -> delegate.set(key, value, ttl));
    }

    @Override
    public void invalidate(String key) {
        run("invalidate", key, () -> delegate.invalidate(key));
    }

    @Override
    public void invalidatePrefix(String prefix) {
        run("invalidatePrefix", prefix, () -> delegate.invalidatePrefix(prefix));
    }

    public CircuitBreaker.State state() {
        return circuitBreaker.getState();
    }

    private void run(String operation, String key, Runnable action) {
        try {
            circuitBreaker.executeRunnable(action);
        } catch (CallNotPermittedException e) {
            log.debug("Cache circuit open, skipping {}: key={}", operation, key);
        } catch (RuntimeException e) {
            log.warn("Cache {} failed, ignored: key={}", operation, key, e);
        }
    }
}
