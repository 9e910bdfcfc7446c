package com.photofeed.feedcache.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.photofeed.feedcache.cachestore.CacheStore;
import com.photofeed.feedcache.cachestore.CaffeineCacheStore;
import com.photofeed.feedcache.cachestore.FailOpenCacheStore;
import com.photofeed.feedcache.cachestore.MemcachedCacheStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import net.spy.memcached.ConnectionFactoryBuilder;
import net.spy.memcached.DefaultHashAlgorithm;
import net.spy.memcached.FailureMode;
import net.spy.memcached.MemcachedClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 缓存后端配置
 * photofeed.cache.backend 选择 caffeine（默认）或 memcached，外层统一套故障放行装饰器
 */
@Configuration
public class CacheStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheStoreConfig.class);

    /** 被装饰的实际后端 */
    static final String CACHE_BACKEND = "cacheBackend";

    private static final float FAILURE_RATE_THRESHOLD = 50.0f;
    private static final int SLIDING_WINDOW_SIZE = 100;
    private static final int MINIMUM_CALLS = 20;
    private static final Duration WAIT_DURATION_IN_OPEN_STATE = Duration.ofSeconds(10);

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    @Qualifier(CACHE_BACKEND)
    @ConditionalOnProperty(prefix = "photofeed.cache", name = "backend", havingValue = "caffeine", matchIfMissing = true)
    public CaffeineCacheStore caffeineCacheStore(PhotoFeedProperties properties, Ticker cacheTicker,
                                                 MeterRegistry meterRegistry) {
        CaffeineCacheStore store = new CaffeineCacheStore(properties.getCache().getMaximumWeightBytes(), cacheTicker);
        // 注册 Micrometer 指标
        CaffeineCacheMetrics.monitor(meterRegistry, store.nativeCache(), "photofeed_cache");
        return store;
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "photofeed.cache", name = "backend", havingValue = "memcached")
    public MemcachedClient memcachedClient(PhotoFeedProperties properties) throws IOException {
        PhotoFeedProperties.Memcached config = properties.getCache().getMemcached();
        log.info("Initializing Memcached client: {}", config.getServers());

        List<InetSocketAddress> addresses = Arrays.stream(config.getServers().split(","))
            .map(server -> {
                String[] parts = server.trim().split(":");
                return new InetSocketAddress(parts[0], Integer.parseInt(parts[1]));
            })
            .collect(Collectors.toList());

        ConnectionFactoryBuilder builder = new ConnectionFactoryBuilder()
            // Ketama 一致性哈希
            .setLocatorType(ConnectionFactoryBuilder.Locator.CONSISTENT)
            .setHashAlg(DefaultHashAlgorithm.KETAMA_HASH)
            // 节点故障时重新分发
            .setFailureMode(FailureMode.Redistribute)
            .setOpTimeout(config.getOpTimeout().toMillis())
            // 二进制协议，incr 支持带初值创建
            .setProtocol(ConnectionFactoryBuilder.Protocol.BINARY)
            .setUseNagleAlgorithm(false);

        return new MemcachedClient(builder.build(), addresses);
    }

    @Bean
    @Qualifier(CACHE_BACKEND)
    @ConditionalOnProperty(prefix = "photofeed.cache", name = "backend", havingValue = "memcached")
    public MemcachedCacheStore memcachedCacheStore(MemcachedClient memcachedClient, PhotoFeedProperties properties,
                                                   Clock clock) {
        return new MemcachedCacheStore(memcachedClient, properties.getCache().getMemcached().getOpTimeout(), clock);
    }

    @Bean
    @Primary
    public FailOpenCacheStore cacheStore(@Qualifier(CACHE_BACKEND) CacheStore backend, MeterRegistry meterRegistry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(FAILURE_RATE_THRESHOLD)
            .minimumNumberOfCalls(MINIMUM_CALLS)
            .waitDurationInOpenState(WAIT_DURATION_IN_OPEN_STATE)
            .permittedNumberOfCallsInHalfOpenState(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(SLIDING_WINDOW_SIZE)
            .build();
        CircuitBreaker circuitBreaker = CircuitBreaker.of("cache-backend", config);

        meterRegistry.gauge("photofeed.cache.circuit.state", circuitBreaker, cb -> cb.getState().getOrder());

        log.info("Cache store initialized: backend={}", backend.getClass().getSimpleName());
        return new FailOpenCacheStore(backend, circuitBreaker);
    }
}
