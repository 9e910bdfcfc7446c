package com.photofeed.feedcache.cachestore;

import com.photofeed.feedcache.support.MutableTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Caffeine 缓存后端单元测试
 */
class CaffeineCacheStoreTest {

    private MutableTicker ticker;
    private CaffeineCacheStore store;

    @BeforeEach
    void setUp() {
        ticker = new MutableTicker();
        store = new CaffeineCacheStore(16L * 1024 * 1024, ticker);
    }

    @Test
    @DisplayName("TTL 边界：T+ttl-1 可见，T+ttl 过期")
    void testTtlBoundary() {
        store.set("post:1", bytes("v1"), Duration.ofSeconds(60));

        ticker.advance(Duration.ofSeconds(59));
        assertArrayEquals(bytes("v1"), store.get("post:1").orElseThrow());

        ticker.advance(Duration.ofSeconds(1));
        assertTrue(store.get("post:1").isEmpty());
    }

    @Test
    @DisplayName("读取不续期")
    void testReadDoesNotExtendTtl() {
        store.set("post:1", bytes("v1"), Duration.ofSeconds(10));

        for (int i = 0; i < 9; i++) {
            ticker.advance(Duration.ofSeconds(1));
            assertTrue(store.get("post:1").isPresent());
        }
        ticker.advance(Duration.ofSeconds(1));
        assertTrue(store.get("post:1").isEmpty());
    }

    @Test
    @DisplayName("覆盖写以新 TTL 为准，后写者胜")
    void testOverwriteUsesNewTtl() {
        store.set("post:1", bytes("old"), Duration.ofSeconds(5));
        ticker.advance(Duration.ofSeconds(4));
        store.set("post:1", bytes("new"), Duration.ofSeconds(5));
        ticker.advance(Duration.ofSeconds(4));

        assertArrayEquals(bytes("new"), store.get("post:1").orElseThrow());
    }

    @Test
    @DisplayName("非正 TTL 不写入")
    void testNonPositiveTtlIsNoop() {
        store.set("post:1", bytes("v"), Duration.ZERO);
        store.set("post:2", bytes("v"), Duration.ofSeconds(-1));

        assertTrue(store.get("post:1").isEmpty());
        assertTrue(store.get("post:2").isEmpty());
    }

    @Test
    @DisplayName("前缀失效只删除匹配的 Key")
    void testInvalidatePrefix() {
        store.set("feed:page:first:20", bytes("a"), Duration.ofSeconds(60));
        store.set("feed:page:first:10", bytes("b"), Duration.ofSeconds(60));
        store.set("feed:user:7:first:20", bytes("c"), Duration.ofSeconds(60));
        store.set("post:1", bytes("d"), Duration.ofSeconds(60));

        store.invalidatePrefix("feed:page:");

        assertTrue(store.get("feed:page:first:20").isEmpty());
        assertTrue(store.get("feed:page:first:10").isEmpty());
        assertTrue(store.get("feed:user:7:first:20").isPresent());
        assertTrue(store.get("post:1").isPresent());
    }

    @Test
    @DisplayName("单 Key 失效")
    void testInvalidate() {
        store.set("post:1", bytes("a"), Duration.ofSeconds(60));
        store.set("post:10", bytes("b"), Duration.ofSeconds(60));

        store.invalidate("post:1");

        assertTrue(store.get("post:1").isEmpty());
        assertTrue(store.get("post:10").isPresent());
    }

    @Test
    @DisplayName("并发读写同一 Key 只会看到完整的某个写入值")
    void testConcurrentWritersNeverTear() throws Exception {
        List<byte[]> candidates = List.of(bytes("aaaaaaaa"), bytes("bbbbbbbb"), bytes("cccccccc"));
        ExecutorService executor = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 3; t++) {
                byte[] value = candidates.get(t);
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2000; i++) {
                        store.set("post:1", value, Duration.ofSeconds(60));
                    }
                    return null;
                }));
            }
            for (int t = 0; t < 3; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2000; i++) {
                        store.get("post:1").ifPresent(v ->
                            assertTrue(candidates.stream().anyMatch(c -> Arrays.equals(c, v))));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
