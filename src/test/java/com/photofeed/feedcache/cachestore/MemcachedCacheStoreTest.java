package com.photofeed.feedcache.cachestore;

import com.photofeed.feedcache.exception.CacheBackendException;
import net.spy.memcached.MemcachedClient;
import net.spy.memcached.OperationTimeoutException;
import net.spy.memcached.internal.OperationFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Memcached 缓存后端单元测试
 */
@ExtendWith(MockitoExtension.class)
class MemcachedCacheStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private MemcachedClient client;

    @Mock
    private OperationFuture<Boolean> future;

    private MemcachedCacheStore store;

    @BeforeEach
    void setUp() {
        store = new MemcachedCacheStore(client, Duration.ofSeconds(1), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("读取使用命名空间代数拼出的物理 Key")
    void testGetUsesGenerationKey() {
        when(client.incr(eq("ns-gen:post"), eq(0L), anyLong(), eq(0))).thenReturn(5L);
        when(client.get("g5:post:1")).thenReturn(new byte[]{1, 2});

        assertArrayEquals(new byte[]{1, 2}, store.get("post:1").orElseThrow());
    }

    @Test
    @DisplayName("未命中返回空")
    void testGetMiss() {
        when(client.incr(eq("ns-gen:post"), eq(0L), anyLong(), eq(0))).thenReturn(5L);
        when(client.get("g5:post:1")).thenReturn(null);

        assertTrue(store.get("post:1").isEmpty());
    }

    @Test
    @DisplayName("前缀失效递增顶层命名空间代数")
    void testInvalidatePrefixBumpsNamespace() {
        when(client.incr(eq("ns-gen:feed"), eq(1L), anyLong(), eq(0))).thenReturn(6L);

        store.invalidatePrefix("feed:user:7:");

        verify(client).incr(eq("ns-gen:feed"), eq(1L), anyLong(), eq(0));
        verify(client, never()).flush();
    }

    @Test
    @DisplayName("跨命名空间的前缀整体清空")
    void testInvalidateEmptyPrefixFlushes() throws Exception {
        when(client.flush()).thenReturn(future);
        when(future.get(anyLong(), any(TimeUnit.class))).thenReturn(true);

        store.invalidatePrefix("");

        verify(client).flush();
    }

    @Test
    @DisplayName("写入等待确认，TTL 向上取整到秒")
    void testSetRoundsTtlUp() throws Exception {
        when(client.incr(eq("ns-gen:image"), eq(0L), anyLong(), eq(0))).thenReturn(1L);
        when(client.set("g1:image:42", 2, new byte[]{9})).thenReturn(future);
        when(future.get(anyLong(), any(TimeUnit.class))).thenReturn(true);

        store.set("image:42", new byte[]{9}, Duration.ofMillis(1500));

        verify(future).get(1000L, TimeUnit.MILLISECONDS);
    }

    @Test
    @DisplayName("超过 30 天的 TTL 转换为绝对时间")
    void testLongTtlBecomesAbsolute() {
        int expiration = store.expiration(Duration.ofDays(45));

        assertEquals(NOW.getEpochSecond() + Duration.ofDays(45).toSeconds(), expiration);
        assertEquals(1, store.expiration(Duration.ofMillis(1)));
    }

    @Test
    @DisplayName("后端超时包装为 CacheBackendException")
    void testTimeoutIsWrapped() throws Exception {
        when(client.incr(eq("ns-gen:post"), eq(0L), anyLong(), eq(0))).thenReturn(1L);
        when(client.get("g1:post:1")).thenThrow(new OperationTimeoutException("timeout"));
        assertThrows(CacheBackendException.class, () -> store.get("post:1"));

        when(client.delete("g1:post:1")).thenReturn(future);
        when(future.get(anyLong(), any(TimeUnit.class))).thenThrow(new TimeoutException());
        assertThrows(CacheBackendException.class, () -> store.invalidate("post:1"));
        verify(future).cancel(true);
    }
}
