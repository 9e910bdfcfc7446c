package com.photofeed.feedcache.cachestore;

import com.photofeed.feedcache.dto.UserIdentity;
import com.photofeed.feedcache.support.CacheFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 缓存门面单元测试
 */
class CacheTemplateTest {

    private CacheFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new CacheFixtures();
    }

    @Test
    @DisplayName("对象写入后按类型读回，并记录命中/未命中")
    void testPutAndGet() {
        UserIdentity identity = UserIdentity.builder().id(1L).accountName("alice").authority(0).active(true).build();

        assertTrue(fixtures.template.get("session", "identity:session:x", UserIdentity.class).isEmpty());
        fixtures.template.put("identity:session:x", identity, Duration.ofSeconds(60));
        Optional<UserIdentity> cached = fixtures.template.get("session", "identity:session:x", UserIdentity.class);

        assertEquals(Optional.of(identity), cached);
        assertEquals(1.0, fixtures.requests("session", "hit"));
        assertEquals(1.0, fixtures.requests("session", "miss"));
    }

    @Test
    @DisplayName("无法解析的载荷按未命中处理")
    void testCorruptPayloadIsMiss() {
        fixtures.store.set("post:1", "not-json{".getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(60));

        assertTrue(fixtures.template.get("post", "post:1", UserIdentity.class).isEmpty());
    }

    @Test
    @DisplayName("标记条目只判断存在与否")
    void testMarker() {
        assertFalse(fixtures.template.hasMarker("image:missing:9"));
        fixtures.template.putMarker("image:missing:9", Duration.ofSeconds(5));
        assertTrue(fixtures.template.hasMarker("image:missing:9"));

        fixtures.ticker.advance(Duration.ofSeconds(5));
        assertFalse(fixtures.template.hasMarker("image:missing:9"));
    }
}
