package com.photofeed.feedcache;

import com.photofeed.feedcache.cachestore.CacheStore;
import com.photofeed.feedcache.cachestore.FailOpenCacheStore;
import com.photofeed.feedcache.health.FeedCacheHealthIndicator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Spring Boot 应用启动测试
 */
@SpringBootTest
@ActiveProfiles("test")
class PhotoFeedCacheApplicationTest {

    @Autowired
    private CacheStore cacheStore;

    @Autowired
    private FeedCacheHealthIndicator healthIndicator;

    @Test
    @DisplayName("应用上下文加载测试")
    void contextLoads() {
        assertInstanceOf(FailOpenCacheStore.class, cacheStore);
    }

    @Test
    @DisplayName("健康检查：存储与缓存均可用")
    void testHealth() {
        assertEquals(Status.UP, healthIndicator.health().getStatus());
        assertEquals("UP", healthIndicator.health().getDetails().get("cache"));
    }
}
