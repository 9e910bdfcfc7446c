package com.photofeed.feedcache.service;

import com.photofeed.feedcache.config.PhotoFeedProperties;
import com.photofeed.feedcache.dto.ImageBlob;
import com.photofeed.feedcache.repository.ContentRepository;
import com.photofeed.feedcache.support.CacheFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 图片缓存单元测试
 */
@ExtendWith(MockitoExtension.class)
class BlobCacheTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00, 0x42};

    @Mock
    private ContentRepository contentRepository;

    private CacheFixtures fixtures;
    private PhotoFeedProperties properties;
    private BlobCache blobCache;

    @BeforeEach
    void setUp() {
        fixtures = new CacheFixtures();
        properties = new PhotoFeedProperties();
        blobCache = new BlobCache(contentRepository, fixtures.template, properties);
    }

    @Test
    @DisplayName("图片 42：3600 秒内只回源一次，之后再回源一次")
    void testImageFetchedOncePerTtl() {
        when(contentRepository.findImage(42L))
            .thenReturn(Optional.of(ImageBlob.builder().mime("image/jpeg").data(JPEG).build()));

        ImageBlob first = blobCache.getImage(42L).orElseThrow();
        fixtures.ticker.advance(Duration.ofSeconds(3599));
        ImageBlob second = blobCache.getImage(42L).orElseThrow();

        assertEquals("image/jpeg", second.getMime());
        assertArrayEquals(first.getData(), second.getData());
        verify(contentRepository, times(1)).findImage(42L);

        fixtures.ticker.advance(Duration.ofSeconds(2));
        blobCache.getImage(42L);
        verify(contentRepository, times(2)).findImage(42L);
    }

    @Test
    @DisplayName("扩展名与 MIME 不一致时返回空")
    void testExtensionMismatch() {
        when(contentRepository.findImage(42L))
            .thenReturn(Optional.of(ImageBlob.builder().mime("image/jpeg").data(JPEG).build()));

        assertTrue(blobCache.getImage(42L, "jpg").isPresent());
        assertTrue(blobCache.getImage(42L, "png").isEmpty());
        assertTrue(blobCache.getImage(42L, "bmp").isEmpty());
        verify(contentRepository, times(1)).findImage(42L);
    }

    @Test
    @DisplayName("不存在的图片写短 TTL 标记，过期后重新回源")
    void testMissingImageMarker() {
        when(contentRepository.findImage(7L)).thenReturn(Optional.empty());

        assertTrue(blobCache.getImage(7L).isEmpty());
        assertTrue(blobCache.getImage(7L).isEmpty());
        verify(contentRepository, times(1)).findImage(7L);

        fixtures.ticker.advance(Duration.ofSeconds(5));
        assertTrue(blobCache.getImage(7L).isEmpty());
        verify(contentRepository, times(2)).findImage(7L);
    }

    @Test
    @DisplayName("标记 TTL 为 0 时不做负缓存")
    void testNegativeCachingDisabled() {
        properties.getTtl().setImageMissing(Duration.ZERO);
        when(contentRepository.findImage(7L)).thenReturn(Optional.empty());

        blobCache.getImage(7L);
        blobCache.getImage(7L);

        verify(contentRepository, times(2)).findImage(7L);
    }

    @Test
    @DisplayName("缓存载荷编解码保留 MIME 与字节")
    void testFraming() {
        ImageBlob blob = ImageBlob.builder().mime("image/gif").data(new byte[]{1, 2, 3}).build();

        ImageBlob decoded = BlobCache.decode(BlobCache.encode(blob)).orElseThrow();

        assertEquals("image/gif", decoded.getMime());
        assertArrayEquals(new byte[]{1, 2, 3}, decoded.getData());
        assertTrue(BlobCache.decode(new byte[]{0}).isEmpty());
    }
}
