package com.photofeed.feedcache.service;

import com.photofeed.feedcache.cachestore.CacheTemplate;
import com.photofeed.feedcache.config.PhotoFeedProperties;
import com.photofeed.feedcache.constant.CacheKeys;
import com.photofeed.feedcache.dto.ImageBlob;
import com.photofeed.feedcache.repository.ContentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * 图片缓存
 * 图片写入后不再变化，命中后在 TTL 内不回源；回源只投影 mime 与图片字节。
 * 不存在的图片写一个短 TTL 的标记。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlobCache {

    /** 扩展名 → MIME */
    static final Map<String, String> MIME_BY_EXTENSION = Map.of(
        "jpg", "image/jpeg",
        "png", "image/png",
        "gif", "image/gif");

    private final ContentRepository contentRepository;
    private final CacheTemplate cacheTemplate;
    private final PhotoFeedProperties properties;

    public Optional<ImageBlob> getImage(long imageId) {
        String key = CacheKeys.image(imageId);
        Optional<ImageBlob> cached = cacheTemplate.getBytes(CacheKeys.CLASS_IMAGE, key).flatMap(BlobCache::decode);
        if (cached.isPresent()) {
            return cached;
        }

        Duration missingTtl = properties.getTtl().getImageMissing();
        boolean negativeCaching = !missingTtl.isZero() && !missingTtl.isNegative();
        if (negativeCaching && cacheTemplate.hasMarker(CacheKeys.imageMissing(imageId))) {
            return Optional.empty();
        }

        Optional<ImageBlob> blob = contentRepository.findImage(imageId);
        if (blob.isPresent()) {
            cacheTemplate.putBytes(key, encode(blob.get()), properties.getTtl().getImage());
        } else if (negativeCaching) {
            log.debug("Image not found, caching marker: id={}", imageId);
            cacheTemplate.putMarker(CacheKeys.imageMissing(imageId), missingTtl);
        }
        return blob;
    }

    /**
     * 按请求路径的扩展名取图，扩展名与存储的 MIME 不一致时为空
     */
    public Optional<ImageBlob> getImage(long imageId, String extension) {
        String expectedMime = extension == null ? null : MIME_BY_EXTENSION.get(extension.toLowerCase());
        if (expectedMime == null) {
            return Optional.empty();
        }
        return getImage(imageId).filter(blob -> expectedMime.equals(blob.getMime()));
    }

    /**
     * [mime 长度: 2 字节][mime][图片字节]
     */
    static byte[] encode(ImageBlob blob) {
        byte[] mime = blob.getMime() == null ? new byte[0] : blob.getMime().getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(2 + mime.length + blob.getData().length)
            .putShort((short) mime.length)
            .put(mime)
            .put(blob.getData())
            .array();
    }

    static Optional<ImageBlob> decode(byte[] payload) {
        if (payload.length < 2) {
            log.warn("Corrupt image cache entry, length={}", payload.length);
            return Optional.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        int mimeLength = Short.toUnsignedInt(buffer.getShort());
        if (mimeLength > buffer.remaining()) {
            log.warn("Corrupt image cache entry, mimeLength={}, length={}", mimeLength, payload.length);
            return Optional.empty();
        }
        byte[] mime = new byte[mimeLength];
        buffer.get(mime);
        byte[] data = new byte[buffer.remaining()];
        buffer.get(data);
        return Optional.of(ImageBlob.builder()
            .mime(mimeLength == 0 ? null : new String(mime, StandardCharsets.UTF_8))
            .data(data)
            .build());
    }
}
