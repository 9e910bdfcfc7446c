package com.photofeed.feedcache.cachestore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photofeed.feedcache.exception.CacheBackendException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * 缓存载荷的 JSON 编解码
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheCodec {

    private final ObjectMapper objectMapper;

    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheBackendException("Cache payload encode failed: " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * 无法解析的载荷按未命中处理
     */
    public <T> Optional<T> decode(String key, byte[] payload, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(payload, type));
        } catch (IOException e) {
            log.warn("Cache payload decode failed, treating as miss: key={}, type={}", key, type.getSimpleName(), e);
            return Optional.empty();
        }
    }
}
