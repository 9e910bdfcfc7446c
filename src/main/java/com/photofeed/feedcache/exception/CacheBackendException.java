package com.photofeed.feedcache.exception;

/**
 * 缓存后端操作失败，由 FailOpenCacheStore 吸收为未命中
 */
public class CacheBackendException extends PhotoFeedException {

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
