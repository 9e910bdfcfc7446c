package com.photofeed.feedcache.exception;

/**
 * 关系库不可用：连接获取重试耗尽，或读写过程中出现瞬时故障
 */
public class StoreUnavailableException extends PhotoFeedException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
