package com.photofeed.feedcache.exception;

/**
 * 读路径加速层异常基类
 */
public class PhotoFeedException extends RuntimeException {

    public PhotoFeedException(String message) {
        super(message);
    }

    public PhotoFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
