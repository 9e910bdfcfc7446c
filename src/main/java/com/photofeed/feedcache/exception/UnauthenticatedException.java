package com.photofeed.feedcache.exception;

/**
 * 会话无效或凭据被拒绝
 */
public class UnauthenticatedException extends PhotoFeedException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
