package com.photofeed.feedcache.service;

/**
 * 口令摘要算法
 */
public interface CredentialDigest {

    String digest(String accountName, String password);

    boolean matches(String accountName, String password, String storedHash);
}
