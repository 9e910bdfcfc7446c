package com.photofeed.feedcache.repository;

import com.photofeed.feedcache.entity.UserRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * 身份相关存储访问
 */
public interface IdentityRepository {

    /**
     * 会话令牌 → 未封禁的用户；同一连接上先查会话再查用户
     */
    Optional<UserRecord> findUserBySessionToken(String token, Instant now);

    /**
     * 按账号名查找未封禁用户（含口令摘要）
     */
    Optional<UserRecord> findActiveUserByAccountName(String accountName);
}
