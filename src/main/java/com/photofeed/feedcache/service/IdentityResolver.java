package com.photofeed.feedcache.service;

import com.photofeed.feedcache.cachestore.CacheTemplate;
import com.photofeed.feedcache.config.PhotoFeedProperties;
import com.photofeed.feedcache.constant.CacheKeys;
import com.photofeed.feedcache.dto.UserIdentity;
import com.photofeed.feedcache.exception.UnauthenticatedException;
import com.photofeed.feedcache.repository.IdentityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * 身份解析服务
 * 会话令牌 → 身份（短 TTL 缓存），账号口令 → 身份（较长 TTL 缓存）。
 * 只缓存成功结果，失败结果每次都回源。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    private final CacheTemplate cacheTemplate;
    private final IdentityRepository identityRepository;
    private final CredentialVerifier credentialVerifier;
    private final PhotoFeedProperties properties;
    private final Clock clock;

    /**
     * 解析会话令牌
     * @return 会话不存在、已过期或用户已封禁时为空
     */
    public Optional<UserIdentity> resolve(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            return Optional.empty();
        }

        String key = CacheKeys.session(sessionToken);
        Optional<UserIdentity> cached = cacheTemplate.get(CacheKeys.CLASS_SESSION, key, UserIdentity.class);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<UserIdentity> identity = identityRepository.findUserBySessionToken(sessionToken, clock.instant())
            .map(UserIdentity::from);
        identity.ifPresent(value -> cacheTemplate.put(key, value, properties.getTtl().getSession()));
        return identity;
    }

    public UserIdentity requireIdentity(String sessionToken) {
        return resolve(sessionToken)
            .orElseThrow(() -> new UnauthenticatedException("Session is missing or expired"));
    }

    /**
     * 账号口令登录
     * @throws UnauthenticatedException 凭据被拒绝
     */
    public UserIdentity login(String accountName, String password) {
        if (accountName == null || accountName.isBlank() || password == null || password.isEmpty()) {
            throw new UnauthenticatedException("Account name and password are required");
        }

        String key = CacheKeys.login(accountName, password);
        Optional<UserIdentity> cached = cacheTemplate.get(CacheKeys.CLASS_LOGIN, key, UserIdentity.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        UserIdentity identity = credentialVerifier.verify(accountName, password)
            .orElseThrow(() -> {
                log.info("Login rejected: account={}", accountName);
                return new UnauthenticatedException("Invalid account name or password");
            });
        cacheTemplate.put(key, identity, properties.getTtl().getLogin());
        return identity;
    }
}
