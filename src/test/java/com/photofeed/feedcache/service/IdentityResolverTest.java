package com.photofeed.feedcache.service;

import com.photofeed.feedcache.config.PhotoFeedProperties;
import com.photofeed.feedcache.dto.UserIdentity;
import com.photofeed.feedcache.entity.UserRecord;
import com.photofeed.feedcache.exception.StoreUnavailableException;
import com.photofeed.feedcache.exception.UnauthenticatedException;
import com.photofeed.feedcache.repository.IdentityRepository;
import com.photofeed.feedcache.support.CacheFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 身份解析单元测试
 */
@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private IdentityRepository identityRepository;

    @Mock
    private CredentialVerifier credentialVerifier;

    private CacheFixtures fixtures;
    private IdentityResolver identityResolver;

    private final UserRecord alice = UserRecord.builder()
        .id(7L).accountName("alice").authority(0).active(true).passhash("x").build();

    @BeforeEach
    void setUp() {
        fixtures = new CacheFixtures();
        identityResolver = new IdentityResolver(fixtures.template, identityRepository, credentialVerifier,
            new PhotoFeedProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("会话命中缓存后 TTL 内不再查库")
    void testResolveCachesIdentity() {
        when(identityRepository.findUserBySessionToken("token-1", NOW)).thenReturn(Optional.of(alice));

        UserIdentity first = identityResolver.resolve("token-1").orElseThrow();
        fixtures.ticker.advance(Duration.ofSeconds(59));
        UserIdentity second = identityResolver.resolve("token-1").orElseThrow();

        assertEquals(first, second);
        assertEquals("alice", second.getAccountName());
        verify(identityRepository, times(1)).findUserBySessionToken(anyString(), any());
    }

    @Test
    @DisplayName("会话缓存 60 秒后过期并回源")
    void testResolveExpires() {
        when(identityRepository.findUserBySessionToken("token-1", NOW)).thenReturn(Optional.of(alice));

        identityResolver.resolve("token-1");
        fixtures.ticker.advance(Duration.ofSeconds(60));
        identityResolver.resolve("token-1");

        verify(identityRepository, times(2)).findUserBySessionToken(anyString(), any());
    }

    @Test
    @DisplayName("未知会话不缓存：连续两次都查库")
    void testNegativeSessionNeverCached() {
        when(identityRepository.findUserBySessionToken("unknown", NOW)).thenReturn(Optional.empty());

        assertTrue(identityResolver.resolve("unknown").isEmpty());
        assertTrue(identityResolver.resolve("unknown").isEmpty());

        verify(identityRepository, times(2)).findUserBySessionToken("unknown", NOW);
    }

    @Test
    @DisplayName("空令牌直接返回空，不访问存储")
    void testBlankToken() {
        assertTrue(identityResolver.resolve(null).isEmpty());
        assertTrue(identityResolver.resolve("  ").isEmpty());
        verifyNoInteractions(identityRepository);
    }

    @Test
    @DisplayName("requireIdentity 在会话无效时抛出 UnauthenticatedException")
    void testRequireIdentity() {
        when(identityRepository.findUserBySessionToken("bad", NOW)).thenReturn(Optional.empty());

        assertThrows(UnauthenticatedException.class, () -> identityResolver.requireIdentity("bad"));
    }

    @Test
    @DisplayName("存储不可用时异常向上抛出")
    void testStoreUnavailablePropagates() {
        when(identityRepository.findUserBySessionToken("token-1", NOW))
            .thenThrow(new StoreUnavailableException("down", null));

        assertThrows(StoreUnavailableException.class, () -> identityResolver.resolve("token-1"));
    }

    @Test
    @DisplayName("登录成功结果缓存 300 秒")
    void testLoginCached() {
        UserIdentity identity = UserIdentity.from(alice);
        when(credentialVerifier.verify("alice", "secret")).thenReturn(Optional.of(identity));

        assertEquals(identity, identityResolver.login("alice", "secret"));
        fixtures.ticker.advance(Duration.ofSeconds(299));
        assertEquals(identity, identityResolver.login("alice", "secret"));
        fixtures.ticker.advance(Duration.ofSeconds(1));
        assertEquals(identity, identityResolver.login("alice", "secret"));

        verify(credentialVerifier, times(2)).verify("alice", "secret");
    }

    @Test
    @DisplayName("登录被拒绝不缓存")
    void testLoginRejectedNeverCached() {
        when(credentialVerifier.verify(eq("alice"), anyString())).thenReturn(Optional.empty());

        assertThrows(UnauthenticatedException.class, () -> identityResolver.login("alice", "wrong"));
        assertThrows(UnauthenticatedException.class, () -> identityResolver.login("alice", "wrong"));

        verify(credentialVerifier, times(2)).verify("alice", "wrong");
    }

    @Test
    @DisplayName("不同口令使用不同的登录缓存 Key")
    void testLoginKeyIncludesPassword() {
        UserIdentity identity = UserIdentity.from(alice);
        when(credentialVerifier.verify("alice", "secret")).thenReturn(Optional.of(identity));
        when(credentialVerifier.verify("alice", "other")).thenReturn(Optional.empty());

        identityResolver.login("alice", "secret");

        assertThrows(UnauthenticatedException.class, () -> identityResolver.login("alice", "other"));
    }
}
