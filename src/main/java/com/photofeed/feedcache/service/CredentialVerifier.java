package com.photofeed.feedcache.service;

import com.photofeed.feedcache.dto.UserIdentity;

import java.util.Optional;

/**
 * 凭据校验，拒绝时返回空
 */
public interface CredentialVerifier {

    Optional<UserIdentity> verify(String accountName, String password);
}
