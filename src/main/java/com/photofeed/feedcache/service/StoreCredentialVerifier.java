package com.photofeed.feedcache.service;

import com.photofeed.feedcache.dto.UserIdentity;
import com.photofeed.feedcache.repository.IdentityRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 按账号名读取未封禁用户，再比较口令摘要
 */
@Component
@RequiredArgsConstructor
public class StoreCredentialVerifier implements CredentialVerifier {

    private final IdentityRepository identityRepository;
    private final CredentialDigest credentialDigest;

    @Override
    public Optional<UserIdentity> verify(String accountName, String password) {
        return identityRepository.findActiveUserByAccountName(accountName)
            .filter(user -> credentialDigest.matches(accountName, password, user.getPasshash()))
            .map(UserIdentity::from);
    }
}
