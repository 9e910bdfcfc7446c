package com.photofeed.feedcache.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 加盐 SHA-512：sha512(password + ":" + sha512(accountName))，十六进制小写
 */
@Component
public class Sha512CredentialDigest implements CredentialDigest {

    @Override
    public String digest(String accountName, String password) {
        return sha512Hex(password + ":" + sha512Hex(accountName));
    }

    @Override
    public boolean matches(String accountName, String password, String storedHash) {
        if (storedHash == null) {
            return false;
        }
        byte[] expected = storedHash.getBytes(StandardCharsets.US_ASCII);
        byte[] actual = digest(accountName, password).getBytes(StandardCharsets.US_ASCII);
        // 定长比较
        return MessageDigest.isEqual(expected, actual);
    }

    private static String sha512Hex(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }
}
