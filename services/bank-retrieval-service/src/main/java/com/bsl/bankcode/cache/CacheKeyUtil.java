package com.bsl.bankcode.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers shared by cache keys and record checksums.
 */
public final class CacheKeyUtil {
    private static final HexFormat HEX = HexFormat.of();

    private CacheKeyUtil() {
    }

    public static String sha256(String value) {
        if (value == null) {
            return null;
        }
        return hex(newDigest().digest(value.getBytes(StandardCharsets.UTF_8)));
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }
}
