package com.example.readrouting.routing.hash;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * MD5 digests of session keys. Used for placement only, not for anything security-related.
 */
final class SessionKeyHasher {

    private SessionKeyHasher() {
    }

    static byte[] md5(String key) {
        try {
            return MessageDigest.getInstance("MD5").digest(key.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }

    /**
     * The full 128-bit digest as a non-negative integer.
     */
    static BigInteger md5AsUnsigned(String key) {
        return new BigInteger(1, md5(key));
    }

    /**
     * The first 8 digest bytes, big-endian, as a ring coordinate.
     */
    static long md5Prefix64(String key) {
        byte[] digest = md5(key);
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (digest[i] & 0xFFL);
        }
        return value;
    }
}
