package com.phantom.gateway.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache Key Derivation
 *
 * <p>Derives the {@link TokenCache} key for an opaque credential as the
 * lowercase hex SHA-256 digest of its UTF-8 bytes. The raw credential is
 * never used as a key.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * Derive the cache key for an opaque credential
     *
     * @param opaqueToken credential as presented by the client, may be empty
     * @return 64 lowercase hex characters
     */
    public static String derive(String opaqueToken) {
        byte[] digest = sha256().digest(opaqueToken.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    /**
     * Short, log-safe prefix of a cache key
     */
    public static String abbreviate(String cacheKey) {
        return cacheKey.length() <= 8 ? cacheKey : cacheKey.substring(0, 8);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
