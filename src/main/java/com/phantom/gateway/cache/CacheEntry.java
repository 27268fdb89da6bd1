package com.phantom.gateway.cache;

import java.time.Instant;

/**
 * Cached JWT with its effective expiry (token expiry minus clock skew).
 */
record CacheEntry(String jwt, Instant expiresAt) {

    boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }
}
