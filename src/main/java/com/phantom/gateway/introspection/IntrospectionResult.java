package com.phantom.gateway.introspection;

import java.time.Instant;

/**
 * Outcome of a successful introspection call. An absent result means the
 * identity provider answered but returned no token, i.e. the credential is
 * inactive or invalid.
 *
 * @param jwt       compact token, empty when absent
 * @param expiresAt token expiry, {@code null} when absent
 */
public record IntrospectionResult(String jwt, Instant expiresAt) {

    private static final IntrospectionResult ABSENT = new IntrospectionResult("", null);

    public static IntrospectionResult absent() {
        return ABSENT;
    }

    public static IntrospectionResult of(String jwt, Instant expiresAt) {
        return new IntrospectionResult(jwt, expiresAt);
    }

    public boolean isAbsent() {
        return jwt == null || jwt.isEmpty();
    }
}
