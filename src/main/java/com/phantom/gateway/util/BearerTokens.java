package com.phantom.gateway.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code Authorization: Bearer <token>} header values.
 */
public final class BearerTokens {

    private static final Pattern BEARER = Pattern.compile("^\\s*Bearer\\s+(.+)\\s*$", Pattern.CASE_INSENSITIVE);

    private BearerTokens() {
    }

    /**
     * Extract the bearer credential from an Authorization header value
     *
     * @return the trimmed credential, or an empty string if the header is
     *         missing or not a bearer header
     */
    public static String extract(String authorization) {
        if (authorization == null || authorization.isEmpty()) {
            return "";
        }
        Matcher matcher = BEARER.matcher(authorization);
        if (!matcher.matches()) {
            return "";
        }
        return matcher.group(1).trim();
    }
}
