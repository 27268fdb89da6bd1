package com.phantom.gateway.util;

import org.springframework.util.AntPathMatcher;

import java.util.List;

/**
 * Matches request paths against the configured public path patterns
 * (Ant style, e.g. {@code /actuator/**}). Public paths bypass the token
 * exchange.
 */
public class PublicPathMatcher {

    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final List<String> patterns;

    public PublicPathMatcher(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public boolean isPublicPath(String path) {
        if (path == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (pathMatcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }
}
