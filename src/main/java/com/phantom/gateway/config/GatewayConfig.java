package com.phantom.gateway.config;

import com.phantom.gateway.cache.TokenCache;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Gateway Configuration
 *
 * <p>Binds the {@code gateway.*} properties (introspection endpoint, client
 * credentials, cache bounds, public paths) and creates the introspection
 * WebClient and the token cache. Required settings are checked at startup so
 * a misconfigured gateway never accepts traffic.
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
public class GatewayConfig implements InitializingBean {

    private IntrospectionConfig introspection = new IntrospectionConfig();
    private CacheConfig cache = new CacheConfig();
    private List<String> publicPaths = new ArrayList<>();

    public static class IntrospectionConfig {
        private String url;
        private String clientId;
        private String clientSecret;
        private double timeoutSeconds = 2.5;

        /**
         * Per-call timeout, fractional seconds allowed
         */
        public Duration getTimeout() {
            return Duration.ofNanos((long) (timeoutSeconds * 1_000_000_000L));
        }

        // Getters and setters
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }
        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
        public double getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(double timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class CacheConfig {
        private int maxEntries = 10000;
        private long reclaimIntervalSeconds = 60;
        private long clockSkewSeconds = 30;

        // Getters and setters
        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
        public long getReclaimIntervalSeconds() { return reclaimIntervalSeconds; }
        public void setReclaimIntervalSeconds(long reclaimIntervalSeconds) { this.reclaimIntervalSeconds = reclaimIntervalSeconds; }
        public long getClockSkewSeconds() { return clockSkewSeconds; }
        public void setClockSkewSeconds(long clockSkewSeconds) { this.clockSkewSeconds = clockSkewSeconds; }
    }

    /**
     * Fail fast on missing or nonsensical settings
     */
    @Override
    public void afterPropertiesSet() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(introspection.getUrl())) {
            missing.add("gateway.introspection.url (INTROSPECTION_URL)");
        }
        if (!StringUtils.hasText(introspection.getClientId())) {
            missing.add("gateway.introspection.client-id (CLIENT_ID)");
        }
        if (!StringUtils.hasText(introspection.getClientSecret())) {
            missing.add("gateway.introspection.client-secret (CLIENT_SECRET)");
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required configuration: " + String.join(", ", missing));
        }
        if (introspection.getTimeoutSeconds() <= 0) {
            throw new IllegalStateException("gateway.introspection.timeout-seconds must be positive");
        }
        if (cache.getReclaimIntervalSeconds() <= 0) {
            throw new IllegalStateException("gateway.cache.reclaim-interval-seconds must be positive");
        }
        if (cache.getClockSkewSeconds() < 0) {
            throw new IllegalStateException("gateway.cache.clock-skew-seconds must not be negative");
        }
    }

    /**
     * WebClient for calling the introspection endpoint
     */
    @Bean
    public WebClient introspectionWebClient(WebClient.Builder builder) {
        return builder
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(256 * 1024)) // 256KB buffer for token responses
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Token cache with its background reclaimer; stopped on shutdown
     */
    @Bean(destroyMethod = "close")
    public TokenCache tokenCache(Clock clock) {
        TokenCache tokenCache = new TokenCache(clock,
            Duration.ofSeconds(cache.getClockSkewSeconds()), cache.getMaxEntries());
        tokenCache.startReclaimer(Duration.ofSeconds(cache.getReclaimIntervalSeconds()));
        return tokenCache;
    }

    // Getters and setters for @ConfigurationProperties
    public IntrospectionConfig getIntrospection() { return introspection; }
    public void setIntrospection(IntrospectionConfig introspection) { this.introspection = introspection; }
    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }
    public List<String> getPublicPaths() { return publicPaths; }
    public void setPublicPaths(List<String> publicPaths) {
        this.publicPaths = publicPaths != null ? publicPaths : new ArrayList<>();
    }
}
