package com.phantom.gateway;

import com.phantom.gateway.cache.TokenCache;
import com.phantom.gateway.config.GatewayConfig;
import com.phantom.gateway.filter.PhantomTokenFilter;
import com.phantom.gateway.service.PhantomTokenDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the Gateway application.
 *
 * <p>These tests verify that the Spring application context loads correctly
 * and that configuration is bound from properties.</p>
 */
@SpringBootTest(properties = {
    "gateway.introspection.url=http://localhost:1/introspect",
    "gateway.introspection.client-id=gateway-client",
    "gateway.introspection.client-secret=s3cret",
    "gateway.introspection.timeout-seconds=1.5",
    "gateway.cache.max-entries=500",
    "gateway.public-paths[0]=/actuator/**"
})
class GatewayApplicationTests {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private GatewayConfig gatewayConfig;

    @Autowired
    private TokenCache tokenCache;

    @Test
    @DisplayName("Should load application context with the phantom token beans")
    void contextLoads() {
        assertNotNull(applicationContext.getBean(PhantomTokenDispatcher.class));
        assertNotNull(applicationContext.getBean(PhantomTokenFilter.class));
        assertEquals(0, tokenCache.size());
    }

    @Test
    @DisplayName("Should bind gateway properties")
    void testPropertiesBound() {
        assertEquals("http://localhost:1/introspect", gatewayConfig.getIntrospection().getUrl());
        assertEquals(1.5, gatewayConfig.getIntrospection().getTimeoutSeconds());
        assertEquals(500, gatewayConfig.getCache().getMaxEntries());
        assertEquals(30, gatewayConfig.getCache().getClockSkewSeconds());
        assertEquals(1, gatewayConfig.getPublicPaths().size());
    }
}
