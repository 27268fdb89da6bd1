package com.phantom.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Phantom Token Gateway Application
 * 
 * <p>API Gateway service using Spring Cloud Gateway.
 * Exchanges the opaque access tokens presented by clients for JWTs via the
 * identity provider's introspection endpoint, caches them, and forwards
 * only the JWT to backend services.
 */
@SpringBootApplication
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
