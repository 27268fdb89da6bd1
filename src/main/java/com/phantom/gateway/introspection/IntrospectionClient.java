package com.phantom.gateway.introspection;

import com.phantom.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Introspection Client
 *
 * <p>Exchanges an opaque access token for its JWT representation by calling
 * the identity provider's introspection endpoint with
 * {@code Accept: application/jwt}. The client authenticates with HTTP Basic
 * and each call is bounded by the configured timeout. Calls are never retried.
 */
@Service
public class IntrospectionClient {

    private static final Logger log = LoggerFactory.getLogger(IntrospectionClient.class);

    public static final MediaType APPLICATION_JWT = new MediaType("application", "jwt");

    /** Validity assumed for a token whose expiry cannot be read */
    static final Duration FALLBACK_VALIDITY = Duration.ofSeconds(30);

    /** Maximum number of body characters quoted in a status error */
    static final int ERROR_BODY_EXCERPT = 512;

    private final WebClient webClient;
    private final GatewayConfig.IntrospectionConfig introspection;
    private final Clock clock;
    private final ExpiryExtractor expiryExtractor = new ExpiryExtractor();

    public IntrospectionClient(
            @Qualifier("introspectionWebClient") WebClient webClient,
            GatewayConfig gatewayConfig,
            Clock clock) {
        this.webClient = webClient;
        this.introspection = gatewayConfig.getIntrospection();
        this.clock = clock;
    }

    /**
     * Introspect an opaque token
     *
     * @param opaqueToken credential presented by the client
     * @return the JWT and its expiry, or {@link IntrospectionResult#absent()} if the
     *         endpoint returned no token
     * @throws IntrospectionException (as error signal) on transport failure, timeout
     *         or non-200 status
     */
    public Mono<IntrospectionResult> introspect(String opaqueToken) {
        Duration timeout = introspection.getTimeout();
        return webClient.post()
            .uri(introspection.getUrl())
            .accept(APPLICATION_JWT)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .headers(headers -> headers.setBasicAuth(introspection.getClientId(), introspection.getClientSecret()))
            .body(BodyInserters.fromFormData("token", opaqueToken))
            .exchangeToMono(this::handleResponse)
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, error ->
                IntrospectionException.transport("introspection timed out after " + timeout.toMillis() + "ms", error))
            .onErrorMap(WebClientRequestException.class, error ->
                IntrospectionException.transport(String.valueOf(error.getMessage()), error));
    }

    private Mono<IntrospectionResult> handleResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (status != 200) {
            return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.<IntrospectionResult>error(IntrospectionException.status(status, excerpt(body))));
        }
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> toResult(body.trim()));
    }

    private IntrospectionResult toResult(String body) {
        if (!ExpiryExtractor.isCompactToken(body)) {
            log.debug("Introspection returned no token, body length={}", body.length());
            return IntrospectionResult.absent();
        }
        try {
            return IntrospectionResult.of(body, expiryExtractor.extract(body));
        } catch (ExpiryExtractionException e) {
            Instant fallback = clock.instant().plus(FALLBACK_VALIDITY);
            log.warn("Could not read token expiry ({}: {}), assuming {}s validity",
                e.getReason(), e.getMessage(), FALLBACK_VALIDITY.toSeconds());
            return IntrospectionResult.of(body, fallback);
        }
    }

    private static String excerpt(String body) {
        String trimmed = body.trim();
        return trimmed.length() <= ERROR_BODY_EXCERPT ? trimmed : trimmed.substring(0, ERROR_BODY_EXCERPT);
    }
}
