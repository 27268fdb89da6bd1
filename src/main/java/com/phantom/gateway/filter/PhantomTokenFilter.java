package com.phantom.gateway.filter;

import com.phantom.gateway.config.GatewayConfig;
import com.phantom.gateway.hook.HookObject;
import com.phantom.gateway.hook.HookRequest;
import com.phantom.gateway.hook.ReturnOverrides;
import com.phantom.gateway.service.HookName;
import com.phantom.gateway.service.PhantomTokenDispatcher;
import com.phantom.gateway.util.PublicPathMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Phantom Token Filter
 *
 * <p>Global filter that runs both phantom token hooks for every request
 * (except public paths): the opaque bearer token is exchanged for a JWT and
 * the upstream request carries only the JWT. Rejections are answered
 * directly with the 401 produced by the dispatcher.
 */
@Component
public class PhantomTokenFilter implements GlobalFilter, Ordered {

    private static final Logger log = LoggerFactory.getLogger(PhantomTokenFilter.class);

    /** Exchange attribute holding the JWT for downstream filters */
    public static final String PHANTOM_JWT_ATTRIBUTE = PhantomTokenDispatcher.METADATA_JWT;

    private final PhantomTokenDispatcher dispatcher;
    private final PublicPathMatcher publicPathMatcher;

    public PhantomTokenFilter(PhantomTokenDispatcher dispatcher, GatewayConfig gatewayConfig) {
        this.dispatcher = dispatcher;
        this.publicPathMatcher = new PublicPathMatcher(gatewayConfig.getPublicPaths());
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getURI().getPath();

        // 1. Public paths skip the exchange
        if (publicPathMatcher.isPublicPath(path)) {
            log.debug("Public path, skipping token exchange: {}", path);
            return chain.filter(exchange);
        }

        // 2. Auth check: opaque token -> JWT
        HookObject hookObject = toHookObject(request);
        return dispatcher.dispatch(hookObject)
            .flatMap(checked -> {
                if (checked.isShortCircuited()) {
                    return reject(exchange, checked, path);
                }

                // 3. Post-auth: JWT onto the upstream Authorization header
                checked.setHookName(HookName.INJECT_JWT_POST_KEY_AUTH.wireName());
                return dispatcher.dispatch(checked).flatMap(injected -> {
                    if (injected.isShortCircuited()) {
                        return reject(exchange, injected, path);
                    }
                    ServerHttpRequest upstreamRequest = request.mutate()
                        .headers(headers -> injected.getRequest().getSetHeaders().forEach(headers::set))
                        .build();
                    exchange.getAttributes().put(PHANTOM_JWT_ATTRIBUTE,
                        injected.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));

                    log.debug("Token exchanged, forwarding with JWT: path={}", path);
                    return chain.filter(exchange.mutate().request(upstreamRequest).build());
                });
            });
    }

    private HookObject toHookObject(ServerHttpRequest request) {
        HookRequest hookRequest = new HookRequest();
        request.getHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) {
                hookRequest.getHeaders().put(name, values.get(0));
            }
        });
        return new HookObject(HookName.PHANTOM_AUTH_CHECK.wireName(), hookRequest);
    }

    /**
     * Answer the client with the dispatcher's override
     */
    private Mono<Void> reject(ServerWebExchange exchange, HookObject hookObject, String path) {
        ReturnOverrides overrides = hookObject.getRequest().getReturnOverrides();
        log.warn("Request rejected: path={}, status={}, reason={}",
            path, overrides.getResponseCode(), overrides.getResponseError());

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatusCode.valueOf(overrides.getResponseCode()));
        overrides.getHeaders().forEach(response.getHeaders()::set);
        response.getHeaders().setContentType(MediaType.TEXT_PLAIN);

        String body = overrides.getResponseBody() != null ? overrides.getResponseBody() : "";
        byte[] bodyBytes = body.getBytes(StandardCharsets.UTF_8);
        return response.writeWith(
            Mono.just(response.bufferFactory().wrap(bodyBytes))
        );
    }

    @Override
    public int getOrder() {
        // High precedence - run before other filters
        return -100;
    }
}
