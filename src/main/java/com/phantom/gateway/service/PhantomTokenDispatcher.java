package com.phantom.gateway.service;

import com.phantom.gateway.cache.CacheKeys;
import com.phantom.gateway.cache.TokenCache;
import com.phantom.gateway.hook.HookObject;
import com.phantom.gateway.hook.HookRequest;
import com.phantom.gateway.hook.ReturnOverrides;
import com.phantom.gateway.hook.SessionState;
import com.phantom.gateway.introspection.IntrospectionClient;
import com.phantom.gateway.introspection.IntrospectionException;
import com.phantom.gateway.util.BearerTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Optional;

/**
 * Phantom Token Dispatcher
 *
 * <p>Runs the two phantom token hooks against a per-request {@link HookObject}:
 * <ol>
 *   <li>{@link HookName#PHANTOM_AUTH_CHECK}: resolve the opaque bearer token to a
 *       JWT, from the cache or by introspection, and record it in the metadata</li>
 *   <li>{@link HookName#INJECT_JWT_POST_KEY_AUTH}: replace the upstream
 *       Authorization header with the JWT</li>
 * </ol>
 *
 * <p>The returned {@code Mono} never errors: every failure becomes a 401
 * override on the hook object.
 */
@Service
public class PhantomTokenDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PhantomTokenDispatcher.class);

    public static final String METADATA_JWT = "phantom_jwt";
    public static final String METADATA_TOKEN = "token";

    static final String MISSING_BEARER = "Missing bearer token";
    static final String TOKEN_INACTIVE = "Token inactive or invalid";
    static final String JWT_MISSING_POST_AUTH = "JWT missing post-auth";
    static final String INVALID_TOKEN_CHALLENGE = "Bearer error=\"invalid_token\"";

    private final TokenCache tokenCache;
    private final IntrospectionClient introspectionClient;

    public PhantomTokenDispatcher(TokenCache tokenCache, IntrospectionClient introspectionClient) {
        this.tokenCache = tokenCache;
        this.introspectionClient = introspectionClient;
    }

    /**
     * Dispatch a hook invocation
     *
     * @param object per-request hook object, modified in place
     * @return the same object, accepted or carrying a 401 override
     */
    public Mono<HookObject> dispatch(HookObject object) {
        switch (HookName.from(object.getHookName())) {
            case PHANTOM_AUTH_CHECK:
                return phantomAuthCheck(object);
            case INJECT_JWT_POST_KEY_AUTH:
                return Mono.just(injectJwtPostKeyAuth(object));
            default:
                return Mono.just(object);
        }
    }

    private Mono<HookObject> phantomAuthCheck(HookObject object) {
        HookRequest request = ensureRequest(object);
        String opaqueToken = BearerTokens.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (opaqueToken.isEmpty()) {
            log.warn("Rejecting request: missing or malformed bearer token");
            return Mono.just(unauthorized(object, MISSING_BEARER));
        }

        String key = CacheKeys.derive(opaqueToken);
        Optional<String> cached = tokenCache.get(key);
        if (cached.isPresent()) {
            log.debug("Token cache hit: key={}", CacheKeys.abbreviate(key));
            return Mono.just(accept(object, opaqueToken, cached.get()));
        }

        log.debug("Token cache miss, introspecting: key={}", CacheKeys.abbreviate(key));
        return introspectionClient.introspect(opaqueToken)
            .map(result -> {
                if (result.isAbsent()) {
                    log.warn("Introspection returned no token: key={}", CacheKeys.abbreviate(key));
                    return unauthorized(object, TOKEN_INACTIVE);
                }
                tokenCache.set(key, result.jwt(), result.expiresAt());
                return accept(object, opaqueToken, result.jwt());
            })
            .onErrorResume(IntrospectionException.class, error -> {
                log.warn("Introspection failed: key={}, kind={}, error={}",
                    CacheKeys.abbreviate(key), error.getKind(), error.getMessage());
                return Mono.just(unauthorized(object, "Introspection error: " + error.getMessage()));
            })
            .onErrorResume(error -> {
                log.error("Unexpected error during token exchange: key={}", CacheKeys.abbreviate(key), error);
                return Mono.just(unauthorized(object, "Introspection error: " + error.getMessage()));
            });
    }

    private HookObject injectJwtPostKeyAuth(HookObject object) {
        String jwt = object.getMetadata() != null ? object.getMetadata().get(METADATA_JWT) : null;
        if (jwt == null || jwt.isEmpty()) {
            // phase 1 accepts only after setting the JWT
            log.error("No JWT in metadata after auth check, rejecting request");
            return unauthorized(object, JWT_MISSING_POST_AUTH);
        }
        ensureRequest(object).getSetHeaders().put(HttpHeaders.AUTHORIZATION, "Bearer " + jwt);
        return object;
    }

    private HookObject accept(HookObject object, String opaqueToken, String jwt) {
        if (object.getMetadata() == null) {
            object.setMetadata(new HashMap<>());
        }
        object.getMetadata().put(METADATA_JWT, jwt);
        object.getMetadata().put(METADATA_TOKEN, opaqueToken);
        if (object.getSession() == null) {
            object.setSession(new SessionState());
        }
        object.getSession().resetToUnlimited();
        return object;
    }

    private HookObject unauthorized(HookObject object, String message) {
        HookRequest request = ensureRequest(object);
        ReturnOverrides overrides = request.getReturnOverrides();
        if (overrides == null) {
            overrides = new ReturnOverrides();
            request.setReturnOverrides(overrides);
        }
        overrides.setResponseCode(HttpStatus.UNAUTHORIZED.value());
        overrides.setResponseError(message);
        overrides.setResponseBody(message);
        overrides.getHeaders().put(HttpHeaders.WWW_AUTHENTICATE, INVALID_TOKEN_CHALLENGE);
        overrides.setOverrideError(true);
        return object;
    }

    private static HookRequest ensureRequest(HookObject object) {
        if (object.getRequest() == null) {
            object.setRequest(new HookRequest());
        }
        return object.getRequest();
    }
}
