package com.phantom.gateway.service;

import com.phantom.gateway.cache.CacheKeys;
import com.phantom.gateway.cache.TokenCache;
import com.phantom.gateway.config.GatewayConfig;
import com.phantom.gateway.hook.HookObject;
import com.phantom.gateway.hook.HookRequest;
import com.phantom.gateway.hook.ReturnOverrides;
import com.phantom.gateway.hook.SessionState;
import com.phantom.gateway.introspection.IntrospectionClient;
import com.phantom.gateway.support.MutableClock;
import com.phantom.gateway.support.StubIntrospectionEndpoint;
import com.phantom.gateway.support.TestTokens;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PhantomTokenDispatcher.
 *
 * <p>Runs both hooks against a real TokenCache and IntrospectionClient, with
 * the introspection endpoint stubbed at the WebClient level.</p>
 */
class PhantomTokenDispatcherTest {

    private static final String CHALLENGE = "Bearer error=\"invalid_token\"";

    private MutableClock clock;
    private TokenCache tokenCache;
    private GatewayConfig gatewayConfig;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000L);
        tokenCache = new TokenCache(clock, Duration.ofSeconds(30), 10000);
        gatewayConfig = new GatewayConfig();
        gatewayConfig.getIntrospection().setUrl("https://idsvr.example.com/oauth/v2/introspect");
        gatewayConfig.getIntrospection().setClientId("gateway-client");
        gatewayConfig.getIntrospection().setClientSecret("s3cret");
    }

    @AfterEach
    void tearDown() {
        tokenCache.close();
    }

    private PhantomTokenDispatcher dispatcherFor(StubIntrospectionEndpoint endpoint) {
        return new PhantomTokenDispatcher(tokenCache,
            new IntrospectionClient(endpoint.webClient(), gatewayConfig, clock));
    }

    private static HookObject authCheck(String authorization) {
        HookRequest request = new HookRequest();
        if (authorization != null) {
            request.getHeaders().put("Authorization", authorization);
        }
        return new HookObject(HookName.PHANTOM_AUTH_CHECK.wireName(), request);
    }

    private static void assertUnauthorized(HookObject object, String message) {
        assertTrue(object.isShortCircuited(), "Request should be short-circuited");
        ReturnOverrides overrides = object.getRequest().getReturnOverrides();
        assertEquals(401, overrides.getResponseCode());
        assertEquals(message, overrides.getResponseBody());
        assertEquals(message, overrides.getResponseError());
        assertEquals(CHALLENGE, overrides.getHeaders().get("WWW-Authenticate"));
        assertTrue(overrides.isOverrideError());
    }

    @Nested
    @DisplayName("PhantomAuthCheck")
    class AuthCheck {

        @Test
        @DisplayName("Should exchange the opaque token and inject the JWT end to end")
        void testEndToEndAccept() {
            String jwt = TestTokens.jwtExpiringAt(clock.instant().plusSeconds(120));
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt(jwt);
            PhantomTokenDispatcher dispatcher = dispatcherFor(endpoint);

            HookObject object = dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();

            assertNotNull(object);
            assertFalse(object.isShortCircuited());
            assertEquals(jwt, object.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));
            assertEquals("OPAQUE1", object.getMetadata().get(PhantomTokenDispatcher.METADATA_TOKEN));

            object.setHookName(HookName.INJECT_JWT_POST_KEY_AUTH.wireName());
            HookObject injected = dispatcher.dispatch(object).block();

            assertNotNull(injected);
            assertFalse(injected.isShortCircuited());
            assertEquals("Bearer " + jwt, injected.getRequest().getSetHeaders().get("Authorization"));
        }

        @Test
        @DisplayName("Should reset session rate and quota to unlimited")
        void testSessionReset() {
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt(
                TestTokens.jwtExpiringAt(clock.instant().plusSeconds(120)));
            HookObject request = authCheck("Bearer OPAQUE1");
            SessionState session = new SessionState();
            session.setRate(100);
            session.setPer(60);
            session.setQuotaMax(1000);
            session.setQuotaRemaining(5);
            session.setQuotaRenewalRate(3600);
            session.setLastUpdated("1699999999");
            request.setSession(session);

            HookObject object = dispatcherFor(endpoint).dispatch(request).block();

            SessionState reset = object.getSession();
            assertEquals(0, reset.getRate());
            assertEquals(0, reset.getPer());
            assertEquals(-1, reset.getQuotaMax());
            assertEquals(-1, reset.getQuotaRemaining());
            assertEquals(0, reset.getQuotaRenewalRate());
            assertEquals("", reset.getLastUpdated());
            assertEquals(0, reset.getIdExtractorDeadline());
        }

        @Test
        @DisplayName("Should create a session when none is attached")
        void testSessionCreated() {
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt(
                TestTokens.jwtExpiringAt(clock.instant().plusSeconds(120)));

            HookObject object = dispatcherFor(endpoint).dispatch(authCheck("Bearer OPAQUE1")).block();

            assertNotNull(object.getSession());
            assertEquals(SessionState.UNLIMITED, object.getSession().getQuotaMax());
        }

        @Test
        @DisplayName("Should introspect only once for a repeated credential")
        void testCacheReuse() {
            String jwt = TestTokens.jwtExpiringAt(clock.instant().plusSeconds(300));
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt(jwt);
            PhantomTokenDispatcher dispatcher = dispatcherFor(endpoint);

            HookObject first = dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();
            clock.advance(Duration.ofSeconds(60));
            HookObject second = dispatcher.dispatch(authCheck("bearer  OPAQUE1 ")).block();

            assertEquals(1, endpoint.callCount(), "Second request should be served from cache");
            assertEquals(jwt, first.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));
            assertEquals(jwt, second.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));
            assertEquals("OPAQUE1", second.getMetadata().get(PhantomTokenDispatcher.METADATA_TOKEN));
        }

        @Test
        @DisplayName("Should introspect again once the cached JWT is within the skew margin")
        void testCacheExpiry() {
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt(
                TestTokens.jwtExpiringAt(clock.instant().plusSeconds(120)));
            PhantomTokenDispatcher dispatcher = dispatcherFor(endpoint);

            dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();
            clock.advance(Duration.ofSeconds(91));
            endpoint.respondWith(HttpStatus.OK, TestTokens.jwtExpiringAt(clock.instant().plusSeconds(120)));
            dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();

            assertEquals(2, endpoint.callCount());
        }

        @Test
        @DisplayName("Should cache the JWT under the derived key")
        void testCachedUnderDerivedKey() {
            String jwt = TestTokens.jwtExpiringAt(clock.instant().plusSeconds(120));
            dispatcherFor(StubIntrospectionEndpoint.returningJwt(jwt)).dispatch(authCheck("Bearer OPAQUE1")).block();

            assertEquals(Optional.of(jwt), tokenCache.get(CacheKeys.derive("OPAQUE1")));
        }

        @Test
        @DisplayName("Should accept but not cache a token with unreadable expiry")
        void testFallbackNotCached() {
            String token = TestTokens.withPayload("{\"sub\":\"alice\"}");
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt(token);
            PhantomTokenDispatcher dispatcher = dispatcherFor(endpoint);

            HookObject object = dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();

            assertFalse(object.isShortCircuited());
            assertEquals(token, object.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));
            assertEquals(0, tokenCache.size(), "Fallback validity does not outlast the skew margin");
        }

        @Test
        @DisplayName("Should accept a token whose exp is out of range or not finite")
        void testOutOfRangeExpAccepted() {
            for (String payload : new String[] {"{\"exp\": 100000000000000000}", "{\"exp\": 1e400}"}) {
                String token = TestTokens.withPayload(payload);
                HookObject object = dispatcherFor(StubIntrospectionEndpoint.returningJwt(token))
                    .dispatch(authCheck("Bearer OPAQUE1")).block();

                assertFalse(object.isShortCircuited(), "Expiry fallback should apply for " + payload);
                assertEquals(token, object.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));
            }
            assertEquals(0, tokenCache.size());
        }

        @Test
        @DisplayName("Should reject a missing Authorization header")
        void testMissingHeader() {
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt("unused");

            HookObject object = dispatcherFor(endpoint).dispatch(authCheck(null)).block();

            assertUnauthorized(object, "Missing bearer token");
            assertEquals(0, endpoint.callCount());
        }

        @Test
        @DisplayName("Should reject a non-bearer Authorization header")
        void testBasicHeader() {
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt("unused");

            HookObject object = dispatcherFor(endpoint).dispatch(authCheck("Basic dXNlcjpwYXNz")).block();

            assertUnauthorized(object, "Missing bearer token");
            assertTrue(object.getMetadata().isEmpty());
        }

        @Test
        @DisplayName("Should reject an inactive token")
        void testInactiveToken() {
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.respondingWith(HttpStatus.OK, "");

            HookObject object = dispatcherFor(endpoint).dispatch(authCheck("Bearer OPAQUE1")).block();

            assertUnauthorized(object, "Token inactive or invalid");
            assertNull(object.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));
            assertEquals(0, tokenCache.size());
        }

        @Test
        @DisplayName("Should reject with the introspection error embedded")
        void testIntrospectionError() {
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.respondingWith(
                HttpStatus.SERVICE_UNAVAILABLE, "maintenance");

            HookObject object = dispatcherFor(endpoint).dispatch(authCheck("Bearer OPAQUE1")).block();

            assertUnauthorized(object, "Introspection error: introspection status 503: maintenance");
        }

        @Test
        @DisplayName("Should reject without error when introspection times out")
        void testIntrospectionTimeout() {
            gatewayConfig.getIntrospection().setTimeoutSeconds(0.05);
            StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.neverResponding();

            HookObject object = dispatcherFor(endpoint).dispatch(authCheck("Bearer OPAQUE1")).block();

            assertUnauthorized(object, "Introspection error: introspection timed out after 50ms");
        }
    }

    @Nested
    @DisplayName("Unexpected failures")
    @ExtendWith(MockitoExtension.class)
    class UnexpectedFailures {

        @Mock
        private IntrospectionClient introspectionClient;

        @Test
        @DisplayName("Should turn any error into a 401 override")
        void testUnexpectedError() {
            when(introspectionClient.introspect(anyString()))
                .thenReturn(Mono.error(new IllegalStateException("boom")));
            PhantomTokenDispatcher dispatcher = new PhantomTokenDispatcher(tokenCache, introspectionClient);

            HookObject object = dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();

            assertUnauthorized(object, "Introspection error: boom");
        }

        @Test
        @DisplayName("Should not introspect on a cache hit")
        void testCacheHitSkipsIntrospection() {
            tokenCache.set(CacheKeys.derive("OPAQUE1"), "cached.jwt.value", clock.instant().plusSeconds(600));
            PhantomTokenDispatcher dispatcher = new PhantomTokenDispatcher(tokenCache, introspectionClient);

            HookObject object = dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();

            assertEquals("cached.jwt.value", object.getMetadata().get(PhantomTokenDispatcher.METADATA_JWT));
            verifyNoInteractions(introspectionClient);
        }
    }

    @Nested
    @DisplayName("InjectJwtPostKeyAuth")
    class Inject {

        private final PhantomTokenDispatcher dispatcher =
            new PhantomTokenDispatcher(new TokenCache(MutableClock.startingAt(0), Duration.ZERO, 0),
                mock(IntrospectionClient.class));

        @Test
        @DisplayName("Should replace an existing Authorization header")
        void testReplacesHeader() {
            HookObject object = new HookObject(HookName.INJECT_JWT_POST_KEY_AUTH.wireName(), new HookRequest());
            object.getRequest().getSetHeaders().put("authorization", "Bearer OPAQUE1");
            object.getMetadata().put(PhantomTokenDispatcher.METADATA_JWT, "a.b.c");

            HookObject injected = dispatcher.dispatch(object).block();

            assertEquals(1, injected.getRequest().getSetHeaders().size());
            assertEquals("Bearer a.b.c", injected.getRequest().getSetHeaders().get("Authorization"));
        }

        @Test
        @DisplayName("Should reject when no JWT was recorded")
        void testMissingJwt() {
            HookObject object = new HookObject(HookName.INJECT_JWT_POST_KEY_AUTH.wireName(), new HookRequest());

            assertUnauthorized(dispatcher.dispatch(object).block(), "JWT missing post-auth");
        }

        @Test
        @DisplayName("Should reject when the recorded JWT is empty")
        void testEmptyJwt() {
            HookObject object = new HookObject(HookName.INJECT_JWT_POST_KEY_AUTH.wireName(), new HookRequest());
            object.getMetadata().put(PhantomTokenDispatcher.METADATA_JWT, "");

            assertUnauthorized(dispatcher.dispatch(object).block(), "JWT missing post-auth");
        }

        @Test
        @DisplayName("Should reject when metadata is missing altogether")
        void testNullMetadata() {
            HookObject object = new HookObject(HookName.INJECT_JWT_POST_KEY_AUTH.wireName(), new HookRequest());
            object.setMetadata(null);

            assertUnauthorized(dispatcher.dispatch(object).block(), "JWT missing post-auth");
        }
    }

    @Test
    @DisplayName("Should pass unrecognized hooks through unchanged")
    void testPassThrough() {
        StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt("unused");
        HookObject object = authCheck("Bearer OPAQUE1");
        object.setHookName("MyCustomPreHook");

        HookObject result = dispatcherFor(endpoint).dispatch(object).block();

        assertSame(object, result);
        assertFalse(result.isShortCircuited());
        assertTrue(result.getMetadata().isEmpty());
        assertNull(result.getSession());
        assertEquals(0, endpoint.callCount());
    }

    @Test
    @DisplayName("Should resolve hook names exactly")
    void testHookNames() {
        assertEquals(HookName.PHANTOM_AUTH_CHECK, HookName.from("PhantomAuthCheck"));
        assertEquals(HookName.INJECT_JWT_POST_KEY_AUTH, HookName.from("InjectJwtPostKeyAuth"));
        assertEquals(HookName.UNRECOGNIZED, HookName.from("phantomauthcheck"));
        assertEquals(HookName.UNRECOGNIZED, HookName.from(null));
    }

    @Test
    @DisplayName("Should not expose the JWT of one credential to another")
    void testCredentialsIsolated() {
        Instant expiry = clock.instant().plusSeconds(300);
        StubIntrospectionEndpoint endpoint = StubIntrospectionEndpoint.returningJwt(TestTokens.jwtExpiringAt(expiry));
        PhantomTokenDispatcher dispatcher = dispatcherFor(endpoint);

        dispatcher.dispatch(authCheck("Bearer OPAQUE1")).block();
        dispatcher.dispatch(authCheck("Bearer OPAQUE2")).block();

        assertEquals(2, endpoint.callCount());
        assertEquals(2, tokenCache.size());
    }
}
