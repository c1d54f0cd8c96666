package floodgate.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import floodgate.core.config.GatewayConfig;
import floodgate.core.config.RateLimitingConfig;
import floodgate.core.model.ratelimit.RateLimitDecision;
import floodgate.core.model.ratelimit.RequestContext;
import floodgate.core.port.in.RateLimitUseCase;
import floodgate.core.service.ratelimit.EndpointPatternMatcher;

@DisplayName("RateLimitFilter")
class RateLimitFilterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private RateLimitUseCase rateLimiter;
    private RateLimitingConfig config;
    private GatewayConfig gatewayConfig;
    private RateLimitFilter filter;

    private ContainerRequestContext requestContext;
    private HttpServerRequest request;
    private Map<String, String> headers;
    private Map<String, Object> properties;

    @BeforeEach
    void setUp() {
        rateLimiter = mock(RateLimitUseCase.class);
        config = mock(RateLimitingConfig.class);
        gatewayConfig = mock(GatewayConfig.class);
        when(config.enabled()).thenReturn(true);
        when(config.includeHeaders()).thenReturn(true);
        when(gatewayConfig.enabled()).thenReturn(true);
        when(gatewayConfig.protectedPaths()).thenReturn(List.of("/api/**"));

        filter = new RateLimitFilter(
                rateLimiter, config, gatewayConfig, new EndpointPatternMatcher(), new ClientIdentifierResolver(true));

        headers = new HashMap<>();
        properties = new HashMap<>();
        requestContext = mock(ContainerRequestContext.class);
        var uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/orders");
        when(requestContext.getUriInfo()).thenReturn(uriInfo);
        when(requestContext.getMethod()).thenReturn("GET");
        when(requestContext.getHeaderString(anyString())).thenAnswer(inv -> headers.get(inv.getArgument(0)));
        when(requestContext.getProperty(anyString())).thenAnswer(inv -> properties.get(inv.getArgument(0)));
        doAnswer(inv -> properties.put(inv.getArgument(0), inv.getArgument(1)))
                .when(requestContext)
                .setProperty(anyString(), any());

        request = mock(HttpServerRequest.class);
        var address = mock(SocketAddress.class);
        when(address.host()).thenReturn("10.0.0.9");
        when(request.remoteAddress()).thenReturn(address);
    }

    private static RateLimitDecision allowed(long remaining, List<String> slots) {
        return new RateLimitDecision(
                true, remaining, 1_700_000_060L, Optional.empty(), Optional.of(100L), Optional.of(60L),
                Optional.of("rpm"), slots);
    }

    private static RateLimitDecision denied() {
        return new RateLimitDecision(
                false, 0, 1_700_000_030L, Optional.of(30L), Optional.of(100L), Optional.of(60L),
                Optional.of("rpm"), List.of());
    }

    @Nested
    @DisplayName("Request filter")
    class RequestFilterTests {

        @Test
        @DisplayName("should continue when allowed")
        void shouldContinueWhenAllowed() {
            headers.put("X-User-ID", "42");
            headers.put("X-Api-Provider", "openai");
            when(rateLimiter.checkRateLimit(any())).thenReturn(Uni.createFrom().item(allowed(99, List.of())));

            var response = filter.filter(requestContext, request).await().atMost(TIMEOUT);

            assertNull(response);
            var captor = ArgumentCaptor.forClass(RequestContext.class);
            verify(rateLimiter).checkRateLimit(captor.capture());
            assertEquals("user:42", captor.getValue().identifier());
            assertEquals("user", captor.getValue().ruleType());
            assertEquals(Optional.of("/api/orders"), captor.getValue().endpoint());
            assertEquals(Optional.of("openai"), captor.getValue().apiProvider());
        }

        @Test
        @DisplayName("should reject with 429 and retry headers when denied")
        void shouldRejectWhenDenied() {
            when(rateLimiter.checkRateLimit(any())).thenReturn(Uni.createFrom().item(denied()));

            var response = filter.filter(requestContext, request).await().atMost(TIMEOUT);

            assertEquals(429, response.getStatus());
            assertEquals(30L, response.getHeaders().getFirst("Retry-After"));
            assertEquals(100L, response.getHeaders().getFirst("X-RateLimit-Limit"));
            assertEquals(0, response.getHeaders().getFirst("X-RateLimit-Remaining"));
        }

        @Test
        @DisplayName("should identify anonymous clients by address")
        void shouldIdentifyAnonymousClientsByAddress() {
            when(rateLimiter.checkRateLimit(any())).thenReturn(Uni.createFrom().item(allowed(5, List.of())));

            filter.filter(requestContext, request).await().atMost(TIMEOUT);

            var captor = ArgumentCaptor.forClass(RequestContext.class);
            verify(rateLimiter).checkRateLimit(captor.capture());
            assertEquals("ip:10.0.0.9", captor.getValue().identifier());
        }

        @Test
        @DisplayName("should skip unprotected paths and disabled gateways")
        void shouldSkipUnprotectedPaths() {
            when(requestContext.getUriInfo().getPath()).thenReturn("/admin/policies");
            assertNull(filter.filter(requestContext, request).await().atMost(TIMEOUT));

            when(requestContext.getUriInfo().getPath()).thenReturn("/api/orders");
            when(gatewayConfig.enabled()).thenReturn(false);
            assertNull(filter.filter(requestContext, request).await().atMost(TIMEOUT));

            verify(rateLimiter, never()).checkRateLimit(any());
        }
    }

    @Nested
    @DisplayName("Response filter")
    class ResponseFilterTests {

        private ContainerResponseContext responseContext;
        private MultivaluedHashMap<String, Object> responseHeaders;

        @BeforeEach
        void setUpResponse() {
            responseContext = mock(ContainerResponseContext.class);
            responseHeaders = new MultivaluedHashMap<>();
            when(responseContext.getHeaders()).thenReturn(responseHeaders);
            when(rateLimiter.releaseConcurrentSlot(anyString(), anyString())).thenReturn(Uni.createFrom().voidItem());
        }

        @Test
        @DisplayName("should add rate limit headers")
        void shouldAddHeaders() {
            properties.put(RateLimitFilter.DECISION_ATTR, allowed(99, List.of()));
            properties.put(RateLimitFilter.IDENTIFIER_ATTR, "user:42");

            filter.afterResponse(requestContext, responseContext).await().atMost(TIMEOUT);

            assertEquals(100L, responseHeaders.getFirst("X-RateLimit-Limit"));
            assertEquals(99L, responseHeaders.getFirst("X-RateLimit-Remaining"));
            assertEquals(1_700_000_060L, responseHeaders.getFirst("X-RateLimit-Reset"));
        }

        @Test
        @DisplayName("should release every held slot")
        void shouldReleaseHeldSlots() {
            properties.put(RateLimitFilter.DECISION_ATTR, allowed(2, List.of("user/conc", "global/conc")));
            properties.put(RateLimitFilter.IDENTIFIER_ATTR, "user:42");

            filter.afterResponse(requestContext, responseContext).await().atMost(TIMEOUT);

            verify(rateLimiter).releaseConcurrentSlot("user:42", "user/conc");
            verify(rateLimiter).releaseConcurrentSlot("user:42", "global/conc");
        }

        @Test
        @DisplayName("should swallow release failures so the response still completes")
        void shouldTolerateReleaseFailures() {
            when(rateLimiter.releaseConcurrentSlot(anyString(), anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("store down")));
            properties.put(RateLimitFilter.DECISION_ATTR, allowed(2, List.of("user/conc")));
            properties.put(RateLimitFilter.IDENTIFIER_ATTR, "user:42");

            filter.afterResponse(requestContext, responseContext).await().atMost(TIMEOUT);

            verify(rateLimiter).releaseConcurrentSlot("user:42", "user/conc");
        }

        @Test
        @DisplayName("should do nothing for requests that were not checked")
        void shouldDoNothingWithoutDecision() {
            filter.afterResponse(requestContext, responseContext).await().atMost(TIMEOUT);

            assertEquals(0, responseHeaders.size());
            verify(rateLimiter, never()).releaseConcurrentSlot(anyString(), anyString());
        }
    }
}
