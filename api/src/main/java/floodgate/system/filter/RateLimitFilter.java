package floodgate.system.filter;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import floodgate.adapter.in.problem.RateLimitProblem;
import floodgate.core.config.GatewayConfig;
import floodgate.core.config.RateLimitingConfig;
import floodgate.core.model.ratelimit.RateLimitDecision;
import floodgate.core.model.ratelimit.RequestContext;
import floodgate.core.port.in.RateLimitUseCase;
import floodgate.core.service.ratelimit.EndpointPatternMatcher;

/**
 * Reactive filter that enforces rate limits on protected paths.
 *
 * <p>The request filter checks every applicable rule before the resource runs
 * and aborts with 429 on denial. The response filter adds the
 * {@code X-RateLimit-*} headers and gives back the concurrency slots the
 * admission took, whatever the outcome of the request.
 *
 * <p>Client identification priority:
 * <ol>
 * <li>{@code X-API-Key} header (hashed)</li>
 * <li>{@code X-User-ID} header</li>
 * <li>Client IP from Forwarded or X-Forwarded-For or remote address</li>
 * </ol>
 */
public class RateLimitFilter {

    private static final Logger LOG = Logger.getLogger(RateLimitFilter.class);

    static final String DECISION_ATTR = "floodgate.ratelimit.decision";
    static final String IDENTIFIER_ATTR = "floodgate.ratelimit.identifier";
    static final String API_PROVIDER_HEADER = "X-Api-Provider";

    private final RateLimitUseCase rateLimiter;
    private final RateLimitingConfig config;
    private final GatewayConfig gatewayConfig;
    private final EndpointPatternMatcher pathMatcher;
    private final ClientIdentifierResolver identifierResolver;

    @Inject
    public RateLimitFilter(
            RateLimitUseCase rateLimiter,
            RateLimitingConfig config,
            GatewayConfig gatewayConfig,
            EndpointPatternMatcher pathMatcher,
            ClientIdentifierResolver identifierResolver) {
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.gatewayConfig = gatewayConfig;
        this.pathMatcher = pathMatcher;
        this.identifierResolver = identifierResolver;
    }

    /**
     * @return Uni with null to continue, or a 429 response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 50)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        if (!gatewayConfig.enabled() || !config.enabled()) {
            return Uni.createFrom().nullItem();
        }

        final var path = requestContext.getUriInfo().getPath();
        if (!isProtected(path)) {
            return Uni.createFrom().nullItem();
        }

        final var remoteAddress = request.remoteAddress() != null ? request.remoteAddress().host() : null;
        final var identity = identifierResolver.resolve(requestContext::getHeaderString, remoteAddress);
        final var context = RequestContext.of(
                identity.identifier(), identity.ruleType(), path, requestContext.getHeaderString(API_PROVIDER_HEADER));

        return rateLimiter.checkRateLimit(context).map(decision -> {
            requestContext.setProperty(DECISION_ATTR, decision);
            requestContext.setProperty(IDENTIFIER_ATTR, identity.identifier());
            if (!decision.allowed()) {
                LOG.debugv("Rejected {0} {1} for {2}: rule {3}",
                        requestContext.getMethod(), path, identity.identifier(), decision.ruleName().orElse("?"));
                return buildRateLimitResponse(decision);
            }
            return null;
        });
    }

    /**
     * Adds rate limit headers and releases held concurrency slots.
     */
    @ServerResponseFilter
    public Uni<Void> afterResponse(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        final var decision = (RateLimitDecision) requestContext.getProperty(DECISION_ATTR);
        if (decision == null) {
            return Uni.createFrom().voidItem();
        }

        if (config.includeHeaders() && decision.allowed() && !decision.isUnbounded()) {
            final var headers = responseContext.getHeaders();
            decision.limitApplied().ifPresent(limit -> headers.putSingle("X-RateLimit-Limit", limit));
            headers.putSingle("X-RateLimit-Remaining", decision.remaining());
            headers.putSingle("X-RateLimit-Reset", decision.resetTime());
        }

        if (decision.heldSlots().isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        final var identifier = (String) requestContext.getProperty(IDENTIFIER_ATTR);
        return releaseSlots(identifier, decision.heldSlots());
    }

    private Uni<Void> releaseSlots(String identifier, List<String> slots) {
        final var releases = slots.stream()
                .map(slot -> rateLimiter
                        .releaseConcurrentSlot(identifier, slot)
                        .onFailure()
                        .recoverWithUni(e -> {
                            LOG.warnv("Failed to release slot {0} of {1}, it will expire: {2}",
                                    slot, identifier, e.getMessage());
                            return Uni.createFrom().voidItem();
                        }))
                .toList();
        return Uni.join().all(releases).andCollectFailures().replaceWithVoid();
    }

    private boolean isProtected(String path) {
        for (final var pattern : gatewayConfig.protectedPaths()) {
            if (pathMatcher.matches(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    private Response buildRateLimitResponse(RateLimitDecision decision) {
        final var retryAfter = decision.retryAfter().orElse(1L);
        final var limit = decision.limitApplied().orElse(0L);
        final var detail = "Rate limit exceeded. Retry after %d seconds.".formatted(retryAfter);

        final var builder = Response.status(Response.Status.TOO_MANY_REQUESTS)
                .type("application/problem+json")
                .header("Retry-After", retryAfter)
                .entity(RateLimitProblem.tooManyRequests(
                        detail, retryAfter, limit, decision.resetTime(), decision.ruleName().orElse(null)));
        if (config.includeHeaders()) {
            builder.header("X-RateLimit-Limit", limit)
                    .header("X-RateLimit-Remaining", 0)
                    .header("X-RateLimit-Reset", decision.resetTime());
        }
        return builder.build();
    }
}
