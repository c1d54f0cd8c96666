package floodgate.adapter.in.rest;

import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import floodgate.adapter.in.dto.RateLimitCheckRequest;
import floodgate.adapter.in.dto.RateLimitDecisionResponse;
import floodgate.adapter.in.dto.SlotReleaseRequest;
import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RequestContext;
import floodgate.core.model.ratelimit.RuleStatus;
import floodgate.core.port.in.RateLimitUseCase;

/**
 * REST resource exposing the rate limiter as a decision service.
 *
 * <p>Callers that enforce limits themselves ask for a decision per request
 * and release any held concurrency slots when the request completes.
 */
@Path("/ratelimit")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RateLimitResource {

    private final RateLimitUseCase rateLimiter;

    @Inject
    public RateLimitResource(RateLimitUseCase rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    /**
     * Decide whether a request may proceed. Consumes quota when allowed.
     *
     * @param request the check request
     * @return the decision; a denial is still a 200 response
     */
    @POST
    @Path("/check")
    public Uni<RateLimitDecisionResponse> check(
            @NotNull(message = "request body is required") @Valid RateLimitCheckRequest request) {
        return rateLimiter.checkRateLimit(request.toContext()).map(RateLimitDecisionResponse::fromModel);
    }

    /**
     * Release a concurrency slot acquired by an earlier check.
     *
     * @return 204 No Content
     */
    @POST
    @Path("/release")
    public Uni<Response> release(@NotNull(message = "request body is required") @Valid SlotReleaseRequest request) {
        return rateLimiter
                .releaseConcurrentSlot(request.identifier(), request.rule())
                .map(ignored -> Response.noContent().build());
    }

    /**
     * Report usage of every rule applying to an identifier without consuming quota.
     */
    @GET
    @Path("/status")
    public Uni<Map<String, RuleStatus>> status(
            @QueryParam("identifier") @NotBlank(message = "identifier is required") String identifier,
            @QueryParam("ruleType") String ruleType,
            @QueryParam("endpoint") String endpoint,
            @QueryParam("provider") String provider) {
        final var type = ruleType == null || ruleType.isBlank() ? RateLimitScope.USER_KEY : ruleType;
        return rateLimiter.getRateLimitStatus(RequestContext.of(identifier, type, endpoint, provider));
    }

    /**
     * Clear the counters of an identifier.
     *
     * @param identifier the client identifier
     * @param rule       optional rule name; every counter of the identifier when absent
     * @return the number of cleared counters
     */
    @DELETE
    @Path("/{identifier}")
    public Uni<Map<String, Object>> reset(@PathParam("identifier") String identifier, @QueryParam("rule") String rule) {
        final var ruleName = Optional.ofNullable(rule).filter(r -> !r.isBlank());
        return rateLimiter
                .resetRateLimit(identifier, ruleName)
                .map(count -> Map.<String, Object>of("identifier", identifier, "reset", count));
    }
}
