package floodgate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import floodgate.core.model.policy.DuplicatePolicyException;
import floodgate.core.model.policy.InvalidImportDataException;
import floodgate.core.model.policy.PolicyNotFoundException;
import floodgate.core.model.ratelimit.RuleConfigurationException;
import floodgate.core.model.ratelimit.StoreUnavailableException;

/**
 * Global exception mappers for converting rate limiter exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapRuleConfigurationException(RuleConfigurationException e) {
        LOG.debugv("Rule configuration error: {0}", e.getMessage());
        return toResponse(RateLimitProblem.invalidRule(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapDuplicatePolicyException(DuplicatePolicyException e) {
        LOG.debugv("Duplicate policy: {0}", e.policyName());
        return toResponse(RateLimitProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapPolicyNotFoundException(PolicyNotFoundException e) {
        return toResponse(RateLimitProblem.resourceNotFound("Policy", e.policyName()));
    }

    @ServerExceptionMapper
    public Response mapInvalidImportDataException(InvalidImportDataException e) {
        LOG.debugv("Rejected policy import: {0}", e.getMessage());
        return toResponse(RateLimitProblem.invalidImport(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapStoreUnavailableException(StoreUnavailableException e) {
        LOG.warnv("Counter store unavailable: {0}", e.getMessage());
        return toResponse(RateLimitProblem.storeUnavailable("Rate limit counters are unavailable"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(RateLimitProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
