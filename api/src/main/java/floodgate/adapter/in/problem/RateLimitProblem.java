package floodgate.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 problems returned by the admission filter and the admin endpoints.
 */
public final class RateLimitProblem {

    private RateLimitProblem() {}

    public static HttpProblem resourceNotFound(String resourceType, String resourceId) {
        return problem(Status.NOT_FOUND, resourceType + " Not Found", resourceType + " not found: " + resourceId);
    }

    public static HttpProblem badRequest(String detail) {
        return problem(Status.BAD_REQUEST, "Bad Request", detail);
    }

    public static HttpProblem invalidRule(String detail) {
        return problem(Status.BAD_REQUEST, "Invalid Rule Configuration", detail);
    }

    public static HttpProblem invalidImport(String detail) {
        return problem(Status.BAD_REQUEST, "Invalid Import Data", detail);
    }

    public static HttpProblem conflict(String detail) {
        return problem(Status.CONFLICT, "Conflict", detail);
    }

    public static HttpProblem storeUnavailable(String detail) {
        return problem(Status.SERVICE_UNAVAILABLE, "Service Unavailable", detail);
    }

    /**
     * Denial of an admission check. Carries the same numbers as the
     * {@code Retry-After} and {@code X-RateLimit-*} headers so clients that only
     * read the body can back off correctly.
     *
     * @param retryAfterSeconds seconds until the client may retry
     * @param limit             limit of the denying rule, 0 when unknown
     * @param resetAt           epoch seconds when the denying window resets
     * @param rule              the denying rule, may be null
     */
    public static HttpProblem tooManyRequests(
            String detail, long retryAfterSeconds, long limit, long resetAt, String rule) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail(detail)
                .with("retryAfter", retryAfterSeconds)
                .with("limit", limit)
                .with("remaining", 0)
                .with("resetAt", resetAt)
                .with("rule", rule)
                .build();
    }

    private static HttpProblem problem(Status status, String title, String detail) {
        return HttpProblem.builder()
                .withTitle(title)
                .withStatus(status)
                .withDetail(detail)
                .build();
    }
}
