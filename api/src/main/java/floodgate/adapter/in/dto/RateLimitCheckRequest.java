package floodgate.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;

import floodgate.core.model.ratelimit.RateLimitScope;
import floodgate.core.model.ratelimit.RequestContext;

/**
 * DTO for rate limit check and status requests.
 *
 * @param identifier  client identifier (user id, api key hash, ip)
 * @param ruleType    {@code user} or {@code api_key}, selects the matching scope (default {@code user})
 * @param endpoint    optional request endpoint, matched against endpoint scopes
 * @param apiProvider optional external provider name
 */
public record RateLimitCheckRequest(
        @NotBlank(message = "identifier is required") String identifier,
        String ruleType,
        String endpoint,
        String apiProvider) {

    public RequestContext toContext() {
        final var type = ruleType == null || ruleType.isBlank() ? RateLimitScope.USER_KEY : ruleType;
        return RequestContext.of(identifier, type, endpoint, apiProvider);
    }
}
