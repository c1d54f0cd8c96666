package floodgate.core.model.ratelimit;

import java.util.Locale;
import java.util.Optional;

/**
 * Inputs of a rate limit check.
 *
 * @param identifier  the client identifier, e.g. {@code user:42} or {@code ip:10.0.0.1}
 * @param ruleType    selects the identity scope: {@code user}, {@code api_key} or any other value for none
 * @param endpoint    the request path, when known
 * @param apiProvider the external provider the request targets, when known
 */
public record RequestContext(
        String identifier, String ruleType, Optional<String> endpoint, Optional<String> apiProvider) {

    public RequestContext {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be null or blank");
        }
        ruleType = ruleType == null ? "" : ruleType.trim().toLowerCase(Locale.ROOT);
        endpoint = endpoint != null ? endpoint.filter(s -> !s.isBlank()) : Optional.empty();
        apiProvider = apiProvider != null ? apiProvider.filter(s -> !s.isBlank()) : Optional.empty();
    }

    public static RequestContext of(String identifier, String ruleType) {
        return new RequestContext(identifier, ruleType, Optional.empty(), Optional.empty());
    }

    public static RequestContext of(String identifier, String ruleType, String endpoint, String apiProvider) {
        return new RequestContext(
                identifier, ruleType, Optional.ofNullable(endpoint), Optional.ofNullable(apiProvider));
    }
}
