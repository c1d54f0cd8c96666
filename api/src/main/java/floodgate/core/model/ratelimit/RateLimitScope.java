package floodgate.core.model.ratelimit;

/**
 * Grouping of rules under a scope key.
 *
 * <p>{@link Global} always applies. The other scopes apply when the request
 * context matches them; see {@code RuleRegistry#resolveRules}.
 */
public sealed interface RateLimitScope {

    String GLOBAL_KEY = "global";
    String USER_KEY = "user";
    String API_KEY_KEY = "api_key";
    String ENDPOINT_PREFIX = "endpoint:";
    String PROVIDER_PREFIX = "provider:";
    String POLICY_PREFIX = "policy:";

    /**
     * Stable string form of this scope, used in counter keys, configuration and events.
     */
    String key();

    static RateLimitScope global() {
        return Global.INSTANCE;
    }

    static RateLimitScope user() {
        return User.INSTANCE;
    }

    static RateLimitScope apiKey() {
        return ApiKey.INSTANCE;
    }

    static RateLimitScope endpoint(String pattern) {
        return new Endpoint(pattern);
    }

    static RateLimitScope provider(String name) {
        return new Provider(name);
    }

    static RateLimitScope policy(String name) {
        return new Policy(name);
    }

    /**
     * Parse a scope key.
     *
     * @param key the key, e.g. {@code global} or {@code endpoint:/api/search/**}
     * @return the scope
     * @throws RuleConfigurationException if the key is not recognized
     */
    static RateLimitScope parse(String key) {
        if (key == null || key.isBlank()) {
            throw new RuleConfigurationException("Scope key is required");
        }
        final var trimmed = key.trim();
        if (trimmed.equals(GLOBAL_KEY)) {
            return global();
        }
        if (trimmed.equals(USER_KEY)) {
            return user();
        }
        if (trimmed.equals(API_KEY_KEY)) {
            return apiKey();
        }
        if (trimmed.startsWith(ENDPOINT_PREFIX)) {
            return endpoint(trimmed.substring(ENDPOINT_PREFIX.length()));
        }
        if (trimmed.startsWith(PROVIDER_PREFIX)) {
            return provider(trimmed.substring(PROVIDER_PREFIX.length()));
        }
        if (trimmed.startsWith(POLICY_PREFIX)) {
            return policy(trimmed.substring(POLICY_PREFIX.length()));
        }
        throw new RuleConfigurationException("Unknown scope: " + key);
    }

    record Global() implements RateLimitScope {
        static final Global INSTANCE = new Global();

        @Override
        public String key() {
            return GLOBAL_KEY;
        }
    }

    record User() implements RateLimitScope {
        static final User INSTANCE = new User();

        @Override
        public String key() {
            return USER_KEY;
        }
    }

    record ApiKey() implements RateLimitScope {
        static final ApiKey INSTANCE = new ApiKey();

        @Override
        public String key() {
            return API_KEY_KEY;
        }
    }

    record Endpoint(String pattern) implements RateLimitScope {
        public Endpoint {
            if (pattern == null || pattern.isBlank()) {
                throw new RuleConfigurationException("Endpoint scope requires a pattern");
            }
        }

        @Override
        public String key() {
            return ENDPOINT_PREFIX + pattern;
        }
    }

    record Provider(String name) implements RateLimitScope {
        public Provider {
            if (name == null || name.isBlank()) {
                throw new RuleConfigurationException("Provider scope requires a name");
            }
        }

        @Override
        public String key() {
            return PROVIDER_PREFIX + name;
        }
    }

    record Policy(String name) implements RateLimitScope {
        public Policy {
            if (name == null || name.isBlank()) {
                throw new RuleConfigurationException("Policy scope requires a name");
            }
        }

        @Override
        public String key() {
            return POLICY_PREFIX + name;
        }
    }
}
