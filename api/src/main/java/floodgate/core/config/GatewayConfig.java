package floodgate.core.config;

import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the admission filter.
 *
 * <p>Configuration prefix: {@code floodgate.gateway}
 */
@ConfigMapping(prefix = "floodgate.gateway")
public interface GatewayConfig {

    /**
     * @return true to rate limit incoming requests (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Glob patterns of paths subject to admission control.
     *
     * @return patterns (default: /api/**)
     */
    @WithDefault("/api/**")
    List<String> protectedPaths();

    /**
     * Trust Forwarded and X-Forwarded-For when identifying anonymous clients.
     *
     * @return true to trust proxy headers (default: true)
     */
    @WithDefault("true")
    boolean trustProxyHeaders();
}
