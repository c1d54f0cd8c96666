package floodgate.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the policy manager.
 *
 * <p>Configuration prefix: {@code floodgate.policies}
 */
@ConfigMapping(prefix = "floodgate.policies")
public interface PolicyConfig {

    /**
     * Seed the built-in developer, premium, standard and anonymous policies at startup.
     *
     * @return true to seed (default: true)
     */
    @WithDefault("true")
    boolean seedDefaults();
}
