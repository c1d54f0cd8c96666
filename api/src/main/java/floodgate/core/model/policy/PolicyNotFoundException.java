package floodgate.core.model.policy;

import floodgate.core.model.ratelimit.RateLimitException;

/**
 * Raised when an operation names a policy that does not exist.
 */
public class PolicyNotFoundException extends RateLimitException {

    private final String policyName;

    public PolicyNotFoundException(String policyName) {
        super("Policy not found: " + policyName);
        this.policyName = policyName;
    }

    public String policyName() {
        return policyName;
    }
}
