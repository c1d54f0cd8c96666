package floodgate.core.model.policy;

import floodgate.core.model.ratelimit.RateLimitException;

/**
 * Raised when creating a policy whose name is already taken.
 */
public class DuplicatePolicyException extends RateLimitException {

    private final String policyName;

    public DuplicatePolicyException(String policyName) {
        super("Policy already exists: " + policyName);
        this.policyName = policyName;
    }

    public String policyName() {
        return policyName;
    }
}
