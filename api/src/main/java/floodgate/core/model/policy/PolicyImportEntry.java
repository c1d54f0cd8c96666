package floodgate.core.model.policy;

import java.util.Optional;

/**
 * One entry of a decoded policy bundle.
 *
 * <p>Exactly one of {@code policy} and {@code error} is present. Entries with an
 * error are skipped on import.
 *
 * @param name   the entry name as found in the bundle, may be {@code "<unnamed>"}
 * @param policy the decoded policy
 * @param error  why the entry could not be decoded
 */
public record PolicyImportEntry(String name, Optional<RateLimitPolicy> policy, Optional<String> error) {

    public static PolicyImportEntry valid(RateLimitPolicy policy) {
        return new PolicyImportEntry(policy.name(), Optional.of(policy), Optional.empty());
    }

    public static PolicyImportEntry invalid(String name, String error) {
        return new PolicyImportEntry(name, Optional.empty(), Optional.of(error));
    }

    public boolean isValid() {
        return policy.isPresent();
    }
}
