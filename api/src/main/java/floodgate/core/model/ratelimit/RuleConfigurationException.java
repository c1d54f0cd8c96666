package floodgate.core.model.ratelimit;

/**
 * Raised when a rule definition is invalid.
 *
 * <p>Only thrown while a rule is built or registered, never while a request is evaluated.
 */
public class RuleConfigurationException extends RateLimitException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
