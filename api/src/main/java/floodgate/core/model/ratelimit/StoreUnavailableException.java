package floodgate.core.model.ratelimit;

/**
 * Raised by counter store implementations when the backing store cannot be reached
 * or returns an unusable response.
 */
public class StoreUnavailableException extends RateLimitException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
