package floodgate.core.model.ratelimit;

/**
 * Base type of all errors raised by the rate limiter.
 *
 * <p>Core operations surface these as failed {@code Uni}s; the REST layer maps
 * each subtype to a problem response.
 */
public abstract class RateLimitException extends RuntimeException {

    protected RateLimitException(String message) {
        super(message);
    }

    protected RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
