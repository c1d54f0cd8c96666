package floodgate.core.model.policy;

import floodgate.core.model.ratelimit.RateLimitException;

/**
 * Raised when a serialized policy bundle cannot be read at all.
 *
 * <p>A readable bundle with individual malformed entries does not raise this;
 * those entries are skipped.
 */
public class InvalidImportDataException extends RateLimitException {

    public InvalidImportDataException(String message) {
        super(message);
    }

    public InvalidImportDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
