package floodgate.system.filter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import floodgate.core.config.GatewayConfig;
import floodgate.core.model.ratelimit.RateLimitScope;

/**
 * Derives the rate limit identity of a request.
 *
 * <p>Priority: API key, then user id, then client IP. API keys are never
 * used verbatim; only a truncated SHA-256 digest reaches counters, logs and
 * events.
 */
@ApplicationScoped
public class ClientIdentifierResolver {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String USER_ID_HEADER = "X-User-ID";
    public static final String IP_RULE_TYPE = "ip";

    /** 16 hex characters = 64 bits, enough to key counters without storing the key. */
    static final int API_KEY_DIGEST_CHARS = 16;

    private final boolean trustProxyHeaders;

    @Inject
    public ClientIdentifierResolver(GatewayConfig config) {
        this(config.trustProxyHeaders());
    }

    public ClientIdentifierResolver(boolean trustProxyHeaders) {
        this.trustProxyHeaders = trustProxyHeaders;
    }

    /**
     * @param header        header lookup of the request
     * @param remoteAddress peer address of the connection, may be null
     * @return the identity the request is counted against
     */
    public ClientIdentity resolve(HeaderLookup header, String remoteAddress) {
        final var apiKey = nonBlank(header.get(API_KEY_HEADER));
        if (apiKey.isPresent()) {
            return new ClientIdentity("api_key:" + digest(apiKey.get()), RateLimitScope.API_KEY_KEY);
        }
        final var userId = nonBlank(header.get(USER_ID_HEADER));
        if (userId.isPresent()) {
            return new ClientIdentity("user:" + userId.get(), RateLimitScope.USER_KEY);
        }
        return new ClientIdentity("ip:" + clientIp(header, remoteAddress), IP_RULE_TYPE);
    }

    String clientIp(HeaderLookup header, String remoteAddress) {
        if (trustProxyHeaders) {
            final var forwarded = header.get("Forwarded");
            if (forwarded != null) {
                final var ip = parseForwardedFor(forwarded);
                if (ip != null) {
                    return ip;
                }
            }
            final var xForwardedFor = header.get("X-Forwarded-For");
            if (xForwardedFor != null && !xForwardedFor.isBlank()) {
                return xForwardedFor.split(",")[0].trim();
            }
        }
        return remoteAddress != null ? remoteAddress : "unknown";
    }

    /**
     * Client address from the first element of an RFC 7239 {@code Forwarded} header.
     *
     * @return the address without quotes, brackets or port, null if absent
     */
    static String parseForwardedFor(String forwarded) {
        final var firstEntry = forwarded.split(",")[0].trim();
        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (!trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                continue;
            }
            var value = trimmed.substring(4);
            if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                value = value.substring(1, value.length() - 1);
            }
            if (value.startsWith("[")) {
                final var bracketEnd = value.indexOf(']');
                return bracketEnd > 0 ? value.substring(1, bracketEnd) : null;
            }
            // IPv4 with port has exactly one colon
            if (value.indexOf(':') >= 0 && value.indexOf(':') == value.lastIndexOf(':')) {
                value = value.substring(0, value.indexOf(':'));
            }
            return value.isBlank() ? null : value;
        }
        return null;
    }

    static String digest(String apiKey) {
        try {
            final var hash = MessageDigest.getInstance("SHA-256").digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, API_KEY_DIGEST_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is a required JDK algorithm", e);
        }
    }

    private static Optional<String> nonBlank(String value) {
        return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
    }

    /**
     * Header access, decoupled from the JAX-RS request for testing.
     */
    @FunctionalInterface
    public interface HeaderLookup {
        String get(String name);
    }
}
