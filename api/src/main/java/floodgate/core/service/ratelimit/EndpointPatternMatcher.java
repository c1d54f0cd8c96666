package floodgate.core.service.ratelimit;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Matches request endpoints against the glob patterns of endpoint scopes.
 *
 * <p>Patterns follow {@link java.nio.file.PathMatcher} glob syntax:
 * {@code *} stays within one path segment, {@code **} crosses segments.
 * Compiled patterns are cached.
 */
@ApplicationScoped
public class EndpointPatternMatcher {

    private static final Pattern MULTIPLE_SLASHES = Pattern.compile("/+");

    private final Map<String, PathMatcher> compiled = new ConcurrentHashMap<>();

    /**
     * @param pattern  glob such as {@code /api/search/**}
     * @param endpoint request path, query string excluded
     * @return true if the endpoint is covered by the pattern
     */
    public boolean matches(String pattern, String endpoint) {
        final var path = normalize(endpoint);
        if (pattern.equals(path)) {
            return true;
        }
        final var matcher = compiled.computeIfAbsent(pattern, p -> FileSystems.getDefault()
                .getPathMatcher("glob:" + p));
        return matcher.matches(Path.of(path));
    }

    private String normalize(String endpoint) {
        if (endpoint == null || endpoint.isEmpty()) {
            return "/";
        }
        var path = endpoint;
        final var query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        path = MULTIPLE_SLASHES.matcher(path).replaceAll("/");
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }
}
