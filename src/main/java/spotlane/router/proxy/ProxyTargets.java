package spotlane.router.proxy;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the upstream URL for an inbound request URI against a backend base
 * URL.
 */
public final class ProxyTargets {

    private ProxyTargets() {
    }

    /**
     * Join {@code base} with the sanitized path of {@code requestUri}. Empty,
     * {@code .} and {@code ..} segments are dropped; the query string is kept.
     *
     * @throws IllegalArgumentException if the result is not a valid URI or
     *                                  would leave the backend's host
     */
    public static URI build(String base, String requestUri) {
        String raw = requestUri == null || requestUri.isEmpty() ? "/" : requestUri;
        int fragment = raw.indexOf('#');
        if (fragment >= 0) {
            raw = raw.substring(0, fragment);
        }
        int q = raw.indexOf('?');
        String path = q >= 0 ? raw.substring(0, q) : raw;
        String query = q >= 0 ? raw.substring(q + 1) : null;

        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                continue;
            }
            segments.add(segment);
        }

        String trimmedBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        StringBuilder target = new StringBuilder(trimmedBase).append('/').append(String.join("/", segments));
        if (query != null && !query.isEmpty()) {
            target.append('?').append(query);
        }

        URI baseUri = URI.create(trimmedBase);
        URI targetUri = URI.create(target.toString());
        if (!Objects.equals(baseUri.getHost(), targetUri.getHost())
                || baseUri.getPort() != targetUri.getPort()
                || !Objects.equals(baseUri.getScheme(), targetUri.getScheme())) {
            throw new IllegalArgumentException("Target escapes backend host: " + requestUri);
        }
        return targetUri;
    }
}
