package spotlane.router.proxy;

import io.netty.handler.codec.http.HttpHeaders;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Headers that belong to one connection and must not cross the proxy, plus
 * the ones the proxy recomputes itself.
 */
public final class HopByHopHeaders {

    static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailers", "transfer-encoding", "upgrade");

    // recomputed for the outgoing hop
    private static final Set<String> RECOMPUTED = Set.of("host", "content-length", "expect", "http2-settings");

    private HopByHopHeaders() {
    }

    /**
     * Header names listed in a {@code Connection} header are hop-by-hop too.
     */
    public static Set<String> connectionTokens(List<String> connectionValues) {
        Set<String> tokens = new HashSet<>();
        for (String value : connectionValues) {
            for (String token : value.split(",")) {
                String t = token.trim().toLowerCase(Locale.ROOT);
                if (!t.isEmpty()) {
                    tokens.add(t);
                }
            }
        }
        return tokens;
    }

    /** Whether a request or response header may be forwarded as-is. */
    public static boolean isForwardable(String name, Set<String> connectionTokens) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith(":")) {
            return false;
        }
        return !HOP_BY_HOP.contains(lower) && !RECOMPUTED.contains(lower) && !connectionTokens.contains(lower);
    }

    /** Response headers from the JDK client, filtered, in original order. */
    public static void copyResponseHeaders(Map<String, List<String>> upstream,
            HttpHeaders downstream) {
        Set<String> tokens = connectionTokens(upstream.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase("connection"))
                .flatMap(e -> e.getValue().stream())
                .toList());
        upstream.forEach((name, values) -> {
            if (isForwardable(name, tokens)) {
                downstream.add(name, values);
            }
        });
    }
}
