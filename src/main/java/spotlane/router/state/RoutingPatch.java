package spotlane.router.state;

/**
 * Partial update for {@link RoutingState}. A {@code null} field is left
 * untouched; a blank one clears the value. URLs lose trailing slashes.
 */
public record RoutingPatch(String serverlessUrl, String serverlessAuthToken, String spotUrl) {

    public RoutingPatch {
        serverlessUrl = normalizeUrl(serverlessUrl);
        serverlessAuthToken = serverlessAuthToken == null ? null : serverlessAuthToken.trim();
        spotUrl = normalizeUrl(spotUrl);
    }

    public static RoutingPatch serverless(String url, String authToken) {
        return new RoutingPatch(url, authToken, null);
    }

    public static RoutingPatch spot(String url) {
        return new RoutingPatch(null, null, url);
    }

    public boolean isEmpty() {
        return serverlessUrl == null && serverlessAuthToken == null && spotUrl == null;
    }

    /** Whether this patch sets a (non-blank) spot URL. */
    public boolean setsSpot() {
        return spotUrl != null && !spotUrl.isEmpty();
    }

    static String normalizeUrl(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
