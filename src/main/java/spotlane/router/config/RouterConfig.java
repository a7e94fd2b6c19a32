package spotlane.router.config;

import java.time.Duration;

/**
 * Configuration holder for the routing proxy.
 * All settings have sensible defaults; {@link #fromEnv()} reads
 * {@code SPOTLANE_*} variables.
 */
public final class RouterConfig {

    static final Duration MIN_PROBE_INTERVAL = Duration.ofMillis(250);

    // Server settings
    private int port = 8080;
    private String host = "0.0.0.0";
    private int maxRequestBytes = 16 * 1024 * 1024;

    // Initial backends (usually pushed later via /router/config)
    private String serverlessUrl;
    private String serverlessAuthToken;
    private String spotUrl;

    // Readiness probing
    private String spotReadyPath = "/health";
    private String spotPokePath = "/health";
    private Duration probeInterval = Duration.ofSeconds(1);
    private Duration probeMinInterval = Duration.ofSeconds(1);
    private Duration probeTimeout = Duration.ofSeconds(1);
    private Duration pokeTimeout = Duration.ofMillis(300);
    private Duration pokeMinInterval = Duration.ofMillis(500);

    // Upstream
    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration upstreamTimeout = Duration.ofSeconds(210);

    // Auth settings (optional)
    private String apiKey;
    private String apiKeyHeader = "x-api-key";
    private boolean allowHealthWithoutAuth = false;

    // Stats
    private int routeWindowSize = 200;

    private RouterConfig() {
    }

    public static RouterConfig defaults() {
        return new RouterConfig();
    }

    public static RouterConfig fromEnv() {
        RouterConfig config = new RouterConfig();

        String port = env("SPOTLANE_PORT");
        if (port != null) {
            config.port = Integer.parseInt(port);
        }
        String host = env("SPOTLANE_HOST");
        if (host != null) {
            config.host = host;
        }
        config.serverlessUrl = env("SPOTLANE_SERVERLESS_URL");
        config.serverlessAuthToken = env("SPOTLANE_SERVERLESS_AUTH_TOKEN");
        config.spotUrl = env("SPOTLANE_SPOT_URL");

        String readyPath = env("SPOTLANE_SPOT_READY_PATH");
        if (readyPath != null) {
            config.spotReadyPath = readyPath;
        }
        String pokePath = env("SPOTLANE_SPOT_POKE_PATH");
        if (pokePath != null) {
            config.spotPokePath = pokePath;
        }

        config.probeInterval = millis("SPOTLANE_PROBE_INTERVAL_MS", config.probeInterval);
        config.probeMinInterval = millis("SPOTLANE_PROBE_MIN_INTERVAL_MS", config.probeMinInterval);
        config.probeTimeout = millis("SPOTLANE_PROBE_TIMEOUT_MS", config.probeTimeout);
        config.pokeTimeout = millis("SPOTLANE_POKE_TIMEOUT_MS", config.pokeTimeout);
        config.pokeMinInterval = millis("SPOTLANE_POKE_MIN_INTERVAL_MS", config.pokeMinInterval);
        config.connectTimeout = millis("SPOTLANE_CONNECT_TIMEOUT_MS", config.connectTimeout);
        config.upstreamTimeout = millis("SPOTLANE_UPSTREAM_TIMEOUT_MS", config.upstreamTimeout);

        config.apiKey = env("SPOTLANE_API_KEY");
        String header = env("SPOTLANE_API_KEY_HEADER");
        if (header != null) {
            config.apiKeyHeader = header;
        }
        String allowHealth = env("SPOTLANE_ALLOW_HEALTH_NO_AUTH");
        if (allowHealth != null) {
            config.allowHealthWithoutAuth = Boolean.parseBoolean(allowHealth);
        }

        String window = env("SPOTLANE_ROUTE_WINDOW_SIZE");
        if (window != null) {
            config.routeWindowSize = Integer.parseInt(window);
        }
        String maxBytes = env("SPOTLANE_MAX_REQUEST_BYTES");
        if (maxBytes != null) {
            config.maxRequestBytes = Integer.parseInt(maxBytes);
        }
        return config;
    }

    private static String env(String name) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Duration millis(String name, Duration fallback) {
        String value = env(name);
        return value == null ? fallback : Duration.ofMillis(Long.parseLong(value));
    }

    // Getters
    public int port() {
        return port;
    }

    public String host() {
        return host;
    }

    public int maxRequestBytes() {
        return maxRequestBytes;
    }

    public String serverlessUrl() {
        return serverlessUrl;
    }

    public String serverlessAuthToken() {
        return serverlessAuthToken;
    }

    public String spotUrl() {
        return spotUrl;
    }

    public String spotReadyPath() {
        return spotReadyPath;
    }

    public String spotPokePath() {
        return spotPokePath;
    }

    /** Tick interval, never below 250ms. */
    public Duration probeInterval() {
        return probeInterval.compareTo(MIN_PROBE_INTERVAL) < 0 ? MIN_PROBE_INTERVAL : probeInterval;
    }

    public Duration probeMinInterval() {
        return probeMinInterval;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public Duration pokeTimeout() {
        return pokeTimeout;
    }

    public Duration pokeMinInterval() {
        return pokeMinInterval;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration upstreamTimeout() {
        return upstreamTimeout;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String apiKeyHeader() {
        return apiKeyHeader;
    }

    public boolean allowHealthWithoutAuth() {
        return allowHealthWithoutAuth;
    }

    public int routeWindowSize() {
        return routeWindowSize;
    }

    /** Independent copy; the {@code with*} setters mutate in place. */
    public RouterConfig copy() {
        RouterConfig c = new RouterConfig();
        c.port = port;
        c.host = host;
        c.maxRequestBytes = maxRequestBytes;
        c.serverlessUrl = serverlessUrl;
        c.serverlessAuthToken = serverlessAuthToken;
        c.spotUrl = spotUrl;
        c.spotReadyPath = spotReadyPath;
        c.spotPokePath = spotPokePath;
        c.probeInterval = probeInterval;
        c.probeMinInterval = probeMinInterval;
        c.probeTimeout = probeTimeout;
        c.pokeTimeout = pokeTimeout;
        c.pokeMinInterval = pokeMinInterval;
        c.connectTimeout = connectTimeout;
        c.upstreamTimeout = upstreamTimeout;
        c.apiKey = apiKey;
        c.apiKeyHeader = apiKeyHeader;
        c.allowHealthWithoutAuth = allowHealthWithoutAuth;
        c.routeWindowSize = routeWindowSize;
        return c;
    }

    // Fluent setters for testing/customization
    public RouterConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public RouterConfig withHost(String host) {
        this.host = host;
        return this;
    }

    public RouterConfig withServerlessUrl(String url) {
        this.serverlessUrl = url;
        return this;
    }

    public RouterConfig withServerlessAuthToken(String token) {
        this.serverlessAuthToken = token;
        return this;
    }

    public RouterConfig withSpotUrl(String url) {
        this.spotUrl = url;
        return this;
    }

    public RouterConfig withSpotReadyPath(String path) {
        this.spotReadyPath = path;
        return this;
    }

    public RouterConfig withProbeInterval(Duration interval) {
        this.probeInterval = interval;
        return this;
    }

    public RouterConfig withProbeMinInterval(Duration interval) {
        this.probeMinInterval = interval;
        return this;
    }

    public RouterConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public RouterConfig withPokeMinInterval(Duration interval) {
        this.pokeMinInterval = interval;
        return this;
    }

    public RouterConfig withConnectTimeout(Duration timeout) {
        this.connectTimeout = timeout;
        return this;
    }

    public RouterConfig withUpstreamTimeout(Duration timeout) {
        this.upstreamTimeout = timeout;
        return this;
    }

    public RouterConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public RouterConfig withAllowHealthWithoutAuth(boolean allow) {
        this.allowHealthWithoutAuth = allow;
        return this;
    }

    public RouterConfig withRouteWindowSize(int size) {
        this.routeWindowSize = size;
        return this;
    }

    @Override
    public String toString() {
        return "RouterConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", serverlessUrl=" + serverlessUrl +
                ", spotUrl=" + spotUrl +
                ", probeInterval=" + probeInterval().toMillis() + "ms" +
                ", upstreamTimeout=" + upstreamTimeout.toSeconds() + "s" +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
