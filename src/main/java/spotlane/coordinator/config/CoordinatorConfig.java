package spotlane.coordinator.config;

import spotlane.router.config.RouterConfig;

import java.time.Duration;

/**
 * Configuration holder for the launch coordinator.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/spotlane;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    // In-process router settings
    private RouterConfig routerConfig = RouterConfig.defaults();
    private String routerPublicHost = "127.0.0.1";

    // Launch settings
    private Duration serverlessTimeout = Duration.ofSeconds(600);
    private Duration spotTimeout = Duration.ofSeconds(1800);

    // Router config push
    private int pushRetries = 5;
    private Duration pushDelay = Duration.ofMillis(3000);

    // Optional INI file with [spot]/[serverless] scaling overrides
    private String scalingPolicyFile = null;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();
        config.routerConfig = RouterConfig.fromEnv();

        String dbUrl = System.getenv("SPOTLANE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String routerPort = System.getenv("SPOTLANE_ROUTER_PORT");
        if (routerPort != null && !routerPort.isBlank()) {
            config.routerConfig = config.routerConfig.withPort(Integer.parseInt(routerPort.trim()));
        }

        String publicHost = System.getenv("SPOTLANE_ROUTER_PUBLIC_HOST");
        if (publicHost != null && !publicHost.isBlank()) {
            config.routerPublicHost = publicHost.trim();
        }

        String serverlessTimeout = System.getenv("SPOTLANE_SERVERLESS_TIMEOUT_SECONDS");
        if (serverlessTimeout != null && !serverlessTimeout.isBlank()) {
            config.serverlessTimeout = Duration.ofSeconds(Long.parseLong(serverlessTimeout.trim()));
        }

        String spotTimeout = System.getenv("SPOTLANE_SPOT_TIMEOUT_SECONDS");
        if (spotTimeout != null && !spotTimeout.isBlank()) {
            config.spotTimeout = Duration.ofSeconds(Long.parseLong(spotTimeout.trim()));
        }

        String retries = System.getenv("SPOTLANE_PUSH_RETRIES");
        if (retries != null && !retries.isBlank()) {
            config.pushRetries = Integer.parseInt(retries.trim());
        }

        String delay = System.getenv("SPOTLANE_PUSH_DELAY_MS");
        if (delay != null && !delay.isBlank()) {
            config.pushDelay = Duration.ofMillis(Long.parseLong(delay.trim()));
        }

        String scaling = System.getenv("SPOTLANE_SCALING_FILE");
        if (scaling != null && !scaling.isBlank()) {
            config.scalingPolicyFile = scaling.trim();
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    /** Template for every router the coordinator starts; URLs are pushed later. */
    public RouterConfig routerConfig() {
        return routerConfig;
    }

    /** Host put into router URLs handed to clients. */
    public String routerPublicHost() {
        return routerPublicHost;
    }

    public Duration serverlessTimeout() {
        return serverlessTimeout;
    }

    /** Zero means the spot leg may take as long as it needs. */
    public Duration spotTimeout() {
        return spotTimeout;
    }

    public int pushRetries() {
        return pushRetries;
    }

    public Duration pushDelay() {
        return pushDelay;
    }

    public String scalingPolicyFile() {
        return scalingPolicyFile;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withRouterConfig(RouterConfig routerConfig) {
        this.routerConfig = routerConfig;
        return this;
    }

    public CoordinatorConfig withRouterPublicHost(String host) {
        this.routerPublicHost = host;
        return this;
    }

    public CoordinatorConfig withServerlessTimeout(Duration timeout) {
        this.serverlessTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withSpotTimeout(Duration timeout) {
        this.spotTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withPushRetries(int retries) {
        this.pushRetries = retries;
        return this;
    }

    public CoordinatorConfig withPushDelay(Duration delay) {
        this.pushDelay = delay;
        return this;
    }

    public CoordinatorConfig withScalingPolicyFile(String path) {
        this.scalingPolicyFile = path;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", routerPort=" + routerConfig.port() +
                ", routerPublicHost='" + routerPublicHost + '\'' +
                ", serverlessTimeout=" + serverlessTimeout.toSeconds() + "s" +
                ", spotTimeout=" + spotTimeout.toSeconds() + "s" +
                ", pushRetries=" + pushRetries +
                '}';
    }
}
