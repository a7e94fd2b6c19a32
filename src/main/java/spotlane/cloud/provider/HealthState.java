package spotlane.cloud.provider;

/**
 * Result of a cheap health query against a deployed backend.
 */
public enum HealthState {
    HEALTHY,
    UNHEALTHY,
    /** No health URL to ask */
    UNKNOWN
}
