package spotlane.coordinator.model;

/**
 * Role a provider plays in a hybrid deployment.
 */
public enum ProviderKind {
    SERVERLESS,
    SPOT
}
