package spotlane.coordinator.model;

/**
 * Sub-status of one backend inside a hybrid deployment.
 */
public enum ComponentStatus {
    PENDING,
    UP,
    FAILED,
    DESTROYED,
    /** Backend not part of this deployment (serverless-only mode) */
    SKIPPED
}
