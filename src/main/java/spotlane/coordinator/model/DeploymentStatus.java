package spotlane.coordinator.model;

/**
 * Lifecycle of a hybrid deployment as persisted in the deployment store.
 */
public enum DeploymentStatus {
    /** Planned and launching; no backend has resolved yet */
    LAUNCHING,
    /** Every backend that resolved so far is up */
    ACTIVE,
    /** Exactly one backend failed; the other keeps serving */
    DEGRADED,
    /** Both backends failed */
    FAILED,
    /** Torn down on request */
    DESTROYED;

    public boolean isTerminal() {
        return this == FAILED || this == DESTROYED;
    }
}
