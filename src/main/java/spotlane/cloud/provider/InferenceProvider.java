package spotlane.cloud.provider;

import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.ProviderKind;
import spotlane.coordinator.model.ProviderPlan;

import java.util.List;
import java.util.Map;

/**
 * Contract every backend implements, serverless or spot.
 *
 * <p>
 * Implementations must not share mutable state with other providers: the
 * serverless and spot deploys run concurrently.
 */
public interface InferenceProvider {

    /** Registry name, e.g. {@code runpod}. */
    String name();

    /** Role this provider plays in a hybrid deployment. */
    ProviderKind kind();

    /**
     * Build the provider-specific artifact. No I/O.
     *
     * @param vllmCommand shared vLLM serve command line
     * @throws spotlane.coordinator.error.ValidationException if the request
     *                                                        cannot run here
     */
    ProviderPlan plan(DeployRequest request, String vllmCommand);

    /**
     * Perform the external deploy call. Any "backend didn't come up" outcome
     * (network, quota, timeout) is returned as
     * {@link DeploymentResult#failure}, not thrown.
     */
    DeploymentResult deploy(ProviderPlan plan);

    /**
     * Best-effort teardown. May throw; callers log the failure and continue
     * with the remaining cleanup.
     */
    void destroy(DeploymentResult result);

    /**
     * Cheap environment checks run right before {@link #deploy}. Returns the
     * problems found; empty means go.
     */
    default List<String> preflight(DeployRequest request) {
        return List.of();
    }

    /**
     * Side-effect-free health query: GET on the health URL, 2xx is healthy.
     */
    default HealthState status(DeploymentResult result) {
        if (result == null || !result.isSuccess()) {
            return HealthState.UNKNOWN;
        }
        return HealthChecks.get(result.healthUrl(), authToken());
    }

    /** Provider-native status of a service, for operators. */
    default Map<String, Object> describe(String serviceName) {
        return Map.of("provider", name(), "service_name", serviceName, "status", "unknown");
    }

    /**
     * Token the router sends as {@code Authorization: Bearer} toward this
     * backend; empty when none.
     */
    default String authToken() {
        return "";
    }
}
