package spotlane.coordinator.model;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of executing one {@link ProviderPlan}. Never mutated; a redeploy
 * produces a new result.
 *
 * <p>
 * A failed result carries an error and no endpoint. It may still carry
 * metadata naming resources that were created before the failure, so
 * teardown can clean them up.
 */
public record DeploymentResult(
        String provider,
        String deploymentId,
        String endpointUrl,
        String healthUrl,
        String error,
        Map<String, String> metadata) {

    public DeploymentResult {
        Objects.requireNonNull(provider, "provider is required");
        if (error != null && endpointUrl != null) {
            throw new IllegalArgumentException("A failed result cannot carry an endpoint: " + provider);
        }
        if (error == null && endpointUrl == null) {
            throw new IllegalArgumentException("A successful result needs an endpoint: " + provider);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DeploymentResult success(String provider, String deploymentId, String endpointUrl,
            String healthUrl, Map<String, String> metadata) {
        return new DeploymentResult(provider, deploymentId, stripTrailingSlash(endpointUrl), healthUrl, null,
                metadata);
    }

    public static DeploymentResult failure(String provider, String error, Map<String, String> metadata) {
        return new DeploymentResult(provider, null, null, null,
                error == null || error.isBlank() ? "unknown error" : error, metadata);
    }

    public static DeploymentResult failure(String provider, String error) {
        return failure(provider, error, Map.of());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** Whether teardown has anything to act on. */
    public boolean hasResources() {
        return deploymentId != null || endpointUrl != null || !metadata.isEmpty();
    }

    public String metadata(String key) {
        return metadata.get(key);
    }

    private static String stripTrailingSlash(String url) {
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
