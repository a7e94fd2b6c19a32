package spotlane.coordinator.model;

import java.util.Map;
import java.util.Objects;

/**
 * Rendered, provider-specific deployment artifact. Consumed once by the
 * adapter that produced it.
 *
 * @param provider       name of the adapter that produced and will execute it
 * @param renderedScript rendered config or script text (may be empty when the
 *                       provider is driven purely by env)
 * @param env            environment passed to the backend workers
 * @param metadata       free-form metadata (service name, endpoint name, ...)
 */
public record ProviderPlan(
        String provider,
        String renderedScript,
        Map<String, String> env,
        Map<String, String> metadata) {

    public ProviderPlan {
        Objects.requireNonNull(provider, "provider is required");
        renderedScript = renderedScript == null ? "" : renderedScript;
        env = env == null ? Map.of() : Map.copyOf(env);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String metadata(String key) {
        return metadata.get(key);
    }

    /** Metadata value that adapters cannot work without. */
    public String requireMetadata(String key) {
        String value = metadata.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Plan for " + provider + " is missing metadata '" + key + "'");
        }
        return value;
    }
}
