package spotlane.router.state;

import java.time.Instant;
import java.util.Optional;

/**
 * Consistent, immutable view of the routing state at one instant.
 * Unset URLs are {@code null}.
 */
public record RoutingSnapshot(
        String serverlessUrl,
        String serverlessAuthToken,
        String spotUrl,
        boolean spotReady,
        Instant lastProbeAt,
        String lastProbeError,
        boolean shutdown) {

    public boolean hasServerless() {
        return serverlessUrl != null;
    }

    public boolean hasSpot() {
        return spotUrl != null;
    }

    /**
     * Spot when it is set and ready, otherwise serverless when set, otherwise
     * nothing.
     */
    public static Optional<Backend> decide(boolean spotPresent, boolean spotReady, boolean serverlessPresent) {
        if (spotPresent && spotReady) {
            return Optional.of(Backend.SPOT);
        }
        if (serverlessPresent) {
            return Optional.of(Backend.SERVERLESS);
        }
        return Optional.empty();
    }

    public Optional<Backend> choose() {
        if (shutdown) {
            return Optional.empty();
        }
        return decide(hasSpot(), spotReady, hasServerless());
    }

    public String baseUrl(Backend backend) {
        return backend == Backend.SPOT ? spotUrl : serverlessUrl;
    }

    public RoutingPhase phase() {
        if (shutdown) {
            return RoutingPhase.SHUTDOWN;
        }
        if (hasSpot() && spotReady) {
            return RoutingPhase.SPOT_PREFERRED;
        }
        if (hasServerless()) {
            return RoutingPhase.SERVERLESS_ONLY;
        }
        return hasSpot() ? RoutingPhase.SPOT_WARMING : RoutingPhase.NO_BACKENDS;
    }
}
