package spotlane.coordinator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The joined, user-visible deployment. Created once the serverless leg has
 * resolved; the spot leg is filled in later by the coordinator's background
 * completion handler.
 *
 * <p>
 * Owned by the coordinator. Field updates are synchronized so a status query
 * never sees a spot result without the matching status.
 */
public final class HybridDeployment {
    private final DeployRequest request;
    private final String routerUrl;
    private final Instant createdAt;
    private final CompletableFuture<HybridDeployment> completion = new CompletableFuture<>();

    private DeploymentResult serverless;
    private DeploymentResult spot;
    private ComponentStatus serverlessStatus = ComponentStatus.PENDING;
    private ComponentStatus spotStatus;
    private DeploymentStatus status = DeploymentStatus.LAUNCHING;

    public HybridDeployment(DeployRequest request, String routerUrl) {
        this.request = Objects.requireNonNull(request, "request is required");
        this.routerUrl = routerUrl;
        this.createdAt = Instant.now();
        this.spotStatus = request.serverlessOnly() ? ComponentStatus.SKIPPED : ComponentStatus.PENDING;
    }

    public DeployRequest request() {
        return request;
    }

    public String serviceName() {
        return request.serviceName();
    }

    /**
     * Public endpoint. Serverless-only deployments have no router, so this is
     * the serverless endpoint once known.
     */
    public synchronized String routerUrl() {
        if (routerUrl == null && serverless != null && serverless.isSuccess()) {
            return serverless.endpointUrl();
        }
        return routerUrl;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized DeploymentResult serverless() {
        return serverless;
    }

    /** Spot result, or {@code null} while the spot leg is still pending. */
    public synchronized DeploymentResult spot() {
        return spot;
    }

    public synchronized ComponentStatus serverlessStatus() {
        return serverlessStatus;
    }

    public synchronized ComponentStatus spotStatus() {
        return spotStatus;
    }

    public synchronized DeploymentStatus status() {
        return status;
    }

    public synchronized boolean isSpotPending() {
        return spotStatus == ComponentStatus.PENDING;
    }

    /**
     * Completes once every leg has settled; fails when both legs failed.
     */
    public CompletableFuture<HybridDeployment> completion() {
        return completion;
    }

    public synchronized void serverlessResolved(DeploymentResult result) {
        this.serverless = Objects.requireNonNull(result);
        this.serverlessStatus = result.isSuccess() ? ComponentStatus.UP : ComponentStatus.FAILED;
        recompute();
    }

    public synchronized void spotResolved(DeploymentResult result) {
        this.spot = Objects.requireNonNull(result);
        this.spotStatus = result.isSuccess() ? ComponentStatus.UP : ComponentStatus.FAILED;
        recompute();
    }

    public synchronized void markDestroyed() {
        if (serverlessStatus != ComponentStatus.SKIPPED) {
            serverlessStatus = ComponentStatus.DESTROYED;
        }
        if (spotStatus != ComponentStatus.SKIPPED) {
            spotStatus = ComponentStatus.DESTROYED;
        }
        status = DeploymentStatus.DESTROYED;
    }

    /** Whether every leg has resolved one way or the other. */
    public synchronized boolean isSettled() {
        return serverlessStatus != ComponentStatus.PENDING && spotStatus != ComponentStatus.PENDING;
    }

    private void recompute() {
        if (status == DeploymentStatus.DESTROYED) {
            return;
        }
        boolean serverlessFailed = serverlessStatus == ComponentStatus.FAILED;
        boolean spotFailed = spotStatus == ComponentStatus.FAILED;
        boolean spotSkipped = spotStatus == ComponentStatus.SKIPPED;

        if (serverlessFailed && (spotFailed || spotSkipped)) {
            status = DeploymentStatus.FAILED;
        } else if (serverlessFailed || spotFailed) {
            status = DeploymentStatus.DEGRADED;
        } else if (serverlessStatus == ComponentStatus.UP) {
            status = DeploymentStatus.ACTIVE;
        } else if (spotStatus == ComponentStatus.UP) {
            // serverless still pending
            status = DeploymentStatus.ACTIVE;
        }
    }

    @Override
    public String toString() {
        return "HybridDeployment{service='" + serviceName() + "', status=" + status()
                + ", router=" + routerUrl + "}";
    }
}
