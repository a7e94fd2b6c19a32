package spotlane.coordinator.launch;

import spotlane.coordinator.model.DeploymentResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Join handles for the two legs of one launch. Both futures always complete
 * normally: failures and timeouts arrive as failed {@link DeploymentResult}s.
 */
public final class LaunchHandle {
    private final CompletableFuture<DeploymentResult> serverless;
    private final CompletableFuture<DeploymentResult> spot;
    private final List<CompletableFuture<DeploymentResult>> running;

    LaunchHandle(CompletableFuture<DeploymentResult> serverless, CompletableFuture<DeploymentResult> spot,
            List<CompletableFuture<DeploymentResult>> running) {
        this.serverless = serverless;
        this.spot = spot;
        this.running = List.copyOf(running);
    }

    public CompletableFuture<DeploymentResult> serverless() {
        return serverless;
    }

    /** {@code null} when no spot leg was launched. */
    public CompletableFuture<DeploymentResult> spot() {
        return spot;
    }

    public boolean hasSpot() {
        return spot != null;
    }

    /**
     * Block until the serverless leg resolves. Bounded by the executor's
     * serverless timeout.
     */
    public DeploymentResult awaitServerless() {
        return serverless.join();
    }

    /**
     * Interrupt every leg still deploying. Each resolves to a "deploy
     * cancelled" failure carrying its plan metadata, so partial resources can
     * still be torn down.
     */
    public void cancelPending() {
        for (CompletableFuture<DeploymentResult> leg : running) {
            if (!leg.isDone()) {
                leg.cancel(true);
            }
        }
    }

    /** Completes when every launched leg has resolved. */
    public CompletableFuture<Void> allSettled() {
        return spot == null ? serverless.thenApply(r -> null) : CompletableFuture.allOf(serverless, spot);
    }
}
