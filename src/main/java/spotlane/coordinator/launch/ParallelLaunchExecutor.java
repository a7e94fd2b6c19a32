package spotlane.coordinator.launch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.provider.InferenceProvider;
import spotlane.cloud.provider.ProviderRegistry;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.ProviderPlan;
import spotlane.coordinator.planner.DeploymentPlan;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each backend's deploy on its own thread, at the same time, and never
 * lets one leg's failure reach the other.
 *
 * <p>
 * The serverless leg is bounded by {@code serverlessTimeout}. The spot leg is
 * bounded by {@code spotTimeout} unless that is zero. A leg that times out is
 * interrupted and resolves to a failed result.
 */
public class ParallelLaunchExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelLaunchExecutor.class);

    private final ProviderRegistry registry;
    private final ExecutorService executor;
    private final Duration serverlessTimeout;
    private final Duration spotTimeout;

    public ParallelLaunchExecutor(ProviderRegistry registry, Duration serverlessTimeout, Duration spotTimeout) {
        this.registry = registry;
        this.serverlessTimeout = serverlessTimeout;
        this.spotTimeout = spotTimeout;
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "spotlane-launch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start every leg of the plan and return immediately.
     */
    public LaunchHandle launch(DeploymentPlan plan) {
        DeployRequest request = plan.request();
        List<CompletableFuture<DeploymentResult>> running = new ArrayList<>();
        CompletableFuture<DeploymentResult> serverless = start(
                registry.get(request.serverlessProvider()), plan.serverless(), request, serverlessTimeout, running);

        CompletableFuture<DeploymentResult> spot = null;
        if (plan.hasSpot()) {
            spot = start(registry.get(request.spotProvider()), plan.spot(), request, spotTimeout, running);
        }
        log.info("Launched {} leg(s) for {}", plan.hasSpot() ? 2 : 1, request.serviceName());
        return new LaunchHandle(serverless, spot, running);
    }

    private CompletableFuture<DeploymentResult> start(InferenceProvider provider, ProviderPlan plan,
            DeployRequest request, Duration timeout, List<CompletableFuture<DeploymentResult>> running) {
        CompletableFuture<DeploymentResult> leg = new CompletableFuture<>();
        running.add(leg);
        Future<?> task = executor.submit(() -> {
            DeploymentResult result = runLeg(provider, plan, request);
            if (!leg.complete(result) && result.isSuccess()) {
                // the leg already timed out or was cancelled; nobody owns these resources
                log.warn("{} finished after its leg was abandoned, tearing down {}", provider.name(),
                        result.endpointUrl());
                try {
                    provider.destroy(result);
                } catch (RuntimeException e) {
                    log.warn("{} teardown of abandoned deploy failed: {}", provider.name(), e.toString());
                }
            }
        });
        // timeout or cancellation interrupts the blocked deploy call
        leg.whenComplete((r, t) -> {
            if (t != null) {
                task.cancel(true);
            }
        });
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            leg.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return leg.handle((result, error) -> {
            if (error == null) {
                return result;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                log.warn("{} deploy timed out after {}s", provider.name(), timeout.toSeconds());
                return DeploymentResult.failure(provider.name(),
                        "deploy timed out after " + timeout.toSeconds() + "s", plan.metadata());
            }
            if (cause instanceof CancellationException) {
                log.warn("{} deploy cancelled", provider.name());
                return DeploymentResult.failure(provider.name(), "deploy cancelled", plan.metadata());
            }
            return DeploymentResult.failure(provider.name(), cause.toString(), plan.metadata());
        });
    }

    static DeploymentResult runLeg(InferenceProvider provider, ProviderPlan plan, DeployRequest request) {
        try {
            List<String> problems = provider.preflight(request);
            if (!problems.isEmpty()) {
                log.warn("{} preflight failed: {}", provider.name(), problems);
                return DeploymentResult.failure(provider.name(), "Preflight failed: " + String.join("; ", problems));
            }
            DeploymentResult result = provider.deploy(plan);
            if (result == null) {
                return DeploymentResult.failure(provider.name(), "provider returned no result");
            }
            if (result.isSuccess()) {
                log.info("{} deploy succeeded: {}", provider.name(), result.endpointUrl());
            } else {
                log.warn("{} deploy failed: {}", provider.name(), result.error());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("{} deploy threw", provider.name(), e);
            return DeploymentResult.failure(provider.name(), e.toString(), plan.metadata());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
