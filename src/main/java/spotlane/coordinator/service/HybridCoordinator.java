package spotlane.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.provider.HealthState;
import spotlane.cloud.provider.InferenceProvider;
import spotlane.cloud.provider.ProviderRegistry;
import spotlane.coordinator.config.CoordinatorConfig;
import spotlane.coordinator.error.ProviderDeployException;
import spotlane.coordinator.error.TeardownException;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.launch.LaunchHandle;
import spotlane.coordinator.launch.ParallelLaunchExecutor;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentRecord;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.DeploymentStatus;
import spotlane.coordinator.model.HybridDeployment;
import spotlane.coordinator.planner.DeploymentPlan;
import spotlane.coordinator.planner.DeploymentPlanner;
import spotlane.coordinator.repository.DeploymentRepository;
import spotlane.router.config.RouterConfig;
import spotlane.router.server.RouterNettyServer;
import spotlane.router.state.RoutingPatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a hybrid deployment from request to teardown.
 *
 * <p>
 * {@link #launch} validates and plans, starts the router with no backends,
 * launches both legs and returns as soon as the serverless leg has resolved.
 * The spot leg finishes in the background; its URL is pushed to the router
 * when it comes up. A failed leg never fails the other one.
 *
 * <p>
 * The deployment store is informational: failures to record are logged and
 * never block launch, routing or teardown.
 */
public class HybridCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HybridCoordinator.class);
    private static final Duration CANCEL_WAIT = Duration.ofSeconds(30);

    private final ProviderRegistry registry;
    private final DeploymentPlanner planner;
    private final ParallelLaunchExecutor executor;
    private final DeploymentRepository repository;
    private final RouterClient routerClient;
    private final CoordinatorConfig config;

    private final Map<String, Live> live = new ConcurrentHashMap<>();

    public HybridCoordinator(ProviderRegistry registry, DeploymentPlanner planner, ParallelLaunchExecutor executor,
            DeploymentRepository repository, RouterClient routerClient, CoordinatorConfig config) {
        this.registry = registry;
        this.planner = planner;
        this.executor = executor;
        this.repository = repository;
        this.routerClient = routerClient;
        this.config = config;
    }

    /**
     * Launch a deployment. Blocks until the serverless leg resolves (bounded
     * by the serverless timeout).
     *
     * @throws ValidationException if the request is rejected before any
     *                             backend is contacted
     */
    public HybridDeployment launch(DeployRequest request) {
        DeploymentPlan plan = planner.plan(request, namesInUse());
        String name = request.serviceName();

        RouterNettyServer router = request.serverlessOnly() ? null : startRouter(name);
        String routerUrl = router == null ? null : "http://" + config.routerPublicHost() + ":" + router.port();
        HybridDeployment deployment = new HybridDeployment(request, routerUrl);

        Live entry = new Live(deployment, router);
        if (live.putIfAbsent(name, entry) != null) {
            stopRouter(router);
            throw new ValidationException("Service name already in use: " + name);
        }
        record(deployment);

        LaunchHandle handle;
        try {
            handle = executor.launch(plan);
        } catch (RuntimeException e) {
            live.remove(name);
            stopRouter(router);
            throw e;
        }
        entry.handle = handle;

        DeploymentResult serverless = handle.awaitServerless();
        deployment.serverlessResolved(serverless);
        if (serverless.isSuccess()) {
            log.info("[{}] serverless up at {}", name, serverless.endpointUrl());
            if (router != null) {
                String token = registry.get(serverless.provider()).authToken();
                pushRoute(deployment, RoutingPatch.serverless(serverless.endpointUrl(), token));
            }
        } else {
            log.warn("[{}] serverless leg failed: {}", name, serverless.error());
        }
        record(deployment);

        if (handle.hasSpot()) {
            handle.spot().thenAccept(spot -> onSpotResolved(entry, spot));
        } else {
            settle(deployment);
        }
        log.info("[{}] {} via {}", name, deployment.status(), deployment.routerUrl());
        return deployment;
    }

    private void onSpotResolved(Live entry, DeploymentResult spot) {
        HybridDeployment deployment = entry.deployment;
        String name = deployment.serviceName();
        if (deployment.status() == DeploymentStatus.DESTROYED) {
            return;
        }
        deployment.spotResolved(spot);
        if (spot.isSuccess()) {
            log.info("[{}] spot up at {}", name, spot.endpointUrl());
            if (!entry.destroying.get()) {
                // the router's config endpoint starts its prober for the new URL
                pushRoute(deployment, RoutingPatch.spot(spot.endpointUrl()));
            }
        } else {
            log.warn("[{}] spot leg failed, staying on serverless: {}", name, spot.error());
        }
        storeQuietly("record spot leg of " + name, () -> {
            if (!repository.updateSpot(name, deployment.status(), deployment.spotStatus(), spot)) {
                repository.save(DeploymentRecord.of(deployment));
            }
        });
        settle(deployment);
    }

    private void settle(HybridDeployment deployment) {
        if (deployment.status() == DeploymentStatus.FAILED) {
            log.error("[{}] every backend failed; requests will get 503", deployment.serviceName());
            deployment.completion().completeExceptionally(new ProviderDeployException(
                    deployment.request().serverlessProvider(),
                    "No backend came up for " + deployment.serviceName()));
        } else {
            deployment.completion().complete(deployment);
        }
    }

    /**
     * Tear a deployment down: stop probing, destroy every backend that left
     * resources (each independently), then stop the router.
     *
     * @throws TeardownException listing every step that failed, after all
     *                           steps were attempted
     */
    public void destroy(HybridDeployment deployment) {
        String name = deployment.serviceName();
        Live entry = live.get(name);
        List<DeploymentResult> results = new ArrayList<>();

        if (entry != null) {
            entry.destroying.set(true);
            if (entry.router != null) {
                entry.router.prober().stop();
            }
            LaunchHandle handle = entry.handle;
            if (handle != null) {
                handle.cancelPending();
                awaitQuietly(handle.allSettled(), CANCEL_WAIT);
                results.add(handle.serverless().getNow(null));
                if (handle.hasSpot()) {
                    results.add(handle.spot().getNow(null));
                }
            }
        }
        if (results.isEmpty()) {
            results.add(deployment.serverless());
            results.add(deployment.spot());
        }

        List<Throwable> failures = destroyAll(name, results);

        if (entry != null) {
            stopRouter(entry.router);
            live.remove(name, entry);
        }
        deployment.markDestroyed();
        deployment.completion().complete(deployment);
        record(deployment);
        log.info("[{}] destroyed ({} teardown failure(s))", name, failures.size());
        TeardownException.throwIfAny("Teardown of " + name + " incomplete", failures);
    }

    /**
     * Destroy by service name. Uses the live deployment when this process
     * launched it, otherwise rebuilds the backend results from the store.
     */
    public void destroy(String serviceName) {
        Live entry = live.get(serviceName);
        if (entry != null) {
            destroy(entry.deployment);
            return;
        }
        DeploymentRecord record = repository.findByServiceName(serviceName)
                .orElseThrow(() -> new ValidationException("Unknown deployment: " + serviceName));
        if (record.status() == DeploymentStatus.DESTROYED) {
            log.info("[{}] already destroyed", serviceName);
            return;
        }
        List<DeploymentResult> results = new ArrayList<>();
        results.add(record.serverlessResult());
        results.add(record.spotResult());

        List<Throwable> failures = destroyAll(serviceName, results);
        storeQuietly("mark " + serviceName + " destroyed",
                () -> repository.updateStatus(serviceName, DeploymentStatus.DESTROYED));
        log.info("[{}] destroyed ({} teardown failure(s))", serviceName, failures.size());
        TeardownException.throwIfAny("Teardown of " + serviceName + " incomplete", failures);
    }

    private List<Throwable> destroyAll(String name, List<DeploymentResult> results) {
        List<Throwable> failures = new ArrayList<>();
        for (DeploymentResult result : results) {
            if (result == null || !result.hasResources()) {
                continue;
            }
            try {
                registry.get(result.provider()).destroy(result);
                log.info("[{}] {} torn down", name, result.provider());
            } catch (RuntimeException e) {
                log.warn("[{}] {} teardown failed: {}", name, result.provider(), e.getMessage());
                failures.add(e);
            }
        }
        return failures;
    }

    /**
     * Operator view: stored record, live router health and each provider's
     * own description of the service.
     */
    public Map<String, Object> status(String serviceName) {
        Live entry = live.get(serviceName);
        DeploymentRecord record = entry != null
                ? DeploymentRecord.of(entry.deployment)
                : repository.findByServiceName(serviceName)
                        .orElseThrow(() -> new ValidationException("Unknown deployment: " + serviceName));

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("deployment", describe(record));

        if (record.routerUrl() != null && record.spotProvider() != null
                && record.status() != DeploymentStatus.DESTROYED) {
            status.put("router", routerClient.health(record.routerUrl())
                    .<Object>map(node -> node)
                    .orElse("unreachable"));
        }

        // stored results carry no health URL, so only a live deployment can be asked
        if (entry != null && record.status() != DeploymentStatus.DESTROYED) {
            Map<String, Object> health = new LinkedHashMap<>();
            legHealth(health, "serverless", entry.deployment.serverless());
            legHealth(health, "spot", entry.deployment.spot());
            status.put("health", health);
        }

        Map<String, Object> providers = new LinkedHashMap<>();
        describeProvider(providers, record.serverlessProvider(), serviceName);
        describeProvider(providers, record.spotProvider(), serviceName);
        status.put("providers", providers);
        return status;
    }

    /**
     * Stored deployments, newest first; destroyed ones only when
     * {@code includeDestroyed}.
     */
    public List<DeploymentRecord> list(boolean includeDestroyed) {
        List<DeploymentRecord> records = repository.findAll();
        if (includeDestroyed) {
            return records;
        }
        return records.stream().filter(r -> r.status() != DeploymentStatus.DESTROYED).toList();
    }

    private void legHealth(Map<String, Object> health, String leg, DeploymentResult result) {
        if (result == null) {
            return;
        }
        try {
            health.put(leg, registry.get(result.provider()).status(result).name());
        } catch (RuntimeException e) {
            health.put(leg, HealthState.UNKNOWN.name());
            log.debug("Health of {} leg unavailable: {}", leg, e.getMessage());
        }
    }

    private void describeProvider(Map<String, Object> providers, String providerName, String serviceName) {
        if (providerName == null) {
            return;
        }
        try {
            InferenceProvider provider = registry.get(providerName);
            providers.put(providerName, provider.describe(serviceName));
        } catch (RuntimeException e) {
            providers.put(providerName, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    static Map<String, Object> describe(DeploymentRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("service_name", record.serviceName());
        map.put("status", record.status().name());
        map.put("model", record.modelName());
        map.put("gpu", record.gpu() + " x" + record.gpuCount());
        map.put("router_url", record.routerUrl());
        map.put("serverless", component(record.serverlessProvider(), record.serverlessStatus().name(),
                record.serverlessEndpoint(), record.serverlessError()));
        if (record.spotProvider() != null) {
            map.put("spot", component(record.spotProvider(), record.spotStatus().name(),
                    record.spotEndpoint(), record.spotError()));
        }
        map.put("created_at", record.createdAt() == null ? null : record.createdAt().toString());
        map.put("updated_at", record.updatedAt() == null ? null : record.updatedAt().toString());
        return map;
    }

    private static Map<String, Object> component(String provider, String status, String endpoint, String error) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("provider", provider);
        map.put("status", status);
        map.put("endpoint", endpoint);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }

    /** Live (in-process) deployment, if this coordinator launched it. */
    public HybridDeployment deployment(String serviceName) {
        Live entry = live.get(serviceName);
        return entry == null ? null : entry.deployment;
    }

    /** In-process router of a live deployment, if any. */
    public RouterNettyServer router(String serviceName) {
        Live entry = live.get(serviceName);
        return entry == null ? null : entry.router;
    }

    private Set<String> namesInUse() {
        Set<String> names = new HashSet<>(live.keySet());
        try {
            names.addAll(repository.activeServiceNames());
        } catch (RuntimeException e) {
            log.warn("Deployment store unavailable, checking only in-process names: {}", e.getMessage());
        }
        return names;
    }

    private RouterNettyServer startRouter(String serviceName) {
        RouterConfig routerConfig = config.routerConfig().copy()
                .withServerlessUrl(null)
                .withServerlessAuthToken(null)
                .withSpotUrl(null);
        RouterNettyServer router = new RouterNettyServer(routerConfig);
        try {
            router.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting router for " + serviceName, e);
        }
        return router;
    }

    private void stopRouter(RouterNettyServer router) {
        if (router == null) {
            return;
        }
        try {
            router.stop();
        } catch (RuntimeException e) {
            log.warn("Error stopping router: {}", e.getMessage());
        }
    }

    private void pushRoute(HybridDeployment deployment, RoutingPatch patch) {
        if (!routerClient.push(deployment.routerUrl(), patch)) {
            log.error("[{}] router at {} did not accept {}", deployment.serviceName(), deployment.routerUrl(),
                    patch);
        }
    }

    private void record(HybridDeployment deployment) {
        storeQuietly("record " + deployment.serviceName(),
                () -> repository.save(DeploymentRecord.of(deployment)));
    }

    private static void storeQuietly(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Could not {}: {}", what, e.getMessage());
        }
    }

    private static void awaitQuietly(Future<?> future, Duration timeout) {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Launch legs did not settle before teardown: {}", e.toString());
        }
    }

    @Override
    public void close() {
        for (Live entry : live.values()) {
            stopRouter(entry.router);
        }
        live.clear();
        executor.close();
    }

    private static final class Live {
        final HybridDeployment deployment;
        final RouterNettyServer router;
        final AtomicBoolean destroying = new AtomicBoolean();
        volatile LaunchHandle handle;

        Live(HybridDeployment deployment, RouterNettyServer router) {
            this.deployment = deployment;
            this.router = router;
        }
    }
}
