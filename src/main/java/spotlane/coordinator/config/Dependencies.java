package spotlane.coordinator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.provider.ProviderRegistry;
import spotlane.coordinator.launch.ParallelLaunchExecutor;
import spotlane.coordinator.model.ScalingPolicy;
import spotlane.coordinator.planner.DeploymentPlanner;
import spotlane.coordinator.repository.DeploymentRepository;
import spotlane.coordinator.service.HybridCoordinator;
import spotlane.coordinator.service.RouterClient;
import spotlane.coordinator.store.Database;
import spotlane.coordinator.store.JdbcDeploymentRepository;

import java.io.File;

/**
 * Manual dependency injection container.
 * Creates and wires all coordinator dependencies.
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv())) {
 *     HybridDeployment d = deps.coordinator().launch(request);
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final DeploymentRepository deploymentRepository;
    private final ProviderRegistry providerRegistry;
    private final DeploymentPlanner planner;
    private final ParallelLaunchExecutor launchExecutor;
    private final RouterClient routerClient;
    private final HybridCoordinator coordinator;

    private Dependencies(CoordinatorConfig config, ProviderRegistry registry) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.deploymentRepository = new JdbcDeploymentRepository(database);

        // Services
        this.providerRegistry = registry;
        this.planner = new DeploymentPlanner(registry);
        this.launchExecutor = new ParallelLaunchExecutor(registry, config.serverlessTimeout(), config.spotTimeout());
        this.routerClient = new RouterClient(config.routerConfig(), config.pushRetries(), config.pushDelay());
        this.coordinator = new HybridCoordinator(registry, planner, launchExecutor, deploymentRepository,
                routerClient, config);

        log.info("Dependencies initialized successfully (providers: {})", registry.names());
    }

    /**
     * Create dependencies with the given config and the built-in providers.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, ProviderRegistry.withDefaults());
    }

    public static Dependencies create(CoordinatorConfig config, ProviderRegistry registry) {
        return new Dependencies(config, registry);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public DeploymentRepository deploymentRepository() {
        return deploymentRepository;
    }

    public ProviderRegistry providerRegistry() {
        return providerRegistry;
    }

    public DeploymentPlanner planner() {
        return planner;
    }

    public RouterClient routerClient() {
        return routerClient;
    }

    public HybridCoordinator coordinator() {
        return coordinator;
    }

    /**
     * Scaling policy from the configured INI file, or the defaults.
     */
    public ScalingPolicy scalingPolicy() {
        if (config.scalingPolicyFile() == null) {
            return ScalingPolicy.defaults();
        }
        return ScalingPolicyLoader.load(new File(config.scalingPolicyFile()));
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            coordinator.close();
        } catch (Exception e) {
            log.warn("Error closing coordinator: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
