package spotlane.coordinator.launch;

import org.junit.jupiter.api.*;
import spotlane.cloud.provider.FakeProvider;
import spotlane.cloud.provider.ProviderRegistry;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.ProviderKind;
import spotlane.coordinator.model.ProviderPlan;
import spotlane.coordinator.planner.DeploymentPlan;
import spotlane.coordinator.planner.DeploymentPlanner;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ParallelLaunchExecutorTest {

    private FakeProvider serverless;
    private FakeProvider spot;
    private ProviderRegistry registry;
    private ParallelLaunchExecutor executor;

    @BeforeEach
    void setUp() {
        serverless = new FakeProvider("fake-serverless", ProviderKind.SERVERLESS, "http://serverless");
        spot = new FakeProvider("fake-spot", ProviderKind.SPOT, "http://spot");
        registry = new ProviderRegistry().register(serverless).register(spot);
    }

    @AfterEach
    void tearDown() {
        serverless.release();
        spot.release();
        if (executor != null) {
            executor.close();
        }
    }

    private DeploymentPlan plan(boolean serverlessOnly) {
        DeployRequest request = DeployRequest.builder()
                .modelName("m")
                .gpu("L4")
                .serviceName("launch-test")
                .serverlessProvider("fake-serverless")
                .spotProvider("fake-spot")
                .serverlessOnly(serverlessOnly)
                .build();
        return new DeploymentPlanner(registry).plan(request, Set.of());
    }

    @Test
    @DisplayName("Serverless resolves while the spot leg is still deploying")
    void serverlessDoesNotWaitForSpot() throws Exception {
        spot.gated();
        executor = new ParallelLaunchExecutor(registry, Duration.ofSeconds(10), Duration.ofSeconds(30));

        LaunchHandle handle = executor.launch(plan(false));
        DeploymentResult result = handle.serverless().get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("http://serverless", result.endpointUrl());
        assertTrue(spot.deployStarted.await(5, TimeUnit.SECONDS), "both legs run at the same time");
        assertFalse(handle.spot().isDone());

        spot.release();
        assertTrue(handle.spot().get(5, TimeUnit.SECONDS).isSuccess());
        handle.allSettled().get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("A throwing provider becomes a failed result and does not affect the other leg")
    void failureIsolation() throws Exception {
        spot.throwing(new IllegalStateException("quota exceeded"));
        executor = new ParallelLaunchExecutor(registry, Duration.ofSeconds(10), Duration.ofSeconds(10));

        LaunchHandle handle = executor.launch(plan(false));

        assertTrue(handle.awaitServerless().isSuccess());
        DeploymentResult spotResult = handle.spot().get(5, TimeUnit.SECONDS);
        assertFalse(spotResult.isSuccess());
        assertTrue(spotResult.error().contains("quota exceeded"));
        assertEquals("launch-test", spotResult.metadata("service_name"));
    }

    @Test
    @DisplayName("A leg past its timeout resolves to a failure and its deploy is interrupted")
    void timeout() throws Exception {
        serverless.gated();
        executor = new ParallelLaunchExecutor(registry, Duration.ofMillis(200), Duration.ofSeconds(10));

        LaunchHandle handle = executor.launch(plan(true));
        DeploymentResult result = handle.awaitServerless();

        assertFalse(result.isSuccess());
        assertTrue(result.error().startsWith("deploy timed out"), result.error());
        assertEquals("launch-test", result.metadata("service_name"));
        assertFalse(handle.hasSpot());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!serverless.interrupted && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(10);
        }
        assertTrue(serverless.interrupted);
    }

    @Test
    @DisplayName("Zero spot timeout means the spot leg waits indefinitely")
    void unboundedSpot() throws Exception {
        spot.gated();
        executor = new ParallelLaunchExecutor(registry, Duration.ofSeconds(10), Duration.ZERO);

        LaunchHandle handle = executor.launch(plan(false));
        TimeUnit.MILLISECONDS.sleep(300);
        assertFalse(handle.spot().isDone());

        spot.release();
        assertTrue(handle.spot().get(5, TimeUnit.SECONDS).isSuccess());
    }

    @Test
    @DisplayName("Cancelling pending legs yields a cancelled failure with the plan metadata")
    void cancelPending() throws Exception {
        spot.gated();
        executor = new ParallelLaunchExecutor(registry, Duration.ofSeconds(10), Duration.ofSeconds(30));

        LaunchHandle handle = executor.launch(plan(false));
        handle.awaitServerless();
        assertTrue(spot.deployStarted.await(5, TimeUnit.SECONDS));

        handle.cancelPending();
        DeploymentResult result = handle.spot().get(5, TimeUnit.SECONDS);

        assertEquals("deploy cancelled", result.error());
        assertEquals("launch-test", result.metadata("service_name"));
        assertTrue(handle.serverless().get().isSuccess(), "finished legs are untouched");
    }

    @Test
    @DisplayName("A deploy that succeeds after its leg timed out is torn down")
    void abandonedSuccessIsDestroyed() throws Exception {
        FakeProvider stubborn = new FakeProvider("stubborn", ProviderKind.SPOT, "http://late") {
            @Override
            public DeploymentResult deploy(ProviderPlan plan) {
                deploys.incrementAndGet();
                deployStarted.countDown();
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(500);
                // ignores interruption, like a blocking SDK call
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
                return DeploymentResult.success("stubborn", "late-1", "http://late", null, null);
            }
        };
        registry.register(stubborn);
        executor = new ParallelLaunchExecutor(registry, Duration.ofSeconds(10), Duration.ofMillis(100));

        DeployRequest request = DeployRequest.builder()
                .modelName("m").gpu("L4").serviceName("late-test")
                .serverlessProvider("fake-serverless").spotProvider("stubborn")
                .build();
        LaunchHandle handle = executor.launch(new DeploymentPlanner(registry).plan(request, Set.of()));

        assertEquals("deploy timed out after 0s", handle.spot().get(5, TimeUnit.SECONDS).error());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (stubborn.destroyed.isEmpty() && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(20);
        }
        assertEquals(List.of("late-1"), stubborn.destroyed.stream().map(DeploymentResult::deploymentId).toList());
    }

    @Test
    @DisplayName("Preflight problems fail the leg without calling deploy")
    void preflightFailure() throws Exception {
        FakeProvider picky = new FakeProvider("picky", ProviderKind.SPOT, "http://x") {
            @Override
            public List<String> preflight(DeployRequest request) {
                return List.of("sky CLI not found");
            }
        };
        registry.register(picky);
        executor = new ParallelLaunchExecutor(registry, Duration.ofSeconds(10), Duration.ofSeconds(10));

        DeployRequest request = DeployRequest.builder()
                .modelName("m").gpu("L4").serviceName("picky-test")
                .serverlessProvider("fake-serverless").spotProvider("picky")
                .build();
        LaunchHandle handle = executor.launch(new DeploymentPlanner(registry).plan(request, Set.of()));

        DeploymentResult result = handle.spot().get(5, TimeUnit.SECONDS);
        assertEquals("Preflight failed: sky CLI not found", result.error());
        assertEquals(0, picky.deploys.get());
    }
}
