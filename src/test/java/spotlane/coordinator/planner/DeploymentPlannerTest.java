package spotlane.coordinator.planner;

import org.junit.jupiter.api.*;
import spotlane.cloud.provider.FakeProvider;
import spotlane.cloud.provider.ProviderRegistry;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.model.ColdStartMode;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.ProviderKind;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentPlannerTest {

    private FakeProvider runpod;
    private FakeProvider skyserve;
    private DeploymentPlanner planner;

    @BeforeEach
    void setUp() {
        runpod = new FakeProvider("runpod", ProviderKind.SERVERLESS, "https://api.runpod.ai/v2/ep/openai");
        skyserve = new FakeProvider("skyserve", ProviderKind.SPOT, "http://1.2.3.4:30001");
        ProviderRegistry registry = new ProviderRegistry().register(runpod).register(skyserve);
        planner = new DeploymentPlanner(registry);
    }

    private DeployRequest.Builder request() {
        return DeployRequest.builder()
                .modelName("Qwen/Qwen2.5-7B-Instruct")
                .gpu("H100")
                .serviceName("qwen-test");
    }

    @Test
    @DisplayName("Hybrid request yields one plan per backend sharing the vLLM command")
    void hybridPlan() {
        DeploymentPlan plan = planner.plan(request().build(), Set.of());

        assertTrue(plan.hasSpot());
        assertEquals("runpod", plan.serverless().provider());
        assertEquals("skyserve", plan.spot().provider());
        assertEquals(plan.vllmCommand(), plan.serverless().renderedScript());
        assertEquals(plan.vllmCommand(), plan.spot().renderedScript());
        assertEquals(2, plan.plans().size());
    }

    @Test
    @DisplayName("Serverless-only request has no spot plan and ignores the spot provider")
    void serverlessOnly() {
        DeploymentPlan plan = planner.plan(request().serverlessOnly(true).spotProvider("nope").build(), Set.of());
        assertFalse(plan.hasSpot());
        assertNull(plan.spot());
        assertEquals(1, plan.plans().size());
    }

    @Test
    @DisplayName("vLLM command reflects model, context length, TP size and cold start mode")
    void vllmCommand() {
        String eager = DeploymentPlanner.buildVllmCommand(request().gpuCount(2).tpSize(2).maxModelLen(8192).build());
        assertEquals("vllm serve Qwen/Qwen2.5-7B-Instruct --host 0.0.0.0 --port 8001 --max-model-len 8192 "
                + "--tensor-parallel-size 2 --disable-log-requests --enforce-eager", eager);

        String graphs = DeploymentPlanner.buildVllmCommand(
                request().coldStartMode(ColdStartMode.NO_FAST_BOOT).build());
        assertFalse(graphs.contains("--enforce-eager"));
        assertTrue(graphs.endsWith("--disable-log-requests"));
    }

    @Test
    @DisplayName("All problems are reported together and no provider is called")
    void collectsErrors() {
        DeployRequest bad = request()
                .gpu("GTX1080")
                .gpuCount(1)
                .tpSize(2)
                .maxModelLen(0)
                .serviceName("Bad_Name")
                .build();

        ValidationException e = assertThrows(ValidationException.class, () -> planner.plan(bad, Set.of()));

        String message = e.getMessage();
        assertTrue(message.contains("unknown GPU 'GTX1080'"), message);
        assertTrue(message.contains("tensor parallel size"), message);
        assertTrue(message.contains("max model length"), message);
        assertTrue(message.contains("service name 'Bad_Name'"), message);
        assertEquals(0, runpod.deploys.get());
    }

    @Test
    @DisplayName("Service names held by live deployments are rejected")
    void duplicateName() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> planner.plan(request().build(), Set.of("qwen-test")));
        assertTrue(e.getMessage().contains("already used"));
    }

    @Test
    @DisplayName("Unknown providers and role mismatches are rejected")
    void providerChecks() {
        ValidationException unknown = assertThrows(ValidationException.class,
                () -> planner.plan(request().serverlessProvider("modal").build(), Set.of()));
        assertTrue(unknown.getMessage().contains("unknown serverless provider 'modal'"), unknown.getMessage());

        ValidationException swapped = assertThrows(ValidationException.class,
                () -> planner.plan(request().spotProvider("runpod").build(), Set.of()));
        assertTrue(swapped.getMessage().contains("is a serverless provider, not spot"), swapped.getMessage());
    }

    @Test
    @DisplayName("A GPU the serverless catalog does not offer is rejected")
    void gpuNotOffered() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> planner.plan(request().gpu("T4").build(), Set.of()));
        assertTrue(e.getMessage().contains("does not offer GPU T4"), e.getMessage());
    }

    @Test
    @DisplayName("A blank service name is replaced by a generated one")
    void generatedName() {
        DeployRequest generated = request().serviceName(" ").build();
        assertTrue(generated.serviceName().startsWith("spotlane-"));
        assertDoesNotThrow(() -> planner.plan(generated, Set.of()));
    }
}
