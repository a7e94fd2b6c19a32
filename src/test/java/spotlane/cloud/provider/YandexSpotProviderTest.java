package spotlane.cloud.provider;

import org.junit.jupiter.api.*;
import spotlane.cloud.auth.AuthService;
import spotlane.cloud.config.CloudConfig;
import spotlane.cloud.creator.VmSpec;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.ProviderPlan;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class YandexSpotProviderTest {

    private static final Supplier<AuthService> NO_AUTH = () -> {
        throw new AssertionError("cloud API must not be called");
    };

    private static CloudConfig cloud(String platformId, int cpu, int ramGb) {
        return new CloudConfig(null, "b1g-folder", "ru-central1-a", "e9b-subnet", "enp-sg", true,
                "fd8-gpu-image", platformId, cpu, ramGb, CloudConfig.DEFAULT_DISK_GB, true,
                "ubuntu", "ssh-ed25519 AAAA test@host");
    }

    private static CloudConfig cloud() {
        return cloud(null, 0, 0);
    }

    private static DeployRequest request() {
        return DeployRequest.builder()
                .modelName("Qwen/Qwen2.5-7B-Instruct")
                .gpu("A100_80GB")
                .serviceName("svc-three")
                .build();
    }

    @Test
    @DisplayName("Plan picks the GPU platform and sizes the VM per GPU")
    void plan() {
        YandexSpotProvider provider = new YandexSpotProvider(cloud(), NO_AUTH, "hf-secret", Duration.ofMinutes(1));

        ProviderPlan plan = provider.plan(request(), "vllm serve Qwen/Qwen2.5-7B-Instruct --port 8001");

        assertEquals("svc-three-spot", plan.metadata("vm_name"));
        assertEquals("gpu-standard-v3", plan.metadata("platform_id"));
        assertEquals("28", plan.metadata("cores"));
        assertEquals("119", plan.metadata("memory_gb"));
        assertEquals("ru-central1-a", plan.metadata("zone_id"));
        assertTrue(plan.renderedScript().startsWith("#cloud-config"));
        assertTrue(plan.renderedScript().contains("HF_TOKEN=hf-secret"));
    }

    @Test
    @DisplayName("Explicit INI sizing and a request region win over defaults")
    void planOverrides() {
        YandexSpotProvider provider = new YandexSpotProvider(cloud("custom-gpu", 16, 64), NO_AUTH, null,
                Duration.ofMinutes(1));

        ProviderPlan plan = provider.plan(request().toBuilder().region("ru-central1-b").build(), "vllm serve x");

        assertEquals("custom-gpu", plan.metadata("platform_id"));
        assertEquals("16", plan.metadata("cores"));
        assertEquals("64", plan.metadata("memory_gb"));
        assertEquals("ru-central1-b", plan.metadata("zone_id"));
    }

    @Test
    @DisplayName("Planning without cloud config or for an unsupported GPU is a validation error")
    void planRejected() {
        YandexSpotProvider unconfigured = new YandexSpotProvider(null, NO_AUTH, null, Duration.ofMinutes(1));
        assertThrows(ValidationException.class, () -> unconfigured.plan(request(), "vllm serve x"));

        YandexSpotProvider provider = new YandexSpotProvider(cloud(), NO_AUTH, null, Duration.ofMinutes(1));
        assertThrows(ValidationException.class,
                () -> provider.plan(request().toBuilder().gpu("L4").build(), "vllm serve x"));
    }

    @Test
    @DisplayName("The plan converts into a complete VM spec")
    void vmSpec() {
        YandexSpotProvider provider = new YandexSpotProvider(cloud(), NO_AUTH, null, Duration.ofMinutes(1));

        VmSpec spec = YandexSpotProvider.toVmSpec(provider.plan(request(), "vllm serve x"));

        assertEquals("svc-three-spot", spec.name());
        assertEquals(List.of("enp-sg"), spec.securityGroupIds());
        assertEquals(100, spec.diskGb());
        assertEquals(1, spec.gpus());
        assertTrue(spec.preemptible());
        assertTrue(spec.assignPublicIp());
    }

    @Test
    @DisplayName("Teardown without an instance id does not touch the cloud")
    void destroyWithoutInstance() {
        YandexSpotProvider provider = new YandexSpotProvider(cloud(), NO_AUTH, null, Duration.ofMinutes(1));

        assertDoesNotThrow(() -> provider.destroy(DeploymentResult.failure(YandexSpotProvider.NAME,
                "Create failed", Map.of("vm_name", "svc-three-spot"))));
    }

    @Test
    @DisplayName("Describe without cloud config reports unknown")
    void describeUnconfigured() {
        YandexSpotProvider provider = new YandexSpotProvider(null, NO_AUTH, null, Duration.ofMinutes(1));

        assertEquals("unknown", provider.describe("svc-three").get("status"));
    }
}
