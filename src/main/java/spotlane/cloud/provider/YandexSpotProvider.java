package spotlane.cloud.provider;

import com.google.protobuf.InvalidProtocolBufferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.auth.AuthService;
import spotlane.cloud.catalog.GpuCatalog;
import spotlane.cloud.catalog.ProviderGpu;
import spotlane.cloud.config.CloudConfig;
import spotlane.cloud.config.IniLoader;
import spotlane.cloud.creator.VMCreator;
import spotlane.cloud.creator.VmSpec;
import spotlane.cloud.manager.VMManager;
import spotlane.cloud.util.CloudInitBuilder;
import spotlane.coordinator.error.TeardownException;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.ProviderKind;
import spotlane.coordinator.model.ProviderPlan;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Spot capacity as a preemptible GPU VM on Yandex Compute. cloud-init starts
 * vLLM in Docker; the endpoint is the VM's public address.
 */
public class YandexSpotProvider implements InferenceProvider {
    private static final Logger log = LoggerFactory.getLogger(YandexSpotProvider.class);

    public static final String NAME = "yandex";
    static final String VLLM_PORT = "8001";

    // per-GPU cores / memory for each GPU platform
    private static final Map<String, int[]> PLATFORM_SHAPES = Map.of(
            "gpu-standard-v3", new int[]{28, 119},
            "standard-v3-t4", new int[]{4, 16});

    private final CloudConfig cloud;
    private final Supplier<AuthService> auth;
    private final String hfToken;
    private final Duration operationWait;

    public YandexSpotProvider(CloudConfig cloud, Supplier<AuthService> auth, String hfToken, Duration operationWait) {
        this.cloud = cloud;
        this.auth = auth;
        this.hfToken = hfToken;
        this.operationWait = operationWait;
    }

    /**
     * Cloud placement from the INI file named by {@code SPOTLANE_YC_INI}
     * (default {@code yandex.ini}); credentials from {@code OAUTH_TOKEN}.
     */
    public static YandexSpotProvider fromEnv() {
        String path = System.getenv().getOrDefault("SPOTLANE_YC_INI", "yandex.ini");
        File file = new File(path);
        CloudConfig cloud = file.isFile() ? IniLoader.load(file).orElse(null) : null;
        return new YandexSpotProvider(cloud, memoize(AuthService::new), System.getenv("HF_TOKEN"),
                Duration.ofMinutes(10));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.SPOT;
    }

    @Override
    public List<String> preflight(DeployRequest request) {
        List<String> problems = new ArrayList<>();
        if (cloud == null) {
            problems.add("Yandex Cloud config not found (SPOTLANE_YC_INI)");
        }
        if (!AuthService.hasToken(AuthService.TOKEN_ENV)) {
            problems.add(AuthService.TOKEN_ENV + " environment variable is not set");
        }
        return problems;
    }

    @Override
    public ProviderPlan plan(DeployRequest request, String vllmCommand) {
        if (cloud == null) {
            throw new ValidationException("Yandex Cloud config not found; point SPOTLANE_YC_INI at an INI file "
                    + "with [AUTH] [NETWORK] [VM] [SSH] sections");
        }
        String platformId = cloud.platformId();
        if (platformId == null || platformId.isBlank()) {
            platformId = GpuCatalog.offering(NAME, request.gpu())
                    .map(ProviderGpu::providerGpuId)
                    .orElseThrow(() -> new ValidationException("Unknown GPU type for Yandex Compute: '"
                            + request.gpu() + "'. Supported: "
                            + GpuCatalog.offerings(NAME).stream().map(ProviderGpu::gpu).toList()));
        }
        int[] shape = PLATFORM_SHAPES.getOrDefault(platformId, new int[]{8, 48});
        int cores = cloud.cpu() > 0 ? cloud.cpu() : shape[0] * request.gpuCount();
        int memoryGb = cloud.ramGb() > 0 ? cloud.ramGb() : shape[1] * request.gpuCount();

        String userData = CloudInitBuilder.buildVllmUserData(cloud.sshUser(), cloud.sshPublicKey(),
                request.vllmVersion(), vllmCommand, VLLM_PORT, hfToken);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("vm_name", request.serviceName() + "-spot");
        metadata.put("folder_id", cloud.folderId());
        metadata.put("zone_id", request.region() != null ? request.region() : cloud.zoneId());
        metadata.put("platform_id", platformId);
        metadata.put("image_id", cloud.imageId());
        metadata.put("subnet_id", cloud.subnetId());
        metadata.put("security_group_id", cloud.securityGroupId() == null ? "" : cloud.securityGroupId());
        metadata.put("cores", String.valueOf(cores));
        metadata.put("memory_gb", String.valueOf(memoryGb));
        metadata.put("disk_gb", String.valueOf(cloud.diskGb()));
        metadata.put("gpus", String.valueOf(request.gpuCount()));
        metadata.put("public_ip", String.valueOf(cloud.publicIp()));
        metadata.put("preemptible", String.valueOf(cloud.preemptible()));
        return new ProviderPlan(NAME, userData, Map.of(), metadata);
    }

    static VmSpec toVmSpec(ProviderPlan plan) {
        String sg = plan.metadata("security_group_id");
        return new VmSpec(
                plan.requireMetadata("folder_id"),
                plan.requireMetadata("zone_id"),
                plan.requireMetadata("platform_id"),
                plan.requireMetadata("vm_name"),
                plan.requireMetadata("image_id"),
                plan.requireMetadata("subnet_id"),
                sg == null || sg.isBlank() ? List.of() : List.of(sg),
                Integer.parseInt(plan.requireMetadata("cores")),
                Integer.parseInt(plan.requireMetadata("memory_gb")),
                Integer.parseInt(plan.requireMetadata("disk_gb")),
                Integer.parseInt(plan.requireMetadata("gpus")),
                Boolean.parseBoolean(plan.metadata("public_ip")),
                Boolean.parseBoolean(plan.metadata("preemptible")),
                plan.renderedScript());
    }

    @Override
    public DeploymentResult deploy(ProviderPlan plan) {
        VmSpec spec = toVmSpec(plan);
        AtomicReference<String> instanceId = new AtomicReference<>();
        try {
            AuthService service = auth.get();
            new VMCreator(service).create(spec, operationWait, instanceId::set);
            String ip = new VMManager(service).getPublicIp(instanceId.get());
            if (ip.isBlank()) {
                return DeploymentResult.failure(NAME, "VM " + instanceId.get() + " has no public IP",
                        failureMetadata(spec, instanceId.get()));
            }
            String endpoint = "http://" + ip + ":" + VLLM_PORT;
            log.info("Yandex spot VM {} up at {}", spec.name(), endpoint);
            return DeploymentResult.success(NAME, instanceId.get(), endpoint, endpoint + "/health", Map.of(
                    "instance_id", instanceId.get(),
                    "vm_name", spec.name(),
                    "folder_id", spec.folderId()));
        } catch (InvalidProtocolBufferException e) {
            log.error("Unexpected create operation metadata for {}", spec.name(), e);
            return DeploymentResult.failure(NAME, "Create failed: " + e.getMessage(),
                    failureMetadata(spec, instanceId.get()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeploymentResult.failure(NAME, "Create interrupted", failureMetadata(spec, instanceId.get()));
        } catch (RuntimeException e) {
            log.error("Yandex VM creation failed for {}: {}", spec.name(), e.toString());
            return DeploymentResult.failure(NAME, "Create failed: " + e.getMessage(),
                    failureMetadata(spec, instanceId.get()));
        }
    }

    private static Map<String, String> failureMetadata(VmSpec spec, String instanceId) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("vm_name", spec.name());
        metadata.put("folder_id", spec.folderId());
        if (instanceId != null) {
            metadata.put("instance_id", instanceId);
        }
        return metadata;
    }

    @Override
    public void destroy(DeploymentResult result) {
        String instanceId = result.metadata("instance_id");
        if (instanceId == null) {
            log.warn("No instance_id in metadata for {}, nothing to delete", result.metadata("vm_name"));
            return;
        }
        try {
            new VMManager(auth.get()).delete(instanceId, operationWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TeardownException("Delete of VM " + instanceId + " interrupted", List.of(e));
        } catch (RuntimeException e) {
            throw new TeardownException("Delete of VM " + instanceId + " failed", List.of(e));
        }
    }

    @Override
    public Map<String, Object> describe(String serviceName) {
        String vmName = serviceName + "-spot";
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("provider", NAME);
        out.put("vm_name", vmName);
        if (cloud == null) {
            out.put("status", "unknown");
            out.put("error", "no cloud config");
            return out;
        }
        try {
            new VMManager(auth.get()).findByName(cloud.folderId(), vmName).ifPresentOrElse(instance -> {
                out.put("instance_id", instance.getId());
                out.put("status", instance.getStatus().toString());
            }, () -> out.put("status", "not found"));
        } catch (RuntimeException e) {
            out.put("status", "unknown");
            out.put("error", e.getMessage());
        }
        return out;
    }

    private static <T> Supplier<T> memoize(Supplier<T> delegate) {
        return new Supplier<>() {
            private T value;

            @Override
            public synchronized T get() {
                if (value == null) {
                    value = delegate.get();
                }
                return value;
            }
        };
    }
}
