package spotlane.cloud.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.catalog.GpuCatalog;
import spotlane.cloud.catalog.ProviderGpu;
import spotlane.coordinator.error.ProviderDeployException;
import spotlane.coordinator.error.TeardownException;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.model.ColdStartMode;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.ProviderKind;
import spotlane.coordinator.model.ProviderPlan;
import spotlane.coordinator.model.ScalingPolicy;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RunPod Serverless: a vLLM worker template plus an endpoint, created over
 * the RunPod REST API.
 */
public class RunPodProvider implements InferenceProvider {
    private static final Logger log = LoggerFactory.getLogger(RunPodProvider.class);

    public static final String NAME = "runpod";
    public static final String DEFAULT_API_BASE = "https://rest.runpod.io/v1";
    public static final String DEFAULT_ENDPOINT_BASE = "https://api.runpod.ai/v2";

    static final String IMAGE = "runpod/worker-v1-vllm:v2.11.3";
    static final int CONTAINER_DISK_GB = 50;
    static final int SCALER_VALUE = 4;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String apiBase;
    private final String endpointBase;
    private final String apiKey;
    private final String hfToken;
    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public RunPodProvider(String apiBase, String endpointBase, String apiKey, String hfToken, HttpClient http) {
        this.apiBase = trimSlash(apiBase);
        this.endpointBase = trimSlash(endpointBase);
        this.apiKey = apiKey;
        this.hfToken = hfToken;
        this.http = http;
    }

    public static RunPodProvider fromEnv() {
        return new RunPodProvider(DEFAULT_API_BASE, DEFAULT_ENDPOINT_BASE,
                System.getenv("RUNPOD_API_KEY"), System.getenv("HF_TOKEN"),
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.SERVERLESS;
    }

    @Override
    public String authToken() {
        return apiKey == null ? "" : apiKey;
    }

    @Override
    public List<String> preflight(DeployRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            return List.of("RUNPOD_API_KEY environment variable is not set");
        }
        return List.of();
    }

    @Override
    public ProviderPlan plan(DeployRequest request, String vllmCommand) {
        String endpointName = request.serviceName() + "-serverless";
        ProviderGpu gpu = GpuCatalog.offering(NAME, request.gpu())
                .orElseThrow(() -> new ValidationException("Unknown GPU type for RunPod: '" + request.gpu()
                        + "'. Supported: " + GpuCatalog.offerings(NAME).stream().map(ProviderGpu::gpu).toList()));
        ScalingPolicy.ServerlessScaling scaling = request.scaling().serverless();
        boolean fastBoot = request.coldStartMode() == ColdStartMode.FAST_BOOT;

        Map<String, String> env = new LinkedHashMap<>();
        env.put("MODEL_NAME", request.modelName());
        env.put("MAX_MODEL_LEN", String.valueOf(request.maxModelLen()));
        env.put("TENSOR_PARALLEL_SIZE", String.valueOf(request.tpSize()));
        env.put("GPU_MEMORY_UTILIZATION", "0.95");
        env.put("MAX_CONCURRENCY", String.valueOf(scaling.concurrency()));
        env.put("DISABLE_LOG_REQUESTS", "true");
        if (fastBoot) {
            env.put("ENFORCE_EAGER", "true");
        }
        if (hfToken != null && !hfToken.isBlank()) {
            env.put("HF_TOKEN", hfToken);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("endpoint_name", endpointName);
        metadata.put("image_name", IMAGE);
        metadata.put("gpu_type_id", gpu.providerGpuId());
        metadata.put("gpu_count", String.valueOf(request.gpuCount()));
        metadata.put("workers_min", String.valueOf(scaling.workersMin()));
        metadata.put("workers_max", String.valueOf(scaling.workersMax()));
        metadata.put("idle_timeout", String.valueOf(scaling.scaledownWindowSeconds()));
        metadata.put("execution_timeout_ms", String.valueOf(scaling.timeoutSeconds() * 1000L));
        metadata.put("flashboot", String.valueOf(fastBoot));

        return new ProviderPlan(NAME, "", env, metadata);
    }

    @Override
    public DeploymentResult deploy(ProviderPlan plan) {
        String endpointName = plan.requireMetadata("endpoint_name");
        if (apiKey == null || apiKey.isBlank()) {
            return DeploymentResult.failure(NAME, "RUNPOD_API_KEY environment variable is not set",
                    Map.of("endpoint_name", endpointName));
        }

        Map<String, Object> templatePayload = new LinkedHashMap<>();
        templatePayload.put("name", endpointName);
        templatePayload.put("imageName", plan.requireMetadata("image_name"));
        templatePayload.put("containerDiskInGb", CONTAINER_DISK_GB);
        templatePayload.put("env", plan.env());
        templatePayload.put("isServerless", true);

        String templateId;
        log.info("Creating RunPod template: {}", endpointName);
        try {
            templateId = post("/templates", templatePayload).path("id").asText(null);
            if (templateId == null) {
                throw new ProviderDeployException(NAME, "response has no template id");
            }
        } catch (ProviderDeployException e) {
            log.error("RunPod template creation failed: {}", e.getMessage());
            return DeploymentResult.failure(NAME, "Template creation failed: " + e.getMessage(),
                    Map.of("endpoint_name", endpointName));
        }

        Map<String, Object> endpointPayload = new LinkedHashMap<>();
        endpointPayload.put("name", endpointName);
        endpointPayload.put("templateId", templateId);
        endpointPayload.put("gpuTypeIds", List.of(plan.requireMetadata("gpu_type_id")));
        endpointPayload.put("gpuCount", Integer.parseInt(plan.requireMetadata("gpu_count")));
        endpointPayload.put("workersMin", Integer.parseInt(plan.requireMetadata("workers_min")));
        endpointPayload.put("workersMax", Integer.parseInt(plan.requireMetadata("workers_max")));
        endpointPayload.put("idleTimeout", Integer.parseInt(plan.requireMetadata("idle_timeout")));
        endpointPayload.put("executionTimeoutMs", Long.parseLong(plan.requireMetadata("execution_timeout_ms")));
        endpointPayload.put("flashboot", Boolean.parseBoolean(plan.metadata("flashboot")));
        endpointPayload.put("scalerType", "QUEUE_DELAY");
        endpointPayload.put("scalerValue", SCALER_VALUE);

        String endpointId;
        log.info("Creating RunPod endpoint: {}", endpointName);
        try {
            endpointId = post("/endpoints", endpointPayload).path("id").asText(null);
            if (endpointId == null) {
                throw new ProviderDeployException(NAME, "response has no endpoint id");
            }
        } catch (ProviderDeployException e) {
            log.error("RunPod endpoint creation failed: {}", e.getMessage());
            log.info("Cleaning up template {} after endpoint failure", templateId);
            try {
                delete("/templates/" + templateId);
            } catch (ProviderDeployException cleanup) {
                log.warn("Failed to clean up template {}: {}", templateId, cleanup.getMessage());
            }
            return DeploymentResult.failure(NAME, "Endpoint creation failed: " + e.getMessage(),
                    Map.of("endpoint_name", endpointName, "template_id", templateId));
        }

        String endpointUrl = endpointBase + "/" + endpointId + "/openai/v1";
        String healthUrl = endpointBase + "/" + endpointId + "/health";
        log.info("RunPod endpoint {} deployed at {}", endpointName, endpointUrl);
        return DeploymentResult.success(NAME, endpointId, endpointUrl, healthUrl, Map.of(
                "endpoint_id", endpointId,
                "template_id", templateId,
                "endpoint_name", endpointName));
    }

    @Override
    public void destroy(DeploymentResult result) {
        String endpointId = result.metadata("endpoint_id");
        String templateId = result.metadata("template_id");
        List<Exception> failures = new ArrayList<>();

        if (endpointId != null) {
            log.info("Deleting RunPod endpoint {}", endpointId);
            try {
                delete("/endpoints/" + endpointId);
            } catch (ProviderDeployException e) {
                log.warn("Failed to delete endpoint {}: {}", endpointId, e.getMessage());
                failures.add(e);
            }
        } else {
            log.warn("No endpoint_id in metadata, skipping endpoint deletion");
        }

        if (templateId != null) {
            log.info("Deleting RunPod template {}", templateId);
            try {
                delete("/templates/" + templateId);
            } catch (ProviderDeployException e) {
                log.warn("Failed to delete template {}: {}", templateId, e.getMessage());
                failures.add(e);
            }
        }
        TeardownException.throwIfAny("RunPod teardown incomplete", failures);
    }

    @Override
    public Map<String, Object> describe(String serviceName) {
        String endpointName = serviceName + "-serverless";
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("provider", NAME);
        out.put("endpoint_name", endpointName);
        try {
            JsonNode endpoints = get("/endpoints");
            for (JsonNode ep : endpoints) {
                String name = ep.path("name").asText("");
                // flashboot endpoints get a " -fb" suffix
                if (name.equals(endpointName) || name.equals(endpointName + " -fb")) {
                    out.put("endpoint_id", ep.path("id").asText());
                    out.put("status", "running");
                    return out;
                }
            }
            out.put("status", "not found");
        } catch (ProviderDeployException e) {
            out.put("status", "unknown");
            out.put("error", e.getMessage());
        }
        return out;
    }

    private JsonNode post(String path, Object payload) {
        try {
            HttpRequest request = authorized(path)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(payload)))
                    .build();
            return send(request);
        } catch (IOException e) {
            throw new ProviderDeployException(NAME, e.toString(), e);
        }
    }

    private JsonNode get(String path) {
        return send(authorized(path).GET().build());
    }

    private void delete(String path) {
        send(authorized(path).DELETE().build());
    }

    private HttpRequest.Builder authorized(String path) {
        return HttpRequest.newBuilder(URI.create(apiBase + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bearer " + apiKey);
    }

    private JsonNode send(HttpRequest request) {
        try {
            HttpResponse<byte[]> response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() / 100 != 2) {
                throw new ProviderDeployException(NAME, request.method() + " " + request.uri().getPath()
                        + " returned HTTP " + response.statusCode());
            }
            byte[] body = response.body();
            return body.length == 0 ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (IOException e) {
            throw new ProviderDeployException(NAME, e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderDeployException(NAME, "interrupted", e);
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
