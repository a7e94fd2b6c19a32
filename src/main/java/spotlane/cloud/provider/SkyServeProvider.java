package spotlane.cloud.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.catalog.GpuCatalog;
import spotlane.cloud.template.TemplateRenderer;
import spotlane.cloud.util.ProcessRunner;
import spotlane.coordinator.error.TeardownException;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.ProviderKind;
import spotlane.coordinator.model.ProviderPlan;
import spotlane.coordinator.model.ScalingPolicy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Spot replicas managed by SkyServe. Drives the {@code sky} CLI: the service
 * YAML is rendered at plan time, {@code sky serve up} launches it and the
 * endpoint is polled until SkyServe publishes it.
 */
public class SkyServeProvider implements InferenceProvider {
    private static final Logger log = LoggerFactory.getLogger(SkyServeProvider.class);

    public static final String NAME = "skyserve";
    static final String TEMPLATE = "templates/skyserve_vllm.yaml.tpl";
    static final String VLLM_PORT = "8001";

    private static final Duration UP_TIMEOUT = Duration.ofSeconds(600);
    private static final Duration STATUS_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DOWN_TIMEOUT = Duration.ofSeconds(120);
    private static final int DOWN_ATTEMPTS = 6;

    private final ProcessRunner runner;
    private final int pollAttempts;
    private final Duration pollDelay;
    private final Duration downRetryDelay;

    public SkyServeProvider() {
        this(new ProcessRunner(), 10, Duration.ofSeconds(15), Duration.ofSeconds(10));
    }

    public SkyServeProvider(ProcessRunner runner, int pollAttempts, Duration pollDelay, Duration downRetryDelay) {
        this.runner = runner;
        this.pollAttempts = pollAttempts;
        this.pollDelay = pollDelay;
        this.downRetryDelay = downRetryDelay;
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
        try {
            ProcessRunner.Result r = runner.run(STATUS_TIMEOUT, List.of("sky", "--version"));
            return r.ok() ? List.of() : List.of("sky CLI is not working: " + r.stderr().trim());
        } catch (IOException e) {
            return List.of("sky CLI not found on PATH (pip install skypilot)");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of("interrupted");
        }
    }

    @Override
    public ProviderPlan plan(DeployRequest request, String vllmCommand) {
        String serviceName = request.serviceName() + "-spot";
        ScalingPolicy.SpotScaling spot = request.scaling().spot();

        String regionBlock = "";
        if (request.region() != null) {
            regionBlock = "  any_of:\n    - infra: " + request.spotCloud().toLowerCase(Locale.ROOT) + "/"
                    + request.region();
        }

        Map<String, String> values = new LinkedHashMap<>();
        values.put("gpu", GpuCatalog.skyPilotName(request.gpu()));
        values.put("gpu_count", String.valueOf(request.gpuCount()));
        values.put("port", VLLM_PORT);
        values.put("vllm_cmd", vllmCommand);
        values.put("vllm_version", request.vllmVersion());
        values.put("min_replicas", String.valueOf(spot.minReplicas()));
        values.put("max_replicas", String.valueOf(spot.maxReplicas()));
        values.put("target_qps", String.valueOf(spot.targetQps()));
        values.put("upscale_delay", String.valueOf(spot.upscaleDelaySeconds()));
        values.put("downscale_delay", String.valueOf(spot.downscaleDelaySeconds()));
        values.put("region_block", regionBlock);

        String rendered = TemplateRenderer.renderResource(TEMPLATE, values);
        return new ProviderPlan(NAME, rendered, Map.of(), Map.of("service_name", serviceName));
    }

    @Override
    public DeploymentResult deploy(ProviderPlan plan) {
        String serviceName = plan.requireMetadata("service_name");
        Map<String, String> metadata = Map.of("service_name", serviceName);
        Path yaml = null;
        try {
            yaml = Files.createTempFile("spotlane_sky_", ".yaml");
            Files.writeString(yaml, plan.renderedScript(), StandardCharsets.UTF_8);

            log.info("Launching SkyServe service {} from {}", serviceName, yaml);
            ProcessRunner.Result up = runner.run(UP_TIMEOUT,
                    List.of("sky", "serve", "up", yaml.toString(), "--service-name", serviceName, "-y"));
            if (!up.ok()) {
                String why = up.timedOut() ? "timed out after " + UP_TIMEOUT.toSeconds() + "s" : up.stderr().trim();
                log.error("sky serve up failed for {}: {}", serviceName, why);
                return DeploymentResult.failure(NAME, "sky serve up failed: " + why, metadata);
            }

            String endpoint = pollEndpoint(serviceName);
            if (endpoint == null) {
                log.warn("sky serve up succeeded but no endpoint yet for {}", serviceName);
                return DeploymentResult.failure(NAME, "Endpoint not yet available (still provisioning)", metadata);
            }
            log.info("SkyServe {} endpoint: {}", serviceName, endpoint);
            return DeploymentResult.success(NAME, serviceName, endpoint, endpoint + "/health", metadata);
        } catch (IOException e) {
            log.error("SkyServe launch of {} failed", serviceName, e);
            return DeploymentResult.failure(NAME, "sky serve up failed: " + e.getMessage(), metadata);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeploymentResult.failure(NAME, "launch interrupted", metadata);
        } finally {
            if (yaml != null) {
                try {
                    Files.deleteIfExists(yaml);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", yaml, e.toString());
                }
            }
        }
    }

    @Override
    public void destroy(DeploymentResult result) {
        String serviceName = result.metadata("service_name");
        if (serviceName == null) {
            log.warn("No service_name in metadata, cannot destroy");
            return;
        }
        log.info("Tearing down SkyServe service {}", serviceName);
        List<Exception> failures = new ArrayList<>();
        try {
            for (int attempt = 1; attempt <= DOWN_ATTEMPTS; attempt++) {
                runner.run(DOWN_TIMEOUT, List.of("sky", "serve", "down", serviceName, "-y"));
                if (isGone(serviceName)) {
                    return;
                }
                log.warn("Service {} still exists after sky serve down (attempt {}/{}), retrying",
                        serviceName, attempt, DOWN_ATTEMPTS);
                if (attempt < DOWN_ATTEMPTS) {
                    Thread.sleep(downRetryDelay.toMillis());
                }
            }
            failures.add(new IllegalStateException("Could not confirm deletion of " + serviceName));
        } catch (IOException e) {
            failures.add(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failures.add(e);
        }
        TeardownException.throwIfAny("SkyServe teardown of " + serviceName + " incomplete", failures);
    }

    @Override
    public Map<String, Object> describe(String serviceName) {
        String spotService = serviceName + "-spot";
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("provider", NAME);
        out.put("service_name", spotService);
        try {
            out.put("raw", runner.run(STATUS_TIMEOUT, List.of("sky", "serve", "status", spotService)).stdout().trim());
        } catch (IOException e) {
            out.put("error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.put("error", "interrupted");
        }
        return out;
    }

    private String pollEndpoint(String serviceName) throws InterruptedException {
        for (int attempt = 1; attempt <= pollAttempts; attempt++) {
            try {
                ProcessRunner.Result r = runner.run(STATUS_TIMEOUT,
                        List.of("sky", "serve", "status", serviceName, "--endpoint"));
                String endpoint = normalizeEndpoint(r.stdout());
                if (endpoint != null) {
                    return endpoint;
                }
            } catch (IOException e) {
                log.debug("Endpoint poll attempt {}/{} failed: {}", attempt, pollAttempts, e.toString());
            }
            if (attempt < pollAttempts) {
                Thread.sleep(pollDelay.toMillis());
            }
        }
        return null;
    }

    /** {@code sky serve status --endpoint} prints a URL, a bare host:port, or nothing. */
    static String normalizeEndpoint(String output) {
        String endpoint = output == null ? "" : output.trim();
        if (endpoint.isEmpty() || endpoint.contains(" ") || endpoint.contains("\n")) {
            return null;
        }
        if (endpoint.startsWith("http://") || endpoint.startsWith("https://")) {
            return endpoint;
        }
        return endpoint.matches("[\\w.-]+:\\d+") ? "http://" + endpoint : null;
    }

    private boolean isGone(String serviceName) {
        try {
            ProcessRunner.Result check = runner.run(STATUS_TIMEOUT, List.of("sky", "serve", "status", serviceName));
            if (check.combined().contains("No existing services")) {
                return true;
            }
            if (check.stdout().contains("SHUTTING_DOWN")) {
                log.info("Service {} still shutting down", serviceName);
                return false;
            }
            return !check.stdout().contains(serviceName);
        } catch (IOException e) {
            // controller may still be starting
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
