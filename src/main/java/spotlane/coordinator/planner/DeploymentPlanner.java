package spotlane.coordinator.planner;

import spotlane.cloud.catalog.GpuCatalog;
import spotlane.cloud.provider.InferenceProvider;
import spotlane.cloud.provider.ProviderRegistry;
import spotlane.cloud.template.TemplateRenderer;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.model.DeployRequest;
import spotlane.coordinator.model.ProviderKind;
import spotlane.coordinator.model.ProviderPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a {@link DeployRequest} into provider plans. No network and no
 * filesystem writes: everything that can be rejected up front is rejected
 * here, before any provider is invoked.
 */
public class DeploymentPlanner {

    static final String VLLM_TEMPLATE = "templates/vllm_serve_cmd.txt";
    static final String VLLM_PORT = "8001";
    private static final Pattern SERVICE_NAME = Pattern.compile("[a-z][a-z0-9-]{2,47}");

    private final ProviderRegistry registry;

    public DeploymentPlanner(ProviderRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param namesInUse service names of deployments that are not destroyed
     * @throws ValidationException listing every problem found
     */
    public DeploymentPlan plan(DeployRequest request, Set<String> namesInUse) {
        validate(request, namesInUse);

        InferenceProvider serverlessProvider = registry.get(request.serverlessProvider());
        InferenceProvider spotProvider = request.serverlessOnly() ? null : registry.get(request.spotProvider());
        String vllmCommand = buildVllmCommand(request);

        ProviderPlan serverless = serverlessProvider.plan(request, vllmCommand);
        ProviderPlan spot = spotProvider == null ? null : spotProvider.plan(request, vllmCommand);
        return new DeploymentPlan(request, vllmCommand, serverless, spot);
    }

    void validate(DeployRequest request, Set<String> namesInUse) {
        List<String> errors = new ArrayList<>();

        if (request.modelName().isBlank()) {
            errors.add("model name must not be blank");
        }
        if (!SERVICE_NAME.matcher(request.serviceName()).matches()) {
            errors.add("service name '" + request.serviceName()
                    + "' must be 3-48 chars of lowercase letters, digits and '-', starting with a letter");
        }
        if (namesInUse.contains(request.serviceName())) {
            errors.add("service name '" + request.serviceName() + "' is already used by a live deployment");
        }
        if (request.gpuCount() < 1) {
            errors.add("gpu count must be >= 1");
        }
        if (request.tpSize() < 1 || request.tpSize() > request.gpuCount()) {
            errors.add("tensor parallel size must be between 1 and gpu count (" + request.gpuCount() + ")");
        }
        if (request.maxModelLen() <= 0) {
            errors.add("max model length must be > 0");
        }
        if (request.concurrency() < 1) {
            errors.add("concurrency must be >= 1");
        }
        if (!GpuCatalog.isKnown(request.gpu())) {
            errors.add("unknown GPU '" + request.gpu() + "'. Known: " + GpuCatalog.knownGpus());
        }

        checkProvider(request.serverlessProvider(), ProviderKind.SERVERLESS, request.gpu(), errors);
        if (!request.serverlessOnly()) {
            checkProvider(request.spotProvider(), ProviderKind.SPOT, request.gpu(), errors);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid deploy request: " + String.join("; ", errors));
        }
    }

    private void checkProvider(String name, ProviderKind expected, String gpu, List<String> errors) {
        if (!registry.contains(name)) {
            errors.add("unknown " + expected.name().toLowerCase(Locale.ROOT) + " provider '" + name + "'. Available: "
                    + registry.names());
            return;
        }
        InferenceProvider provider = registry.get(name);
        if (provider.kind() != expected) {
            errors.add("provider '" + name + "' is a " + provider.kind().name().toLowerCase(Locale.ROOT)
                    + " provider, not " + expected.name().toLowerCase(Locale.ROOT));
        }
        if (GpuCatalog.lists(name) && GpuCatalog.offering(name, gpu).isEmpty()) {
            errors.add("provider '" + name + "' does not offer GPU " + gpu);
        }
    }

    /** Shared vLLM command line, identical on every backend. */
    public static String buildVllmCommand(DeployRequest request) {
        String rendered = TemplateRenderer.renderResource(VLLM_TEMPLATE, Map.of(
                "model", request.modelName(),
                "host", "0.0.0.0",
                "port", VLLM_PORT,
                "max_model_len", String.valueOf(request.maxModelLen()),
                "tp_size", String.valueOf(request.tpSize()),
                "eager_flag", request.coldStartMode().enforceEager() ? "--enforce-eager" : ""));
        return rendered.trim();
    }
}
