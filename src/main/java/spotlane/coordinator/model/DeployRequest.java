package spotlane.coordinator.model;

import spotlane.cloud.catalog.GpuCatalog;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable user intent for one hybrid deployment. The service name is the
 * unique key across the deployment store.
 */
public final class DeployRequest {
    private final String modelName;
    private final String gpu;
    private final int gpuCount;
    private final int tpSize;
    private final int maxModelLen;
    private final int concurrency;
    private final ColdStartMode coldStartMode;
    private final boolean scaleToZero;
    private final String serverlessProvider;
    private final String spotProvider;
    private final String spotCloud;
    private final String region;
    private final String serviceName;
    private final ScalingPolicy scaling;
    private final boolean serverlessOnly;
    private final String vllmVersion;

    private DeployRequest(Builder builder) {
        this.modelName = Objects.requireNonNull(builder.modelName, "modelName is required");
        this.gpu = GpuCatalog.normalize(Objects.requireNonNull(builder.gpu, "gpu is required"));
        this.gpuCount = builder.gpuCount;
        this.tpSize = builder.tpSize;
        this.maxModelLen = builder.maxModelLen;
        this.concurrency = builder.concurrency;
        this.coldStartMode = builder.coldStartMode == null ? ColdStartMode.FAST_BOOT : builder.coldStartMode;
        this.scaleToZero = builder.scaleToZero;
        this.serverlessProvider = builder.serverlessProvider;
        this.spotProvider = builder.spotProvider;
        this.spotCloud = builder.spotCloud;
        this.region = blankToNull(builder.region);
        this.serviceName = builder.serviceName == null || builder.serviceName.isBlank()
                ? generateServiceName()
                : builder.serviceName.trim();
        this.scaling = (builder.scaling == null ? ScalingPolicy.defaults() : builder.scaling)
                .applyScaleToZero(builder.scaleToZero);
        this.serverlessOnly = builder.serverlessOnly;
        this.vllmVersion = builder.vllmVersion;
    }

    public String modelName() {
        return modelName;
    }

    public String gpu() {
        return gpu;
    }

    public int gpuCount() {
        return gpuCount;
    }

    public int tpSize() {
        return tpSize;
    }

    public int maxModelLen() {
        return maxModelLen;
    }

    public int concurrency() {
        return concurrency;
    }

    public ColdStartMode coldStartMode() {
        return coldStartMode;
    }

    public boolean scaleToZero() {
        return scaleToZero;
    }

    public String serverlessProvider() {
        return serverlessProvider;
    }

    public String spotProvider() {
        return spotProvider;
    }

    public String spotCloud() {
        return spotCloud;
    }

    public String region() {
        return region;
    }

    public String serviceName() {
        return serviceName;
    }

    public ScalingPolicy scaling() {
        return scaling;
    }

    public boolean serverlessOnly() {
        return serverlessOnly;
    }

    public String vllmVersion() {
        return vllmVersion;
    }

    /** Flat view persisted as the request JSON of a deployment record. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("model_name", modelName);
        map.put("gpu", gpu);
        map.put("gpu_count", gpuCount);
        map.put("tp_size", tpSize);
        map.put("max_model_len", maxModelLen);
        map.put("concurrency", concurrency);
        map.put("cold_start_mode", coldStartMode.name());
        map.put("scale_to_zero", scaleToZero);
        map.put("serverless_provider", serverlessProvider);
        map.put("spot_provider", spotProvider);
        map.put("spot_cloud", spotCloud);
        map.put("region", region);
        map.put("service_name", serviceName);
        map.put("serverless_only", serverlessOnly);
        map.put("vllm_version", vllmVersion);
        return map;
    }

    public Builder toBuilder() {
        return new Builder()
                .modelName(modelName)
                .gpu(gpu)
                .gpuCount(gpuCount)
                .tpSize(tpSize)
                .maxModelLen(maxModelLen)
                .concurrency(concurrency)
                .coldStartMode(coldStartMode)
                .scaleToZero(scaleToZero)
                .serverlessProvider(serverlessProvider)
                .spotProvider(spotProvider)
                .spotCloud(spotCloud)
                .region(region)
                .serviceName(serviceName)
                .scaling(scaling)
                .serverlessOnly(serverlessOnly)
                .vllmVersion(vllmVersion);
    }

    public static Builder builder() {
        return new Builder();
    }

    static String generateServiceName() {
        return "spotlane-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static final class Builder {
        private String modelName;
        private String gpu;
        private int gpuCount = 1;
        private int tpSize = 1;
        private int maxModelLen = 4096;
        private int concurrency = 32;
        private ColdStartMode coldStartMode = ColdStartMode.FAST_BOOT;
        private boolean scaleToZero = true;
        private String serverlessProvider = "runpod";
        private String spotProvider = "skyserve";
        private String spotCloud = "aws";
        private String region;
        private String serviceName;
        private ScalingPolicy scaling;
        private boolean serverlessOnly;
        private String vllmVersion = "0.15.1";

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder gpu(String gpu) {
            this.gpu = gpu;
            return this;
        }

        public Builder gpuCount(int gpuCount) {
            this.gpuCount = gpuCount;
            return this;
        }

        public Builder tpSize(int tpSize) {
            this.tpSize = tpSize;
            return this;
        }

        public Builder maxModelLen(int maxModelLen) {
            this.maxModelLen = maxModelLen;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder coldStartMode(ColdStartMode coldStartMode) {
            this.coldStartMode = coldStartMode;
            return this;
        }

        public Builder scaleToZero(boolean scaleToZero) {
            this.scaleToZero = scaleToZero;
            return this;
        }

        public Builder serverlessProvider(String serverlessProvider) {
            this.serverlessProvider = serverlessProvider;
            return this;
        }

        public Builder spotProvider(String spotProvider) {
            this.spotProvider = spotProvider;
            return this;
        }

        public Builder spotCloud(String spotCloud) {
            this.spotCloud = spotCloud;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder scaling(ScalingPolicy scaling) {
            this.scaling = scaling;
            return this;
        }

        public Builder serverlessOnly(boolean serverlessOnly) {
            this.serverlessOnly = serverlessOnly;
            return this;
        }

        public Builder vllmVersion(String vllmVersion) {
            this.vllmVersion = vllmVersion;
            return this;
        }

        public DeployRequest build() {
            return new DeployRequest(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeployRequest that))
            return false;
        return Objects.equals(serviceName, that.serviceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceName);
    }

    @Override
    public String toString() {
        return "DeployRequest{service='" + serviceName + "', model='" + modelName + "', gpu=" + gpu
                + "x" + gpuCount + ", serverless=" + serverlessProvider + ", spot="
                + (serverlessOnly ? "none" : spotProvider) + "}";
    }
}
