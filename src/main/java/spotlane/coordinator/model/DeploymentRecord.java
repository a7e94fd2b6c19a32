package spotlane.coordinator.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted snapshot of a hybrid deployment, keyed by service name.
 */
public final class DeploymentRecord {
    private final String serviceName;
    private final DeploymentStatus status;
    private final String modelName;
    private final String gpu;
    private final int gpuCount;
    private final String serverlessProvider;
    private final String spotProvider;
    private final String region;
    private final String routerUrl;
    private final Map<String, Object> request;
    private final ComponentStatus serverlessStatus;
    private final String serverlessEndpoint;
    private final String serverlessDeploymentId;
    private final Map<String, String> serverlessMetadata;
    private final String serverlessError;
    private final ComponentStatus spotStatus;
    private final String spotEndpoint;
    private final String spotDeploymentId;
    private final Map<String, String> spotMetadata;
    private final String spotError;
    private final Instant createdAt;
    private final Instant updatedAt;

    private DeploymentRecord(Builder b) {
        this.serviceName = Objects.requireNonNull(b.serviceName, "serviceName is required");
        this.status = Objects.requireNonNull(b.status, "status is required");
        this.modelName = b.modelName;
        this.gpu = b.gpu;
        this.gpuCount = b.gpuCount;
        this.serverlessProvider = b.serverlessProvider;
        this.spotProvider = b.spotProvider;
        this.region = b.region;
        this.routerUrl = b.routerUrl;
        this.request = b.request == null ? Map.of() : b.request;
        this.serverlessStatus = b.serverlessStatus == null ? ComponentStatus.PENDING : b.serverlessStatus;
        this.serverlessEndpoint = b.serverlessEndpoint;
        this.serverlessDeploymentId = b.serverlessDeploymentId;
        this.serverlessMetadata = b.serverlessMetadata == null ? Map.of() : Map.copyOf(b.serverlessMetadata);
        this.serverlessError = b.serverlessError;
        this.spotStatus = b.spotStatus == null ? ComponentStatus.PENDING : b.spotStatus;
        this.spotEndpoint = b.spotEndpoint;
        this.spotDeploymentId = b.spotDeploymentId;
        this.spotMetadata = b.spotMetadata == null ? Map.of() : Map.copyOf(b.spotMetadata);
        this.spotError = b.spotError;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
    }

    /**
     * Snapshot the live deployment for persistence.
     */
    public static DeploymentRecord of(HybridDeployment deployment) {
        DeployRequest request = deployment.request();
        Builder builder = builder()
                .serviceName(deployment.serviceName())
                .status(deployment.status())
                .modelName(request.modelName())
                .gpu(request.gpu())
                .gpuCount(request.gpuCount())
                .serverlessProvider(request.serverlessProvider())
                .spotProvider(request.serverlessOnly() ? null : request.spotProvider())
                .region(request.region())
                .routerUrl(deployment.routerUrl())
                .request(request.toMap())
                .serverlessStatus(deployment.serverlessStatus())
                .spotStatus(deployment.spotStatus())
                .createdAt(deployment.createdAt())
                .updatedAt(Instant.now());

        DeploymentResult serverless = deployment.serverless();
        if (serverless != null) {
            builder.serverlessEndpoint(serverless.endpointUrl())
                    .serverlessDeploymentId(serverless.deploymentId())
                    .serverlessMetadata(serverless.metadata())
                    .serverlessError(serverless.error());
        }
        DeploymentResult spot = deployment.spot();
        if (spot != null) {
            builder.spotEndpoint(spot.endpointUrl())
                    .spotDeploymentId(spot.deploymentId())
                    .spotMetadata(spot.metadata())
                    .spotError(spot.error());
        }
        return builder.build();
    }

    /**
     * Rebuild the serverless result so a later process can tear it down.
     * Returns {@code null} when nothing was recorded for it.
     */
    public DeploymentResult serverlessResult() {
        return toResult(serverlessProvider, serverlessDeploymentId, serverlessEndpoint, serverlessMetadata,
                serverlessError);
    }

    /** Same as {@link #serverlessResult()} for the spot leg. */
    public DeploymentResult spotResult() {
        return toResult(spotProvider, spotDeploymentId, spotEndpoint, spotMetadata, spotError);
    }

    private static DeploymentResult toResult(String provider, String id, String endpoint,
            Map<String, String> metadata, String error) {
        if (provider == null || (id == null && endpoint == null && metadata.isEmpty())) {
            return null;
        }
        if (endpoint != null) {
            return DeploymentResult.success(provider, id, endpoint, null, metadata);
        }
        return DeploymentResult.failure(provider, error == null ? "not deployed" : error, metadata);
    }

    public String serviceName() {
        return serviceName;
    }

    public DeploymentStatus status() {
        return status;
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

    public String serverlessProvider() {
        return serverlessProvider;
    }

    public String spotProvider() {
        return spotProvider;
    }

    public String region() {
        return region;
    }

    public String routerUrl() {
        return routerUrl;
    }

    public Map<String, Object> request() {
        return request;
    }

    public ComponentStatus serverlessStatus() {
        return serverlessStatus;
    }

    public String serverlessEndpoint() {
        return serverlessEndpoint;
    }

    public String serverlessDeploymentId() {
        return serverlessDeploymentId;
    }

    public Map<String, String> serverlessMetadata() {
        return serverlessMetadata;
    }

    public String serverlessError() {
        return serverlessError;
    }

    public ComponentStatus spotStatus() {
        return spotStatus;
    }

    public String spotEndpoint() {
        return spotEndpoint;
    }

    public String spotDeploymentId() {
        return spotDeploymentId;
    }

    public Map<String, String> spotMetadata() {
        return spotMetadata;
    }

    public String spotError() {
        return spotError;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .serviceName(serviceName)
                .status(status)
                .modelName(modelName)
                .gpu(gpu)
                .gpuCount(gpuCount)
                .serverlessProvider(serverlessProvider)
                .spotProvider(spotProvider)
                .region(region)
                .routerUrl(routerUrl)
                .request(request)
                .serverlessStatus(serverlessStatus)
                .serverlessEndpoint(serverlessEndpoint)
                .serverlessDeploymentId(serverlessDeploymentId)
                .serverlessMetadata(serverlessMetadata)
                .serverlessError(serverlessError)
                .spotStatus(spotStatus)
                .spotEndpoint(spotEndpoint)
                .spotDeploymentId(spotDeploymentId)
                .spotMetadata(spotMetadata)
                .spotError(spotError)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String serviceName;
        private DeploymentStatus status = DeploymentStatus.LAUNCHING;
        private String modelName;
        private String gpu;
        private int gpuCount = 1;
        private String serverlessProvider;
        private String spotProvider;
        private String region;
        private String routerUrl;
        private Map<String, Object> request;
        private ComponentStatus serverlessStatus;
        private String serverlessEndpoint;
        private String serverlessDeploymentId;
        private Map<String, String> serverlessMetadata;
        private String serverlessError;
        private ComponentStatus spotStatus;
        private String spotEndpoint;
        private String spotDeploymentId;
        private Map<String, String> spotMetadata;
        private String spotError;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder status(DeploymentStatus status) {
            this.status = status;
            return this;
        }

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

        public Builder serverlessProvider(String serverlessProvider) {
            this.serverlessProvider = serverlessProvider;
            return this;
        }

        public Builder spotProvider(String spotProvider) {
            this.spotProvider = spotProvider;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder routerUrl(String routerUrl) {
            this.routerUrl = routerUrl;
            return this;
        }

        public Builder request(Map<String, Object> request) {
            this.request = request;
            return this;
        }

        public Builder serverlessStatus(ComponentStatus serverlessStatus) {
            this.serverlessStatus = serverlessStatus;
            return this;
        }

        public Builder serverlessEndpoint(String serverlessEndpoint) {
            this.serverlessEndpoint = serverlessEndpoint;
            return this;
        }

        public Builder serverlessDeploymentId(String serverlessDeploymentId) {
            this.serverlessDeploymentId = serverlessDeploymentId;
            return this;
        }

        public Builder serverlessMetadata(Map<String, String> serverlessMetadata) {
            this.serverlessMetadata = serverlessMetadata;
            return this;
        }

        public Builder serverlessError(String serverlessError) {
            this.serverlessError = serverlessError;
            return this;
        }

        public Builder spotStatus(ComponentStatus spotStatus) {
            this.spotStatus = spotStatus;
            return this;
        }

        public Builder spotEndpoint(String spotEndpoint) {
            this.spotEndpoint = spotEndpoint;
            return this;
        }

        public Builder spotDeploymentId(String spotDeploymentId) {
            this.spotDeploymentId = spotDeploymentId;
            return this;
        }

        public Builder spotMetadata(Map<String, String> spotMetadata) {
            this.spotMetadata = spotMetadata;
            return this;
        }

        public Builder spotError(String spotError) {
            this.spotError = spotError;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public DeploymentRecord build() {
            return new DeploymentRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeploymentRecord that))
            return false;
        return Objects.equals(serviceName, that.serviceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceName);
    }

    @Override
    public String toString() {
        return "DeploymentRecord{service='" + serviceName + "', status=" + status + ", serverless="
                + serverlessStatus + ", spot=" + spotStatus + "}";
    }
}
