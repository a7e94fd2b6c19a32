package spotlane.coordinator.model;

/**
 * Autoscaling knobs for both halves of a deployment.
 */
public record ScalingPolicy(SpotScaling spot, ServerlessScaling serverless) {

    public ScalingPolicy {
        spot = spot == null ? SpotScaling.defaults() : spot;
        serverless = serverless == null ? ServerlessScaling.defaults() : serverless;
    }

    public static ScalingPolicy defaults() {
        return new ScalingPolicy(SpotScaling.defaults(), ServerlessScaling.defaults());
    }

    /**
     * With scale-to-zero disabled both backends keep at least one warm worker.
     */
    public ScalingPolicy applyScaleToZero(boolean scaleToZero) {
        if (scaleToZero) {
            return this;
        }
        return new ScalingPolicy(
                spot.withMinReplicas(Math.max(1, spot.minReplicas())),
                serverless.withWorkersMin(Math.max(1, serverless.workersMin())));
    }

    /**
     * Spot replica autoscaling.
     *
     * @param upscaleDelaySeconds   seconds of sustained load before adding a replica
     * @param downscaleDelaySeconds seconds of idleness before removing one
     */
    public record SpotScaling(
            int minReplicas,
            int maxReplicas,
            double targetQps,
            int upscaleDelaySeconds,
            int downscaleDelaySeconds) {

        public SpotScaling {
            if (minReplicas < 0) {
                throw new IllegalArgumentException("spot.min_replicas must be >= 0");
            }
            if (maxReplicas < Math.max(1, minReplicas)) {
                throw new IllegalArgumentException("spot.max_replicas must be >= max(1, min_replicas)");
            }
            if (targetQps <= 0) {
                throw new IllegalArgumentException("spot.target_qps must be > 0");
            }
        }

        public static SpotScaling defaults() {
            return new SpotScaling(0, 5, 10, 5, 300);
        }

        public SpotScaling withMinReplicas(int value) {
            return new SpotScaling(value, Math.max(maxReplicas, value), targetQps, upscaleDelaySeconds,
                    downscaleDelaySeconds);
        }
    }

    /**
     * Serverless worker autoscaling.
     */
    public record ServerlessScaling(
            int concurrency,
            int scaledownWindowSeconds,
            int timeoutSeconds,
            int workersMin,
            int workersMax) {

        public ServerlessScaling {
            if (concurrency < 1) {
                throw new IllegalArgumentException("serverless.concurrency must be >= 1");
            }
            if (workersMin < 0 || workersMax < Math.max(1, workersMin)) {
                throw new IllegalArgumentException("serverless workers_min/workers_max out of range");
            }
        }

        public static ServerlessScaling defaults() {
            return new ServerlessScaling(32, 60, 600, 0, 1);
        }

        public ServerlessScaling withWorkersMin(int value) {
            return new ServerlessScaling(concurrency, scaledownWindowSeconds, timeoutSeconds, value,
                    Math.max(workersMax, value));
        }

        public ServerlessScaling withConcurrency(int value) {
            return new ServerlessScaling(value, scaledownWindowSeconds, timeoutSeconds, workersMin, workersMax);
        }
    }
}
