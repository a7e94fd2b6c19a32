package spotlane.router.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import spotlane.router.state.RoutingSnapshot;

import java.util.Map;

/**
 * Response DTO for GET /router/health. Absent values serialize as
 * {@code null}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RouterHealthResponse(
        @JsonProperty("skyserve_ready") boolean skyserveReady,
        @JsonProperty("last_probe_ts") Double lastProbeTs,
        @JsonProperty("last_probe_err") String lastProbeErr,
        @JsonProperty("serverless_base_url") String serverlessBaseUrl,
        @JsonProperty("skyserve_base_url") String skyserveBaseUrl,
        @JsonProperty("phase") String phase,
        @JsonProperty("route_stats") Map<String, Object> routeStats) {

    public static RouterHealthResponse of(RoutingSnapshot snapshot, Map<String, Object> routeStats) {
        Double probeTs = snapshot.lastProbeAt() == null
                ? null
                : snapshot.lastProbeAt().toEpochMilli() / 1000.0;
        return new RouterHealthResponse(
                snapshot.spotReady(),
                probeTs,
                snapshot.lastProbeError(),
                snapshot.serverlessUrl(),
                snapshot.spotUrl(),
                snapshot.phase().name(),
                routeStats);
    }
}
