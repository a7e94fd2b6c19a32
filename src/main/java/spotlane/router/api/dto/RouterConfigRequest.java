package spotlane.router.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import spotlane.router.state.RoutingPatch;

/**
 * Request DTO for POST /router/config. Absent fields stay unchanged; an empty
 * string clears a backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RouterConfigRequest(
        @JsonProperty("serverless_url") String serverlessUrl,
        @JsonProperty("serverless_auth_token") String serverlessAuthToken,
        @JsonProperty("spot_url") String spotUrl) {

    public RoutingPatch toPatch() {
        return new RoutingPatch(serverlessUrl, serverlessAuthToken, spotUrl);
    }

    public static RouterConfigRequest of(RoutingPatch patch) {
        return new RouterConfigRequest(patch.serverlessUrl(), patch.serverlessAuthToken(), patch.spotUrl());
    }
}
