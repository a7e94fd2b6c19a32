package spotlane.router.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.router.api.dto.RouterConfigRequest;
import spotlane.router.probe.ReadinessProber;
import spotlane.router.server.RouterHandler;
import spotlane.router.state.RoutingPatch;
import spotlane.router.state.RoutingSnapshot;
import spotlane.router.state.RoutingState;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

/**
 * POST /router/config
 *
 * <p>
 * Partial update of the backend URLs. Setting a spot URL starts the prober.
 */
public class RouterConfigController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RouterConfigController.class);
    public static final String PATH = "/router/config";

    private final RoutingState state;
    private final ReadinessProber prober;

    public RouterConfigController(RoutingState state, ReadinessProber prober) {
        this.state = state;
        this.prober = prober;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return ControllerResponse.ack();
        }

        RouterConfigRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, RouterConfigRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage());
        }
        if (request == null) {
            return ControllerResponse.ack();
        }

        RoutingPatch patch = request.toPatch();
        validateUrl("serverless_url", patch.serverlessUrl());
        validateUrl("spot_url", patch.spotUrl());

        RoutingSnapshot applied = state.apply(patch);
        log.info("Routing updated: serverless={} spot={} phase={}",
                applied.serverlessUrl(), applied.spotUrl(), applied.phase());
        if (patch.setsSpot()) {
            prober.start();
            prober.trigger();
        }
        return ControllerResponse.ack();
    }

    static void validateUrl(String field, String url) {
        if (url == null || url.isEmpty()) {
            return;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException(field + " must be an http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(field + " is not a valid URL: " + url);
        }
    }
}
