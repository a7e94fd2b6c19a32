package spotlane.router.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import spotlane.router.api.dto.RouterHealthResponse;
import spotlane.router.state.RoutingState;

/**
 * GET /router/health
 *
 * <p>
 * Reports the last recorded probe; never probes synchronously.
 */
public class RouterHealthController implements Controller {

    public static final String PATH = "/router/health";

    private final RoutingState state;

    public RouterHealthController(RoutingState state) {
        this.state = state;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        RouterHealthResponse response = RouterHealthResponse.of(state.snapshot(), state.routeStats());
        return ControllerResponse.ok(response);
    }
}
