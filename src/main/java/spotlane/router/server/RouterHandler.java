package spotlane.router.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.router.api.Controller;
import spotlane.router.api.Controller.ControllerResponse;
import spotlane.router.api.RouterHealthController;
import spotlane.router.config.RouterConfig;
import spotlane.router.proxy.ProxyForwarder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.UNAUTHORIZED;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Entry point for every request reaching the router.
 *
 * <p>
 * Admin endpoints under {@code /router/} go to registered controllers;
 * everything else is proxied to the current backend. When an API key is
 * configured it guards both.
 *
 * <p>
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final RouterConfig config;
    private final ProxyForwarder forwarder;

    public RouterHandler(RouterConfig config, ProxyForwarder forwarder) {
        this.config = config;
        this.forwarder = forwarder;
    }

    /**
     * Register a controller. Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        try {
            if (!checkAuth(req, method, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, keepAlive, ControllerResponse.error(UNAUTHORIZED, "unauthorized"));
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    writeSafe(ctx, keepAlive, controller.handle(ctx, req, path));
                    return;
                }
            }

            forwarder.forward(ctx, req);

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeSafe(ctx, keepAlive, ControllerResponse.error(BAD_REQUEST, e.getMessage()));
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            writeSafe(ctx, keepAlive, ControllerResponse.error(INTERNAL_SERVER_ERROR, e.toString()));
        }
    }

    /**
     * Accepts the key in the configured header or as a bearer token. The
     * comparison is constant-time.
     */
    boolean checkAuth(FullHttpRequest req, HttpMethod method, String path) {
        if (!config.hasApiKey()) {
            return true;
        }
        if (config.allowHealthWithoutAuth() && method.equals(HttpMethod.GET)
                && RouterHealthController.PATH.equals(path)) {
            return true;
        }
        String provided = req.headers().get(config.apiKeyHeader());
        if (provided == null) {
            String authorization = req.headers().get(HttpHeaderNames.AUTHORIZATION);
            if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
                provided = authorization.substring(7).trim();
            }
        }
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8),
                config.apiKey().getBytes(StandardCharsets.UTF_8));
    }

    private void writeSafe(ChannelHandlerContext ctx, boolean keepAlive, ControllerResponse controllerResponse) {
        try {
            byte[] bytes = controllerResponse.body() == null
                    ? new byte[0]
                    : MAPPER.writeValueAsBytes(controllerResponse.body());
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, controllerResponse.status(),
                    Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            HttpUtil.setKeepAlive(response, keepAlive);
            if (keepAlive) {
                ctx.writeAndFlush(response);
            } else {
                ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
            }
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.debug("Closing idle connection {}", ctx.channel().remoteAddress());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Channel error from {}: {}", ctx.channel().remoteAddress(), cause.toString());
        if (ctx.channel().isActive()) {
            writeSafe(ctx, false, ControllerResponse.error(INTERNAL_SERVER_ERROR, "channel error"));
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
