package spotlane.router.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * One of the router's own admin endpoints. Requests that no controller
 * matches are proxied.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * @throws IllegalArgumentException for a malformed request; answered
     *                                  with 400 and the message
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Status plus a body object that the handler writes as JSON.
     */
    record ControllerResponse(HttpResponseStatus status, Object body) {

        private static final Map<String, String> ACK = Map.of("status", "ok");

        public static ControllerResponse ok(Object body) {
            return new ControllerResponse(HttpResponseStatus.OK, body);
        }

        /** {@code {"status":"ok"}} */
        public static ControllerResponse ack() {
            return ok(ACK);
        }

        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, Map.of("error", message == null ? "" : message));
        }
    }
}
