package spotlane.router.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.LastHttpContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.router.config.RouterConfig;
import spotlane.router.probe.ReadinessProber;
import spotlane.router.probe.SpotPoker;
import spotlane.router.server.RouterHandler;
import spotlane.router.state.Backend;
import spotlane.router.state.RoutingSnapshot;
import spotlane.router.state.RoutingState;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_GATEWAY;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.SERVICE_UNAVAILABLE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Forwards one inbound request to the backend the routing state picks and
 * streams the response back chunk by chunk.
 *
 * <p>
 * A spot transport failure (connect error, reset, timeout before the
 * response head) marks spot unready and replays the request on serverless
 * exactly once. Backend error statuses are passed through untouched.
 */
public class ProxyForwarder {

    private static final Logger log = LoggerFactory.getLogger(ProxyForwarder.class);
    private static final int SUMMARY_EVERY = 100;

    private final RoutingState state;
    private final ReadinessProber prober;
    private final SpotPoker poker;
    private final RouterConfig config;
    private final HttpClient client;
    private final AtomicLong completed = new AtomicLong();

    public ProxyForwarder(RoutingState state, ReadinessProber prober, SpotPoker poker,
            RouterConfig config, HttpClient client) {
        this.state = state;
        this.prober = prober;
        this.poker = poker;
        this.config = config;
        this.client = client;
    }

    /**
     * Route and forward. The request body is copied before this returns, so
     * the caller may release {@code req} afterwards.
     */
    public void forward(ChannelHandlerContext ctx, FullHttpRequest req) {
        InboundRequest inbound = InboundRequest.copyOf(req);
        RoutingSnapshot snapshot = state.snapshot();

        Backend backend = snapshot.choose().orElse(null);
        if (backend == null) {
            state.recordRejected();
            String message;
            if (snapshot.shutdown()) {
                message = "Router is shutting down";
            } else if (snapshot.hasSpot()) {
                prober.trigger();
                message = "Spot backend not ready, no serverless fallback";
            } else {
                message = "No backends configured yet";
            }
            writeError(ctx, inbound.keepAlive(), SERVICE_UNAVAILABLE, errorBody(message, null));
            return;
        }

        if (backend == Backend.SERVERLESS && snapshot.hasSpot()) {
            poker.poke(snapshot.spotUrl());
            prober.trigger();
        }
        attempt(ctx, inbound, snapshot, backend, true);
    }

    private void attempt(ChannelHandlerContext ctx, InboundRequest inbound, RoutingSnapshot snapshot,
            Backend backend, boolean mayFallback) {
        String base = snapshot.baseUrl(backend);
        HttpRequest upstream;
        try {
            upstream = buildUpstream(inbound, ProxyTargets.build(base, inbound.uri()), backend, snapshot);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected request target {}: {}", inbound.uri(), e.getMessage());
            writeError(ctx, inbound.keepAlive(), BAD_REQUEST, errorBody("invalid request target", null));
            return;
        }

        long started = System.nanoTime();
        client.sendAsync(upstream, HttpResponse.BodyHandlers.ofPublisher())
                .whenComplete((response, error) -> {
                    if (error == null) {
                        relay(ctx, inbound, response, backend, started);
                        return;
                    }
                    UpstreamException failure = new UpstreamException(backend, base, unwrap(error));
                    state.recordOutcome(backend, elapsedSince(started), false);
                    if (backend == Backend.SPOT && mayFallback && snapshot.hasServerless()) {
                        log.warn("Spot forward failed, falling back to serverless: {}", failure.getMessage());
                        state.markSpotUnready(base, failure.getMessage());
                        prober.trigger();
                        attempt(ctx, inbound, snapshot, Backend.SERVERLESS, false);
                    } else {
                        log.warn("Upstream failure: {}", failure.getMessage());
                        writeError(ctx, inbound.keepAlive(), BAD_GATEWAY,
                                errorBody("upstream_error", failure.getMessage()));
                    }
                });
    }

    HttpRequest buildUpstream(InboundRequest inbound, URI target, Backend backend, RoutingSnapshot snapshot) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(target).timeout(config.upstreamTimeout());
        boolean injectToken = backend == Backend.SERVERLESS
                && snapshot.serverlessAuthToken() != null && !snapshot.serverlessAuthToken().isEmpty();

        for (Map.Entry<String, String> header : inbound.headers()) {
            String name = header.getKey();
            String value = header.getValue();
            if (!HopByHopHeaders.isForwardable(name, inbound.connectionTokens())) {
                continue;
            }
            if (config.hasApiKey() && name.equalsIgnoreCase(config.apiKeyHeader())) {
                continue;
            }
            if (name.equalsIgnoreCase("authorization")
                    && (injectToken || (config.hasApiKey() && value.equals("Bearer " + config.apiKey())))) {
                continue;
            }
            try {
                builder.header(name, value);
            } catch (IllegalArgumentException e) {
                log.debug("Dropping header {} the client refuses: {}", name, e.getMessage());
            }
        }
        if (injectToken) {
            builder.header("Authorization", "Bearer " + snapshot.serverlessAuthToken());
        }

        HttpRequest.BodyPublisher body = inbound.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(inbound.body());
        return builder.method(inbound.method().name(), body).build();
    }

    private void relay(ChannelHandlerContext ctx, InboundRequest inbound,
            HttpResponse<Flow.Publisher<List<ByteBuffer>>> response, Backend backend, long started) {
        int code = response.statusCode();
        DefaultHttpResponse head = new DefaultHttpResponse(HTTP_1_1, HttpResponseStatus.valueOf(code));
        HopByHopHeaders.copyResponseHeaders(response.headers().map(), head.headers());

        boolean isHead = inbound.method().equals(HttpMethod.HEAD);
        boolean bodyless = isHead || code == 204 || code == 304 || (code >= 100 && code < 200);
        if (isHead) {
            response.headers().firstValue("content-length")
                    .ifPresent(len -> head.headers().set(HttpHeaderNames.CONTENT_LENGTH, len));
        } else if (!bodyless) {
            HttpUtil.setTransferEncodingChunked(head, true);
        }
        HttpUtil.setKeepAlive(head, inbound.keepAlive());
        ctx.writeAndFlush(head);

        response.body().subscribe(new StreamingRelay(ctx, inbound.keepAlive(), bodyless, streamed -> {
            boolean success = streamed && code < 500;
            state.recordOutcome(backend, elapsedSince(started), success);
            if (completed.incrementAndGet() % SUMMARY_EVERY == 0) {
                log.info("Routed {} requests, stats {}", completed.get(), state.routeStats());
            }
        }));
    }

    private void writeError(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    private static String errorBody(String error, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (detail != null) {
            body.put("detail", detail);
        }
        try {
            return RouterHandler.mapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return "{\"error\":\"" + error + "\"}";
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof IOException || cause instanceof RuntimeException ? cause : error;
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    /** Everything needed to replay the request once Netty has released it. */
    record InboundRequest(
            HttpMethod method,
            String uri,
            List<Map.Entry<String, String>> headers,
            Set<String> connectionTokens,
            byte[] body,
            boolean keepAlive) {

        static InboundRequest copyOf(FullHttpRequest req) {
            List<Map.Entry<String, String>> headers = new ArrayList<>(req.headers().entries());
            Set<String> tokens = HopByHopHeaders.connectionTokens(req.headers().getAll(HttpHeaderNames.CONNECTION));
            byte[] body = ByteBufUtil.getBytes(req.content());
            return new InboundRequest(req.method(), req.uri(), List.copyOf(headers), tokens, body,
                    HttpUtil.isKeepAlive(req));
        }
    }

    /**
     * Writes each upstream chunk as it arrives and asks for the next one only
     * after the write has been flushed.
     */
    private static final class StreamingRelay implements Flow.Subscriber<List<ByteBuffer>> {

        private final ChannelHandlerContext ctx;
        private final boolean keepAlive;
        private final boolean discardBody;
        private final Consumer<Boolean> onFinished;
        private final AtomicBoolean finished = new AtomicBoolean();
        private Flow.Subscription subscription;

        StreamingRelay(ChannelHandlerContext ctx, boolean keepAlive, boolean discardBody,
                Consumer<Boolean> onFinished) {
            this.ctx = ctx;
            this.keepAlive = keepAlive;
            this.discardBody = discardBody;
            this.onFinished = onFinished;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(1);
        }

        @Override
        public void onNext(List<ByteBuffer> buffers) {
            if (discardBody) {
                subscription.request(1);
                return;
            }
            int size = 0;
            for (ByteBuffer buffer : buffers) {
                size += buffer.remaining();
            }
            if (size == 0) {
                subscription.request(1);
                return;
            }
            DefaultHttpContent chunk = new DefaultHttpContent(
                    Unpooled.copiedBuffer(buffers.toArray(new ByteBuffer[0])));
            ctx.writeAndFlush(chunk).addListener(f -> {
                if (f.isSuccess()) {
                    subscription.request(1);
                } else {
                    log.debug("Client went away mid-stream: {}", f.cause() == null ? "closed" : f.cause().toString());
                    subscription.cancel();
                    finish(false);
                }
            });
        }

        @Override
        public void onError(Throwable throwable) {
            log.warn("Upstream stream broke after response head: {}", throwable.toString());
            ctx.close();
            finish(false);
        }

        @Override
        public void onComplete() {
            // stats first, so a client that reads the last byte sees them
            finish(true);
            if (keepAlive) {
                ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT);
            } else {
                ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
            }
        }

        private void finish(boolean streamed) {
            if (finished.compareAndSet(false, true)) {
                onFinished.accept(streamed);
            }
        }
    }
}
