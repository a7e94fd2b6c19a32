package spotlane.router.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import spotlane.router.config.RouterConfig;
import spotlane.router.state.RoutingPatch;
import spotlane.router.state.RoutingState;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real router on an ephemeral port in front of two local backends.
 */
class RouterProxyIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestBackend serverless;
    private TestBackend spot;
    private RouterNettyServer router;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws IOException {
        serverless = new TestBackend("serverless");
        spot = new TestBackend("spot");
        httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.stop();
        }
        serverless.close();
        spot.close();
    }

    private RouterConfig baseConfig() {
        return RouterConfig.defaults()
                .withHost("127.0.0.1")
                .withPort(0)
                .withProbeMinInterval(Duration.ZERO)
                .withProbeTimeout(Duration.ofSeconds(2))
                .withUpstreamTimeout(Duration.ofSeconds(10));
    }

    private void startRouter(RouterConfig config) throws InterruptedException {
        router = new RouterNettyServer(config);
        router.start();
    }

    private String routerUrl() {
        return "http://127.0.0.1:" + router.port();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(URI.create(routerUrl() + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(routerUrl() + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode health() throws Exception {
        HttpResponse<String> response = get("/router/health");
        assertEquals(200, response.statusCode(), response.body());
        return MAPPER.readTree(response.body());
    }

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private void awaitSpotReady() throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (router.routingState().snapshot().spotReady()) {
                return;
            }
            TimeUnit.MILLISECONDS.sleep(20);
        }
        fail("spot never became ready");
    }

    @Test
    @DisplayName("No backends configured: 503 with an error body")
    void noBackends() throws Exception {
        startRouter(baseConfig());

        HttpResponse<String> response = post("/v1/chat/completions", "{}");

        assertEquals(503, response.statusCode());
        assertEquals("No backends configured yet", MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(1, health().get("route_stats").get("rejected").asInt());
    }

    @Test
    @DisplayName("Spot configured but not ready and no serverless: 503")
    void spotWarmingWithoutServerless() throws Exception {
        spot.healthStatus(503);
        startRouter(baseConfig());
        router.routingState().apply(RoutingPatch.spot(spot.url()));

        HttpResponse<String> response = get("/v1/models");

        assertEquals(503, response.statusCode());
        assertTrue(response.body().contains("Spot backend not ready"));
        assertTrue(spot.proxied().isEmpty());
    }

    @Test
    @DisplayName("Serverless only: requests are forwarded with path, query, method and body intact")
    void forwardsToServerless() throws Exception {
        startRouter(baseConfig().withServerlessUrl(serverless.url()));

        HttpResponse<String> response = post("/v1/completions?x=1", "{\"prompt\":\"hi\"}");

        assertEquals(200, response.statusCode());
        assertEquals("serverless", response.headers().firstValue("x-backend").orElse(null));
        TestBackend.Recorded seen = serverless.proxied().get(0);
        assertEquals("POST", seen.method());
        assertEquals("/v1/completions?x=1", seen.uri());
        assertEquals("{\"prompt\":\"hi\"}", seen.body());
        assertEquals("application/json", seen.header("Content-Type"));
    }

    @Test
    @DisplayName("Spot set but not ready: serverless serves and spot gets poked")
    void notReadySpotRoutesToServerless() throws Exception {
        spot.healthStatus(503);
        startRouter(baseConfig());
        router.routingState().apply(new RoutingPatch(serverless.url(), null, spot.url()));

        HttpResponse<String> response = get("/v1/models");

        assertEquals(200, response.statusCode());
        assertEquals(1, serverless.proxied().size());
        assertTrue(spot.proxied().isEmpty());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (spot.healthHits() == 0 && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(20);
        }
        assertTrue(spot.healthHits() > 0, "spot should have been poked or probed");
        assertEquals("SERVERLESS_ONLY", health().get("phase").asText());
    }

    @Test
    @DisplayName("Spot URL pushed via /router/config becomes preferred once probes succeed")
    void configPushThenSpotPreferred() throws Exception {
        startRouter(baseConfig());

        HttpResponse<String> update = post("/router/config",
                "{\"serverless_url\":\"" + serverless.url() + "/\",\"spot_url\":\"" + spot.url() + "\"}");
        assertEquals(200, update.statusCode(), update.body());
        assertEquals("ok", MAPPER.readTree(update.body()).get("status").asText());
        assertTrue(router.prober().isRunning());

        awaitSpotReady();
        HttpResponse<String> response = get("/v1/models");

        assertEquals("spot", response.headers().firstValue("x-backend").orElse(null));
        JsonNode h = health();
        assertTrue(h.get("skyserve_ready").asBoolean());
        assertEquals("SPOT_PREFERRED", h.get("phase").asText());
        assertEquals(serverless.url(), h.get("serverless_base_url").asText());
        assertEquals(spot.url(), h.get("skyserve_base_url").asText());
        assertTrue(h.get("last_probe_ts").isNumber());
        assertTrue(h.get("last_probe_err").isNull());
        assertEquals(1, h.get("route_stats").get("spot").asInt());
    }

    @Test
    @DisplayName("Spot transport failure falls back to serverless once and marks spot unready")
    void spotFailureFallsBack() throws Exception {
        String deadSpot = "http://127.0.0.1:" + closedPort();
        startRouter(baseConfig());
        RoutingState state = router.routingState();
        state.apply(new RoutingPatch(serverless.url(), null, deadSpot));
        state.recordProbe(deadSpot, true, null);

        HttpResponse<String> response = post("/v1/chat/completions", "{\"stream\":false}");

        assertEquals(200, response.statusCode());
        assertEquals("serverless", response.headers().firstValue("x-backend").orElse(null));
        assertEquals("{\"stream\":false}", serverless.proxied().get(0).body());
        assertFalse(state.snapshot().spotReady());
        assertNotNull(state.snapshot().lastProbeError());

        JsonNode stats = health().get("route_stats");
        assertEquals(1, stats.get("errors_spot").asInt());
        assertEquals(1, stats.get("serverless").asInt());
    }

    @Test
    @DisplayName("Both backends unreachable: one attempt each, then 502")
    void bothFailGives502() throws Exception {
        String deadSpot = "http://127.0.0.1:" + closedPort();
        String deadServerless = "http://127.0.0.1:" + closedPort();
        startRouter(baseConfig());
        RoutingState state = router.routingState();
        state.apply(new RoutingPatch(deadServerless, null, deadSpot));
        state.recordProbe(deadSpot, true, null);

        HttpResponse<String> response = get("/v1/models");

        assertEquals(502, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("upstream_error", body.get("error").asText());
        assertTrue(body.get("detail").asText().startsWith("serverless "));

        JsonNode stats = health().get("route_stats");
        assertEquals(2, stats.get("total").asInt());
        assertEquals(1, stats.get("errors_spot").asInt());
        assertEquals(1, stats.get("errors_serverless").asInt());
    }

    @Test
    @DisplayName("Backend error statuses pass through without fallback")
    void errorStatusPassesThrough() throws Exception {
        startRouter(baseConfig());
        router.routingState().apply(new RoutingPatch(serverless.url(), null, spot.url()));
        router.routingState().recordProbe(spot.url(), true, null);
        spot.status(500);

        HttpResponse<String> response = get("/v1/models");

        assertEquals(500, response.statusCode());
        assertEquals("spot", response.headers().firstValue("x-backend").orElse(null));
        assertTrue(serverless.proxied().isEmpty());
        assertTrue(router.routingState().snapshot().spotReady());
    }

    @Test
    @DisplayName("Serverless requests carry the provider token instead of the client's")
    void injectsServerlessToken() throws Exception {
        startRouter(baseConfig());
        router.routingState().apply(RoutingPatch.serverless(serverless.url(), "rp-secret"));

        post("/v1/completions", "{}", "Authorization", "Bearer client-token");

        assertEquals("Bearer rp-secret", serverless.proxied().get(0).header("Authorization"));
    }

    @Test
    @DisplayName("Spot requests keep the client's Authorization header")
    void spotKeepsClientAuthorization() throws Exception {
        startRouter(baseConfig());
        router.routingState().apply(new RoutingPatch(serverless.url(), "rp-secret", spot.url()));
        router.routingState().recordProbe(spot.url(), true, null);

        post("/v1/completions", "{}", "Authorization", "Bearer client-token");

        assertEquals("Bearer client-token", spot.proxied().get(0).header("Authorization"));
    }

    @Test
    @DisplayName("Hop-by-hop request headers, including ones named in Connection, are stripped")
    void stripsHopByHopHeaders() throws Exception {
        startRouter(baseConfig().withServerlessUrl(serverless.url()));

        try (Socket socket = new Socket("127.0.0.1", router.port())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(("GET /v1/models HTTP/1.1\r\n"
                    + "Host: router\r\n"
                    + "Connection: close, X-Hop-Secret\r\n"
                    + "X-Hop-Secret: do-not-forward\r\n"
                    + "Proxy-Authorization: Basic abc\r\n"
                    + "TE: trailers\r\n"
                    + "X-Request-Id: r-1\r\n"
                    + "\r\n").getBytes(StandardCharsets.US_ASCII));
            out.flush();
            String response = new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            assertTrue(response.startsWith("HTTP/1.1 200"), response);
        }

        TestBackend.Recorded seen = serverless.proxied().get(0);
        assertNull(seen.header("X-Hop-Secret"));
        assertNull(seen.header("Proxy-Authorization"));
        assertNull(seen.header("TE"));
        assertEquals("r-1", seen.header("X-Request-Id"));
        assertNotEquals("router", seen.header("Host"));
    }

    @Test
    @DisplayName("Streaming responses reach the client before the upstream finishes")
    void streamsIncrementally() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        serverless.responder(exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write("data: first\n\n".getBytes(StandardCharsets.UTF_8));
                out.flush();
                release.await(10, TimeUnit.SECONDS);
                out.write("data: second\n\n".getBytes(StandardCharsets.UTF_8));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        startRouter(baseConfig().withServerlessUrl(serverless.url()));

        HttpResponse<InputStream> response = httpClient.send(
                HttpRequest.newBuilder(URI.create(routerUrl() + "/v1/chat/completions"))
                        .POST(HttpRequest.BodyPublishers.ofString("{\"stream\":true}"))
                        .build(),
                HttpResponse.BodyHandlers.ofInputStream());
        assertEquals(200, response.statusCode());
        assertEquals("text/event-stream", response.headers().firstValue("content-type").orElse(null));

        try (InputStream in = response.body()) {
            ByteArrayOutputStream received = new ByteArrayOutputStream();
            byte[] buffer = new byte[256];
            while (!received.toString(StandardCharsets.UTF_8).contains("data: first")) {
                int n = in.read(buffer);
                assertTrue(n > 0, "stream ended before the first event");
                received.write(buffer, 0, n);
            }
            assertFalse(received.toString(StandardCharsets.UTF_8).contains("second"));

            release.countDown();
            received.write(in.readAllBytes());
            assertEquals("data: first\n\ndata: second\n\n", received.toString(StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("With an API key, requests need it and it is not forwarded")
    void apiKeyGuardsEverything() throws Exception {
        startRouter(baseConfig().withServerlessUrl(serverless.url()).withApiKey("router-key"));

        assertEquals(401, get("/v1/models").statusCode());
        assertEquals(401, get("/router/health").statusCode());
        assertEquals(401, post("/router/config", "{}").statusCode());

        HttpResponse<String> ok = post("/v1/models", "{}", "x-api-key", "router-key");
        assertEquals(200, ok.statusCode());
        assertNull(serverless.proxied().get(0).header("x-api-key"));

        HttpResponse<String> bearer = post("/v1/models", "{}", "Authorization", "Bearer router-key");
        assertEquals(200, bearer.statusCode());
        assertNull(serverless.proxied().get(1).header("Authorization"));

        assertEquals(401, post("/v1/models", "{}", "x-api-key", "wrong").statusCode());
    }

    @Test
    @DisplayName("Health can be left open while the API key guards the rest")
    void healthWithoutAuth() throws Exception {
        startRouter(baseConfig().withApiKey("router-key").withAllowHealthWithoutAuth(true));

        assertEquals(200, get("/router/health").statusCode());
        assertEquals(401, get("/v1/models").statusCode());
    }

    @Test
    @DisplayName("Config endpoint rejects malformed JSON and non-http URLs, accepts an empty body")
    void configValidation() throws Exception {
        startRouter(baseConfig());

        assertEquals(400, post("/router/config", "{not json").statusCode());
        assertEquals(400, post("/router/config", "{\"spot_url\":\"ftp://x\"}").statusCode());
        assertEquals(400, post("/router/config", "{\"serverless_url\":\"no-scheme\"}").statusCode());
        assertEquals(200, post("/router/config", "").statusCode());
        assertEquals("NO_BACKENDS", health().get("phase").asText());

        assertEquals(200, post("/router/config", "{\"serverless_url\":\"" + serverless.url() + "\"}").statusCode());
        assertEquals(200, post("/router/config", "{\"serverless_url\":\"\"}").statusCode());
        assertTrue(health().get("serverless_base_url").isNull());
    }

    @Test
    @DisplayName("After stop the router refuses connections and the state is shut down")
    void stopShutsDown() throws Exception {
        startRouter(baseConfig().withServerlessUrl(serverless.url()));
        int port = router.port();
        router.stop();

        assertFalse(router.isRunning());
        assertTrue(router.routingState().snapshot().shutdown());
        assertThrows(IOException.class, () -> httpClient.send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/v1/models")).build(),
                HttpResponse.BodyHandlers.ofString()));
    }
}
