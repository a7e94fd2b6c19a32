package spotlane.coordinator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.router.api.dto.RouterConfigRequest;
import spotlane.router.config.RouterConfig;
import spotlane.router.state.RoutingPatch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Talks to a router's admin endpoints over HTTP. The coordinator pushes
 * backend URLs this way even when the router runs in the same process, so a
 * remote router behaves the same.
 */
public class RouterClient {

    private static final Logger log = LoggerFactory.getLogger(RouterClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient client;
    private final RouterConfig routerConfig;
    private final int retries;
    private final Duration delay;

    public RouterClient(RouterConfig routerConfig, int retries, Duration delay) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(2))
                .build(), routerConfig, retries, delay);
    }

    public RouterClient(HttpClient client, RouterConfig routerConfig, int retries, Duration delay) {
        this.client = client;
        this.routerConfig = routerConfig;
        this.retries = Math.max(1, retries);
        this.delay = delay;
    }

    /**
     * POST the patch to {@code /router/config}, retrying on failure.
     *
     * @return whether the router accepted it
     */
    public boolean push(String routerUrl, RoutingPatch patch) {
        String body;
        try {
            body = MAPPER.writeValueAsString(RouterConfigRequest.of(patch));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot serialize routing patch", e);
        }
        HttpRequest request = authorized(HttpRequest.newBuilder(URI.create(routerUrl + "/router/config")))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        for (int attempt = 1; attempt <= retries; attempt++) {
            try {
                HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() == 200) {
                    log.info("Pushed routing update to {}", routerUrl);
                    return true;
                }
                log.warn("Router {} rejected update (attempt {}/{}): {} {}", routerUrl, attempt, retries,
                        response.statusCode(), response.body());
            } catch (IOException e) {
                log.warn("Router {} unreachable (attempt {}/{}): {}", routerUrl, attempt, retries, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            if (attempt < retries && !sleep()) {
                return false;
            }
        }
        log.error("Giving up pushing routing update to {} after {} attempts", routerUrl, retries);
        return false;
    }

    /**
     * GET {@code /router/health}; empty when the router cannot be reached.
     */
    public Optional<JsonNode> health(String routerUrl) {
        HttpRequest request = authorized(HttpRequest.newBuilder(URI.create(routerUrl + "/router/health")))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Router health {} returned {}", routerUrl, response.statusCode());
                return Optional.empty();
            }
            return Optional.of(MAPPER.readTree(response.body()));
        } catch (IOException e) {
            log.debug("Router health {} unreachable: {}", routerUrl, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (routerConfig.hasApiKey()) {
            builder.header(routerConfig.apiKeyHeader(), routerConfig.apiKey());
        }
        return builder;
    }

    private boolean sleep() {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
