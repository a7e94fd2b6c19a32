package spotlane.cloud.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Shared HTTP GET used by the default {@link InferenceProvider#status}.
 */
final class HealthChecks {
    private static final Logger log = LoggerFactory.getLogger(HealthChecks.class);

    static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();

    private HealthChecks() {
    }

    static HealthState get(String url, String bearerToken) {
        if (url == null || url.isBlank()) {
            return HealthState.UNKNOWN;
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(TIMEOUT)
                .GET();
        if (bearerToken != null && !bearerToken.isBlank()) {
            request.header("Authorization", "Bearer " + bearerToken);
        }
        try {
            int code = CLIENT.send(request.build(), HttpResponse.BodyHandlers.discarding()).statusCode();
            return code >= 200 && code < 300 ? HealthState.HEALTHY : HealthState.UNHEALTHY;
        } catch (IOException e) {
            log.debug("Health check {} failed: {}", url, e.toString());
            return HealthState.UNHEALTHY;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthState.UNHEALTHY;
        }
    }
}
