package spotlane.router.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.router.config.RouterConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget nudge to a cold spot backend so its own autoscaler wakes
 * up. Short timeout, throttled, result discarded. Nothing waits on it.
 */
public class SpotPoker {

    private static final Logger log = LoggerFactory.getLogger(SpotPoker.class);

    private final RouterConfig config;
    private final HttpClient client;
    private final AtomicLong lastPokeNanos = new AtomicLong(System.nanoTime() - Long.MAX_VALUE / 2);
    private final AtomicLong pokesSent = new AtomicLong();

    public SpotPoker(RouterConfig config, HttpClient client) {
        this.config = config;
        this.client = client;
    }

    public void poke(String spotUrl) {
        if (spotUrl == null) {
            return;
        }
        long now = System.nanoTime();
        long last = lastPokeNanos.get();
        if (now - last < config.pokeMinInterval().toNanos() || !lastPokeNanos.compareAndSet(last, now)) {
            return;
        }
        pokesSent.incrementAndGet();
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(spotUrl + config.spotPokePath()))
                    .timeout(config.pokeTimeout())
                    .GET()
                    .build();
            client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                    .exceptionally(e -> {
                        log.trace("Poke {} failed: {}", spotUrl, e.toString());
                        return null;
                    });
        } catch (IllegalArgumentException e) {
            log.trace("Poke skipped, bad spot url {}", spotUrl);
        }
    }

    public long pokesSent() {
        return pokesSent.get();
    }
}
