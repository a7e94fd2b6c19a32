package spotlane.router.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.router.config.RouterConfig;
import spotlane.router.state.RoutingSnapshot;
import spotlane.router.state.RoutingState;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Recurring readiness checks against the spot backend.
 *
 * <p>
 * Ticks run on one daemon thread and idle while no spot URL is known. Any
 * caller may also {@link #trigger()} a probe; triggers collapse: no new probe
 * is issued while one is in flight or before the minimum interval since the
 * last one has passed.
 */
public class ReadinessProber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReadinessProber.class);

    private final RoutingState state;
    private final RouterConfig config;
    private final HttpClient client;
    private final ScheduledExecutorService ticker;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicLong probesIssued = new AtomicLong();
    // only touched by the thread holding inFlight
    private long lastIssuedNanos;
    private boolean issuedBefore;

    private ScheduledFuture<?> tick;

    public ReadinessProber(RoutingState state, RouterConfig config, HttpClient client) {
        this.state = state;
        this.config = config;
        this.client = client;
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "spotlane-prober");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start ticking. Idempotent.
     */
    public synchronized void start() {
        if (tick != null || ticker.isShutdown()) {
            return;
        }
        long intervalMs = config.probeInterval().toMillis();
        tick = ticker.scheduleWithFixedDelay(wrapRunnable("probe-tick", this::trigger),
                0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Readiness prober started (every {}ms, timeout {}ms)", intervalMs,
                config.probeTimeout().toMillis());
    }

    /**
     * Cancel ticking. A probe already in flight still completes and is
     * recorded only if the spot URL is unchanged.
     */
    public synchronized void stop() {
        if (tick != null) {
            tick.cancel(false);
            tick = null;
            log.info("Readiness prober stopped");
        }
    }

    public synchronized boolean isRunning() {
        return tick != null;
    }

    /**
     * Issue a probe unless one is in flight or the minimum interval has not
     * elapsed.
     *
     * @return the pending probe, or {@code null} when collapsed into an
     *         existing one or there is no spot URL
     */
    public CompletableFuture<ProbeOutcome> trigger() {
        RoutingSnapshot snapshot = state.snapshot();
        if (!snapshot.hasSpot() || snapshot.shutdown()) {
            return null;
        }
        if (!inFlight.compareAndSet(false, true)) {
            return null;
        }
        long now = System.nanoTime();
        if (issuedBefore && now - lastIssuedNanos < config.probeMinInterval().toNanos()) {
            inFlight.set(false);
            return null;
        }
        issuedBefore = true;
        lastIssuedNanos = now;
        probesIssued.incrementAndGet();

        String spotUrl = snapshot.spotUrl();
        CompletableFuture<ProbeOutcome> pending;
        try {
            pending = probe(spotUrl);
        } catch (RuntimeException e) {
            pending = CompletableFuture.completedFuture(ProbeOutcome.failure(e.toString()));
        }
        return pending.whenComplete((outcome, error) -> {
            try {
                ProbeOutcome result = outcome != null ? outcome : ProbeOutcome.failure(String.valueOf(error));
                boolean applied = state.recordProbe(spotUrl, result.ok(), result.error());
                if (applied && !result.ok()) {
                    log.debug("Spot probe {} failed: {}", spotUrl, result.error());
                }
            } finally {
                inFlight.set(false);
            }
        });
    }

    private CompletableFuture<ProbeOutcome> probe(String spotUrl) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(spotUrl + config.spotReadyPath()))
                    .timeout(config.probeTimeout())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ProbeOutcome.failure("bad spot url: " + e.getMessage()));
        }
        return client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        return ProbeOutcome.failure(cause.getClass().getSimpleName()
                                + (cause.getMessage() == null ? "" : ": " + cause.getMessage()));
                    }
                    int code = response.statusCode();
                    return code >= 200 && code < 300 ? ProbeOutcome.success() : ProbeOutcome.failure("status=" + code);
                });
    }

    /** Probes actually sent since creation. */
    public long probesIssued() {
        return probesIssued.get();
    }

    @Override
    public void close() {
        stop();
        ticker.shutdownNow();
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
