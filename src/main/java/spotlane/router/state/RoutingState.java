package spotlane.router.state;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * The single source of truth consulted on every proxied request.
 *
 * <p>
 * Every field, including the statistics, is guarded by one lock. Readers get
 * an immutable {@link RoutingSnapshot}; writers go through
 * {@link #apply(RoutingPatch)}, {@link #recordProbe} and the outcome
 * recorders. No other access exists, so a reader can never see a spot URL
 * paired with readiness that belonged to a previous URL.
 */
public final class RoutingState {

    private final Object lock = new Object();
    private final Clock clock;
    private final Instant startedAt;
    private final RouteStats stats;

    private String serverlessUrl;
    private String serverlessAuthToken;
    private String spotUrl;
    private boolean spotReady;
    private Instant lastProbeAt;
    private String lastProbeError;
    private boolean shutdown;

    private Instant spotReadySince;
    private Duration spotReadyAccumulated = Duration.ZERO;

    public RoutingState() {
        this(200, Clock.systemUTC());
    }

    public RoutingState(int windowSize, Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.stats = new RouteStats(windowSize);
    }

    public RoutingSnapshot snapshot() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    /**
     * Apply a partial patch. Fields absent from the patch keep their value.
     * A different spot URL starts out not ready.
     */
    public RoutingSnapshot apply(RoutingPatch patch) {
        synchronized (lock) {
            if (patch.serverlessUrl() != null) {
                serverlessUrl = emptyToNull(patch.serverlessUrl());
            }
            if (patch.serverlessAuthToken() != null) {
                serverlessAuthToken = emptyToNull(patch.serverlessAuthToken());
            }
            if (patch.spotUrl() != null) {
                String next = emptyToNull(patch.spotUrl());
                if (next == null ? spotUrl != null : !next.equals(spotUrl)) {
                    spotUrl = next;
                    setSpotReady(false);
                    lastProbeError = null;
                    lastProbeAt = null;
                }
            }
            return snapshotLocked();
        }
    }

    /**
     * Record a probe result for {@code probedSpotUrl}. Ignored when the spot
     * URL changed while the probe was in flight.
     *
     * @return whether the result was applied
     */
    public boolean recordProbe(String probedSpotUrl, boolean ok, String error) {
        synchronized (lock) {
            if (spotUrl == null || !spotUrl.equals(probedSpotUrl)) {
                return false;
            }
            setSpotReady(ok);
            lastProbeError = ok ? null : error;
            lastProbeAt = clock.instant();
            return true;
        }
    }

    /**
     * Mark spot not ready after a failed forward, without waiting for the
     * next probe.
     */
    public void markSpotUnready(String failedSpotUrl, String error) {
        synchronized (lock) {
            if (spotUrl != null && spotUrl.equals(failedSpotUrl)) {
                setSpotReady(false);
                lastProbeError = error;
            }
        }
    }

    public void recordOutcome(Backend backend, Duration elapsed, boolean success) {
        synchronized (lock) {
            stats.record(backend, elapsed, success);
        }
    }

    public void recordRejected() {
        synchronized (lock) {
            stats.recordRejected();
        }
    }

    /** Number of forwarded requests across both backends. */
    public long totalRouted() {
        synchronized (lock) {
            return stats.total();
        }
    }

    public Map<String, Object> routeStats() {
        synchronized (lock) {
            Instant now = clock.instant();
            Duration ready = spotReadyAccumulated;
            if (spotReadySince != null) {
                ready = ready.plus(Duration.between(spotReadySince, now));
            }
            return stats.toMap(Duration.between(startedAt, now), ready);
        }
    }

    /** Terminal: every later decision is "no backend". */
    public void shutdown() {
        synchronized (lock) {
            setSpotReady(false);
            shutdown = true;
        }
    }

    private void setSpotReady(boolean ready) {
        if (ready == spotReady) {
            return;
        }
        Instant now = clock.instant();
        if (ready) {
            spotReadySince = now;
        } else if (spotReadySince != null) {
            spotReadyAccumulated = spotReadyAccumulated.plus(Duration.between(spotReadySince, now));
            spotReadySince = null;
        }
        spotReady = ready;
    }

    private RoutingSnapshot snapshotLocked() {
        return new RoutingSnapshot(serverlessUrl, serverlessAuthToken, spotUrl, spotReady, lastProbeAt,
                lastProbeError, shutdown);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
