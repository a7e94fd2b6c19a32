package spotlane.router.state;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing counters plus a ring buffer of the most recent outcomes.
 * Not thread-safe: guarded by the owning {@link RoutingState}'s lock.
 */
final class RouteStats {

    private record Sample(Backend backend, boolean error) {
    }

    private final int windowSize;
    private final Deque<Sample> window;
    private final Map<Backend, long[]> counts = new EnumMap<>(Backend.class);
    private final Map<Backend, long[]> errors = new EnumMap<>(Backend.class);
    private final Map<Backend, long[]> elapsedNanos = new EnumMap<>(Backend.class);
    private long rejected;

    RouteStats(int windowSize) {
        this.windowSize = Math.max(1, windowSize);
        this.window = new ArrayDeque<>(this.windowSize);
        for (Backend b : Backend.values()) {
            counts.put(b, new long[1]);
            errors.put(b, new long[1]);
            elapsedNanos.put(b, new long[1]);
        }
    }

    void record(Backend backend, Duration elapsed, boolean success) {
        counts.get(backend)[0]++;
        elapsedNanos.get(backend)[0] += Math.max(0, elapsed.toNanos());
        if (!success) {
            errors.get(backend)[0]++;
        }
        if (window.size() == windowSize) {
            window.removeFirst();
        }
        window.addLast(new Sample(backend, !success));
    }

    void recordRejected() {
        rejected++;
    }

    long total() {
        return counts.get(Backend.SPOT)[0] + counts.get(Backend.SERVERLESS)[0];
    }

    Map<String, Object> toMap(Duration uptime, Duration spotReadyTime) {
        long spot = counts.get(Backend.SPOT)[0];
        long serverless = counts.get(Backend.SERVERLESS)[0];
        long total = spot + serverless;

        long windowSpot = 0;
        long windowErrors = 0;
        for (Sample s : window) {
            if (s.backend() == Backend.SPOT) {
                windowSpot++;
            }
            if (s.error()) {
                windowErrors++;
            }
        }
        int windowTotal = window.size();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total", total);
        out.put("spot", spot);
        out.put("serverless", serverless);
        out.put("pct_spot", pct(spot, total));
        out.put("pct_serverless", pct(serverless, total));
        out.put("window_total", windowTotal);
        out.put("window_spot", windowSpot);
        out.put("window_serverless", windowTotal - windowSpot);
        out.put("errors_spot", errors.get(Backend.SPOT)[0]);
        out.put("errors_serverless", errors.get(Backend.SERVERLESS)[0]);
        out.put("window_error_rate", windowTotal == 0 ? 0.0 : round((double) windowErrors / windowTotal));
        out.put("avg_latency_ms_spot", avgMillis(Backend.SPOT));
        out.put("avg_latency_ms_serverless", avgMillis(Backend.SERVERLESS));
        out.put("gpu_seconds_spot", seconds(elapsedNanos.get(Backend.SPOT)[0]));
        out.put("gpu_seconds_serverless", seconds(elapsedNanos.get(Backend.SERVERLESS)[0]));
        out.put("rejected", rejected);
        out.put("uptime_seconds", seconds(uptime.toNanos()));
        out.put("spot_ready_seconds", seconds(spotReadyTime.toNanos()));
        return out;
    }

    private double avgMillis(Backend backend) {
        long n = counts.get(backend)[0];
        return n == 0 ? 0.0 : round(elapsedNanos.get(backend)[0] / 1_000_000.0 / n);
    }

    private static double pct(long part, long total) {
        return total == 0 ? 0.0 : round(100.0 * part / total);
    }

    private static double seconds(long nanos) {
        return round(nanos / 1_000_000_000.0);
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
