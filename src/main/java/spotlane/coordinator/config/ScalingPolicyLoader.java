package spotlane.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.model.ScalingPolicy;
import spotlane.coordinator.model.ScalingPolicy.ServerlessScaling;
import spotlane.coordinator.model.ScalingPolicy.SpotScaling;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads autoscaling overrides from an INI file:
 *
 * <pre>
 * [spot]
 * min_replicas = 1
 * max_replicas = 3
 *
 * [serverless]
 * workers_max = 2
 * </pre>
 *
 * Keys left out keep their defaults. Unknown sections or keys are rejected.
 */
public final class ScalingPolicyLoader {

    private static final Set<String> SPOT_KEYS = Set.of(
            "min_replicas", "max_replicas", "target_qps", "upscale_delay_seconds", "downscale_delay_seconds");
    private static final Set<String> SERVERLESS_KEYS = Set.of(
            "concurrency", "scaledown_window_seconds", "timeout_seconds", "workers_min", "workers_max");

    private ScalingPolicyLoader() {
    }

    public static ScalingPolicy load(File file) {
        try {
            return parse(new Ini(file), file.getPath());
        } catch (IOException e) {
            throw new ValidationException("Cannot read scaling policy " + file + ": " + e.getMessage(), e);
        }
    }

    public static ScalingPolicy load(Reader reader) {
        try {
            return parse(new Ini(reader), "<inline>");
        } catch (IOException e) {
            throw new ValidationException("Cannot read scaling policy: " + e.getMessage(), e);
        }
    }

    public static ScalingPolicy parse(String text) {
        return load(new StringReader(text));
    }

    private static ScalingPolicy parse(Ini ini, String source) {
        List<String> errors = new ArrayList<>();
        for (String section : ini.keySet()) {
            if (!section.equals("spot") && !section.equals("serverless")) {
                errors.add("unknown section [" + section + "]");
            }
        }

        Profile.Section spot = ini.get("spot");
        Profile.Section serverless = ini.get("serverless");
        checkKeys(spot, "spot", SPOT_KEYS, errors);
        checkKeys(serverless, "serverless", SERVERLESS_KEYS, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(source + ": " + String.join("; ", errors));
        }

        SpotScaling spotDefaults = SpotScaling.defaults();
        ServerlessScaling serverlessDefaults = ServerlessScaling.defaults();
        try {
            SpotScaling spotScaling = new SpotScaling(
                    intValue(spot, "min_replicas", spotDefaults.minReplicas()),
                    intValue(spot, "max_replicas", spotDefaults.maxReplicas()),
                    doubleValue(spot, "target_qps", spotDefaults.targetQps()),
                    intValue(spot, "upscale_delay_seconds", spotDefaults.upscaleDelaySeconds()),
                    intValue(spot, "downscale_delay_seconds", spotDefaults.downscaleDelaySeconds()));
            ServerlessScaling serverlessScaling = new ServerlessScaling(
                    intValue(serverless, "concurrency", serverlessDefaults.concurrency()),
                    intValue(serverless, "scaledown_window_seconds", serverlessDefaults.scaledownWindowSeconds()),
                    intValue(serverless, "timeout_seconds", serverlessDefaults.timeoutSeconds()),
                    intValue(serverless, "workers_min", serverlessDefaults.workersMin()),
                    intValue(serverless, "workers_max", serverlessDefaults.workersMax()));
            return new ScalingPolicy(spotScaling, serverlessScaling);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(source + ": " + e.getMessage(), e);
        }
    }

    private static void checkKeys(Profile.Section section, String name, Set<String> allowed, List<String> errors) {
        if (section == null) {
            return;
        }
        for (String key : section.keySet()) {
            if (!allowed.contains(key)) {
                errors.add("unknown key " + name + "." + key);
            }
        }
    }

    private static int intValue(Profile.Section section, String key, int fallback) {
        String raw = section == null ? null : section.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw);
        }
    }

    private static double doubleValue(Profile.Section section, String key, double fallback) {
        String raw = section == null ? null : section.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + raw);
        }
    }
}
