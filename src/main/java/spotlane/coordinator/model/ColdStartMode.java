package spotlane.coordinator.model;

import java.util.Locale;

/**
 * How vLLM trades cold-start time against steady-state throughput.
 */
public enum ColdStartMode {
    /** Skip CUDA graph capture ({@code --enforce-eager}); faster boot, lower throughput. */
    FAST_BOOT,
    /** Capture CUDA graphs; slower boot, better throughput. */
    NO_FAST_BOOT;

    public boolean enforceEager() {
        return this == FAST_BOOT;
    }

    /** Accepts {@code fast_boot}, {@code fast-boot}, {@code FAST_BOOT}. */
    public static ColdStartMode parse(String value) {
        if (value == null || value.isBlank()) {
            return FAST_BOOT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ColdStartMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cold start mode: " + value
                    + " (expected fast_boot or no_fast_boot)");
        }
    }
}
