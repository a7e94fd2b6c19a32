package spotlane.cloud.catalog;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static GPU catalog: hardware specs, aliases and per-provider offerings with
 * list prices.
 */
public final class GpuCatalog {

    private static final Map<String, GpuSpec> SPECS = new LinkedHashMap<>();
    private static final Map<String, String> ALIASES = Map.of(
            "A100", "A100_80GB",
            "4090", "RTX4090");
    private static final List<ProviderGpu> OFFERINGS;
    private static final Map<String, String> SKYPILOT_NAMES = Map.of(
            "T4", "T4",
            "L4", "L4",
            "L40S", "L40S",
            "A10G", "A10G",
            "A100_40GB", "A100",
            "A100_80GB", "A100-80GB",
            "H100", "H100",
            "H200", "H200",
            "B200", "B200");

    static {
        spec("T4", "NVIDIA T4", 16, "turing");
        spec("A10", "NVIDIA A10", 24, "ampere");
        spec("A10G", "NVIDIA A10G", 24, "ampere");
        spec("L4", "NVIDIA L4", 24, "ada");
        spec("A4000", "NVIDIA RTX A4000", 16, "ampere");
        spec("A5000", "NVIDIA RTX A5000", 24, "ampere");
        spec("A6000", "NVIDIA RTX A6000", 48, "ampere");
        spec("RTX4090", "NVIDIA GeForce RTX 4090", 24, "ada");
        spec("A40", "NVIDIA A40", 48, "ampere");
        spec("L40", "NVIDIA L40", 48, "ada");
        spec("L40S", "NVIDIA L40S", 48, "ada");
        spec("A100_40GB", "NVIDIA A100 40GB", 40, "ampere");
        spec("A100_80GB", "NVIDIA A100 80GB SXM", 80, "ampere");
        spec("H100_MIG", "NVIDIA H100 MIG", 40, "hopper");
        spec("H100", "NVIDIA H100 80GB HBM3", 80, "hopper");
        spec("H200", "NVIDIA H200", 141, "hopper");
        spec("B200", "NVIDIA B200", 192, "blackwell");
        spec("RTX_PRO_6000", "NVIDIA RTX PRO 6000", 32, "blackwell");

        OFFERINGS = List.of(
                new ProviderGpu("A4000", "runpod", "NVIDIA RTX A4000", 0.43),
                new ProviderGpu("A5000", "runpod", "NVIDIA RTX A5000", 0.58),
                new ProviderGpu("L4", "runpod", "NVIDIA L4", 2.74),
                new ProviderGpu("RTX4090", "runpod", "NVIDIA GeForce RTX 4090", 1.01),
                new ProviderGpu("A6000", "runpod", "NVIDIA RTX A6000", 0.79),
                new ProviderGpu("L40", "runpod", "NVIDIA L40", 1.15),
                new ProviderGpu("L40S", "runpod", "NVIDIA L40S", 1.58),
                new ProviderGpu("A40", "runpod", "NVIDIA A40", 0.79),
                new ProviderGpu("A100_80GB", "runpod", "NVIDIA A100-SXM4-80GB", 1.12),
                new ProviderGpu("H100", "runpod", "NVIDIA H100 80GB HBM3", 4.97),
                new ProviderGpu("H200", "runpod", "NVIDIA H200", 0.0),
                new ProviderGpu("B200", "runpod", "NVIDIA B200", 0.0),

                // Yandex Compute GPU platforms, preemptible
                new ProviderGpu("T4", "yandex", "standard-v3-t4", 0.0),
                new ProviderGpu("A100_80GB", "yandex", "gpu-standard-v3", 0.0));
    }

    private GpuCatalog() {
    }

    private static void spec(String shortName, String fullName, int vramGb, String arch) {
        SPECS.put(shortName, new GpuSpec(shortName, fullName, vramGb, arch));
    }

    /**
     * Resolve aliases to the canonical short name. Unknown names come back
     * upper-cased so validation can report them.
     */
    public static String normalize(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (SPECS.containsKey(trimmed)) {
            return trimmed;
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (SPECS.containsKey(upper)) {
            return upper;
        }
        return ALIASES.getOrDefault(upper, upper);
    }

    public static boolean isKnown(String gpu) {
        return SPECS.containsKey(normalize(gpu));
    }

    public static Optional<GpuSpec> spec(String gpu) {
        return Optional.ofNullable(SPECS.get(normalize(gpu)));
    }

    public static List<String> knownGpus() {
        return List.copyOf(SPECS.keySet());
    }

    /** Whether the catalog lists anything at all for this provider. */
    public static boolean lists(String provider) {
        return OFFERINGS.stream().anyMatch(o -> o.provider().equals(provider));
    }

    public static Optional<ProviderGpu> offering(String provider, String gpu) {
        String canonical = normalize(gpu);
        return OFFERINGS.stream()
                .filter(o -> o.provider().equals(provider) && o.gpu().equals(canonical))
                .findFirst();
    }

    public static List<ProviderGpu> offerings(String provider) {
        return OFFERINGS.stream().filter(o -> o.provider().equals(provider)).toList();
    }

    /** Cheapest priced offering of a GPU across providers. */
    public static Optional<ProviderGpu> cheapest(String gpu) {
        String canonical = normalize(gpu);
        return OFFERINGS.stream()
                .filter(o -> o.gpu().equals(canonical) && o.isPriced())
                .min(Comparator.comparingDouble(ProviderGpu::pricePerGpuHour));
    }

    /** Accelerator name SkyPilot expects; falls back to the short name. */
    public static String skyPilotName(String gpu) {
        String canonical = normalize(gpu);
        return SKYPILOT_NAMES.getOrDefault(canonical, canonical);
    }
}
