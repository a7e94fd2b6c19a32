package spotlane.cloud.catalog;

/**
 * Hardware facts for one GPU type.
 *
 * @param shortName canonical name used everywhere else ("L4", "A100_80GB")
 * @param fullName  vendor name ("NVIDIA L4")
 * @param vramGb    memory per GPU
 * @param arch      architecture family ("ada", "ampere", "hopper", ...)
 */
public record GpuSpec(String shortName, String fullName, int vramGb, String arch) {
}
