package spotlane.cloud.config;

/**
 * Yandex Cloud placement for spot GPU VMs, read from an INI file by
 * {@link IniLoader}.
 *
 * @param platformId optional; derived from the GPU when null
 * @param cpu        0 for the platform's per-GPU default
 * @param ramGb      0 for the platform's per-GPU default
 */
public record CloudConfig(
        String cloudId,
        String folderId,
        String zoneId,
        String subnetId,
        String securityGroupId,
        boolean publicIp,
        String imageId,
        String platformId,
        int cpu,
        int ramGb,
        int diskGb,
        boolean preemptible,
        String sshUser,
        String sshPublicKey) {

    public static final int DEFAULT_DISK_GB = 100;

    /** Public key omitted. */
    @Override
    public String toString() {
        return "CloudConfig{folderId='" + folderId + "', zoneId='" + zoneId + "', subnetId='" + subnetId
                + "', imageId='" + imageId + "', preemptible=" + preemptible + "}";
    }
}
