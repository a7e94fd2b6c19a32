package spotlane.cloud.creator;

import java.util.List;

/**
 * Everything needed to create one GPU VM.
 */
public record VmSpec(
        String folderId,
        String zoneId,
        String platformId,
        String name,
        String imageId,
        String subnetId,
        List<String> securityGroupIds,
        int cores,
        int memoryGb,
        int diskGb,
        int gpus,
        boolean assignPublicIp,
        boolean preemptible,
        String userData
) {}
