package spotlane.cloud.creator;

import com.google.protobuf.InvalidProtocolBufferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.auth.AuthService;
import yandex.cloud.api.compute.v1.InstanceOuterClass.IpVersion;
import yandex.cloud.api.compute.v1.InstanceOuterClass.SchedulingPolicy;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass.AttachedDiskSpec;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass.CreateInstanceMetadata;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass.CreateInstanceRequest;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass.NetworkInterfaceSpec;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass.OneToOneNatSpec;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass.PrimaryAddressSpec;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass.ResourcesSpec;
import yandex.cloud.api.operation.OperationOuterClass.Operation;
import yandex.cloud.sdk.utils.OperationUtils;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Creates GPU VMs on Yandex Compute.
 */
public class VMCreator {
    private static final Logger log = LoggerFactory.getLogger(VMCreator.class);

    private static final long GIB = 1L << 30;
    private final AuthService auth;

    public VMCreator(AuthService auth) {
        this.auth = auth;
    }

    /**
     * Send the create request and report the instance id as soon as it is
     * known, then block until the operation finishes.
     *
     * @param onInstanceId receives the id before waiting, so a failed wait
     *                     still leaves something to tear down
     */
    public String create(VmSpec spec, Duration wait, Consumer<String> onInstanceId)
            throws InvalidProtocolBufferException, InterruptedException {

        Operation pending = auth.instances().create(buildCreateInstanceRequest(spec));
        String instanceId = pending.getMetadata().unpack(CreateInstanceMetadata.class).getInstanceId();
        log.info("Create sent: name={} id={}", spec.name(), instanceId);
        onInstanceId.accept(instanceId);

        Operation finished = OperationUtils.wait(auth.operations(), pending, wait);
        if (finished.hasError()) {
            throw new IllegalStateException("Instance " + instanceId + " failed: " + finished.getError().getMessage());
        }
        log.info("VM {} is up (id={})", spec.name(), instanceId);
        return instanceId;
    }

    static CreateInstanceRequest buildCreateInstanceRequest(VmSpec spec) {
        return CreateInstanceRequest.newBuilder()
                .setFolderId(spec.folderId())
                .setZoneId(spec.zoneId())
                .setName(spec.name())
                .setPlatformId(spec.platformId())
                .setResourcesSpec(resources(spec))
                .setBootDiskSpec(bootDisk(spec))
                .addNetworkInterfaceSpecs(networkInterface(spec))
                .setSchedulingPolicy(SchedulingPolicy.newBuilder().setPreemptible(spec.preemptible()))
                .putMetadata("user-data", spec.userData())
                .build();
    }

    private static ResourcesSpec resources(VmSpec spec) {
        return ResourcesSpec.newBuilder()
                .setCores(spec.cores())
                .setMemory(spec.memoryGb() * GIB)
                .setGpus(spec.gpus())
                .build();
    }

    // disk is deleted together with the instance
    private static AttachedDiskSpec bootDisk(VmSpec spec) {
        return AttachedDiskSpec.newBuilder()
                .setAutoDelete(true)
                .setDiskSpec(AttachedDiskSpec.DiskSpec.newBuilder()
                        .setImageId(spec.imageId())
                        .setSize(spec.diskGb() * GIB))
                .build();
    }

    private static NetworkInterfaceSpec networkInterface(VmSpec spec) {
        PrimaryAddressSpec.Builder address = PrimaryAddressSpec.newBuilder();
        if (spec.assignPublicIp()) {
            address.setOneToOneNatSpec(OneToOneNatSpec.newBuilder().setIpVersion(IpVersion.IPV4));
        }
        NetworkInterfaceSpec.Builder nic = NetworkInterfaceSpec.newBuilder()
                .setSubnetId(spec.subnetId())
                .setPrimaryV4AddressSpec(address);
        if (spec.securityGroupIds() != null) {
            nic.addAllSecurityGroupIds(spec.securityGroupIds());
        }
        return nic.build();
    }
}
