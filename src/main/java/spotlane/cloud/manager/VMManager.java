package spotlane.cloud.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.cloud.auth.AuthService;
import yandex.cloud.api.compute.v1.InstanceOuterClass.Instance;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;
import yandex.cloud.api.operation.OperationOuterClass.Operation;
import yandex.cloud.sdk.utils.OperationUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Lookups and deletion for spot VMs created by
 * {@link spotlane.cloud.creator.VMCreator}.
 */
public class VMManager {
    private static final Logger log = LoggerFactory.getLogger(VMManager.class);

    private final AuthService auth;

    public VMManager(AuthService auth) {
        this.auth = auth;
    }

    /** NAT address of the first interface, or empty when it has none. */
    public String getPublicIp(String instanceId) {
        Instance instance = auth.instances().get(InstanceServiceOuterClass.GetInstanceRequest.newBuilder()
                .setInstanceId(instanceId)
                .build());
        if (instance.getNetworkInterfacesCount() == 0) {
            return "";
        }
        var address = instance.getNetworkInterfaces(0).getPrimaryV4Address();
        return address.hasOneToOneNat() ? address.getOneToOneNat().getAddress() : "";
    }

    public Optional<Instance> findByName(String folderId, String name) {
        var list = auth.instances().list(InstanceServiceOuterClass.ListInstancesRequest.newBuilder()
                .setFolderId(folderId)
                .setFilter("name=\"" + name + "\"")
                .build());
        return list.getInstancesCount() == 0 ? Optional.empty() : Optional.of(list.getInstances(0));
    }

    /** Delete and wait for the operation to finish. */
    public void delete(String instanceId, Duration wait) throws InterruptedException {
        Operation op = auth.instances().delete(InstanceServiceOuterClass.DeleteInstanceRequest.newBuilder()
                .setInstanceId(instanceId)
                .build());
        Operation done = OperationUtils.wait(auth.operations(), op, wait);
        if (done.hasError()) {
            throw new IllegalStateException("Delete of " + instanceId + " failed: " + done.getError().getMessage());
        }
        log.info("VM deleted: {}", instanceId);
    }
}
