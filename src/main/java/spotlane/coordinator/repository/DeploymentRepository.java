package spotlane.coordinator.repository;

import spotlane.coordinator.model.ComponentStatus;
import spotlane.coordinator.model.DeploymentRecord;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.DeploymentStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for deployment records, keyed by service name.
 */
public interface DeploymentRepository {

    /**
     * Insert or fully replace a record.
     */
    void save(DeploymentRecord record);

    Optional<DeploymentRecord> findByServiceName(String serviceName);

    /**
     * All records, newest first.
     */
    List<DeploymentRecord> findAll();

    List<DeploymentRecord> findByStatus(DeploymentStatus status);

    /**
     * @return true if a record was updated
     */
    boolean updateStatus(String serviceName, DeploymentStatus status);

    /**
     * Record the outcome of the spot leg together with the resulting overall
     * status.
     *
     * @return true if a record was updated
     */
    boolean updateSpot(String serviceName, DeploymentStatus status, ComponentStatus spotStatus,
            DeploymentResult spot);

    /**
     * Service names held by deployments that are not destroyed or failed.
     */
    Set<String> activeServiceNames();
}
