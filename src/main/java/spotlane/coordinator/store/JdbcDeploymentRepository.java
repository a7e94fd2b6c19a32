package spotlane.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import spotlane.coordinator.model.ComponentStatus;
import spotlane.coordinator.model.DeploymentRecord;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.DeploymentStatus;
import spotlane.coordinator.repository.DeploymentRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of DeploymentRepository. Maps are stored as JSON.
 */
public class JdbcDeploymentRepository implements DeploymentRepository {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };
    private static final int MAX_ERROR_LENGTH = 2048;

    private final Database db;

    public JdbcDeploymentRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(DeploymentRecord record) {
        String sql = """
                    MERGE INTO deployments (service_name, status, model_name, gpu, gpu_count,
                        serverless_provider, spot_provider, region, router_url, request_json,
                        serverless_status, serverless_endpoint, serverless_deployment_id, serverless_metadata,
                        serverless_error, spot_status, spot_endpoint, spot_deployment_id, spot_metadata,
                        spot_error, created_at, updated_at)
                    KEY (service_name)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, record.serviceName());
            ps.setString(2, record.status().name());
            ps.setString(3, record.modelName());
            ps.setString(4, record.gpu());
            ps.setInt(5, record.gpuCount());
            ps.setString(6, record.serverlessProvider());
            ps.setString(7, record.spotProvider());
            ps.setString(8, record.region());
            ps.setString(9, record.routerUrl());
            ps.setString(10, toJson(record.request()));
            ps.setString(11, record.serverlessStatus().name());
            ps.setString(12, record.serverlessEndpoint());
            ps.setString(13, record.serverlessDeploymentId());
            ps.setString(14, toJson(record.serverlessMetadata()));
            ps.setString(15, truncate(record.serverlessError()));
            ps.setString(16, record.spotStatus().name());
            ps.setString(17, record.spotEndpoint());
            ps.setString(18, record.spotDeploymentId());
            ps.setString(19, toJson(record.spotMetadata()));
            ps.setString(20, truncate(record.spotError()));
            setTimestamp(ps, 21, record.createdAt() != null ? record.createdAt() : now);
            setTimestamp(ps, 22, now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save deployment: " + record.serviceName(), e);
        }
    }

    @Override
    public Optional<DeploymentRecord> findByServiceName(String serviceName) {
        String sql = "SELECT * FROM deployments WHERE service_name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, serviceName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find deployment: " + serviceName, e);
        }
    }

    @Override
    public List<DeploymentRecord> findAll() {
        String sql = "SELECT * FROM deployments ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all deployments", e);
        }
    }

    @Override
    public List<DeploymentRecord> findByStatus(DeploymentStatus status) {
        String sql = "SELECT * FROM deployments WHERE status = ? ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find deployments by status: " + status, e);
        }
    }

    @Override
    public boolean updateStatus(String serviceName, DeploymentStatus status) {
        String sql;
        if (status == DeploymentStatus.DESTROYED) {
            sql = """
                        UPDATE deployments
                        SET status = ?, updated_at = ?,
                            serverless_status = CASE WHEN serverless_status = 'SKIPPED' THEN 'SKIPPED' ELSE 'DESTROYED' END,
                            spot_status = CASE WHEN spot_status = 'SKIPPED' THEN 'SKIPPED' ELSE 'DESTROYED' END
                        WHERE service_name = ?
                    """;
        } else {
            sql = "UPDATE deployments SET status = ?, updated_at = ? WHERE service_name = ?";
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, serviceName);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update deployment status: " + serviceName, e);
        }
    }

    @Override
    public boolean updateSpot(String serviceName, DeploymentStatus status, ComponentStatus spotStatus,
            DeploymentResult spot) {
        String sql = """
                    UPDATE deployments
                    SET status = ?, spot_status = ?, spot_endpoint = ?, spot_deployment_id = ?,
                        spot_metadata = ?, spot_error = ?, updated_at = ?
                    WHERE service_name = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, spotStatus.name());
            ps.setString(3, spot == null ? null : spot.endpointUrl());
            ps.setString(4, spot == null ? null : spot.deploymentId());
            ps.setString(5, toJson(spot == null ? Map.of() : spot.metadata()));
            ps.setString(6, spot == null ? null : truncate(spot.error()));
            setTimestamp(ps, 7, Instant.now());
            ps.setString(8, serviceName);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update spot leg of deployment: " + serviceName, e);
        }
    }

    @Override
    public Set<String> activeServiceNames() {
        String sql = "SELECT service_name FROM deployments WHERE status NOT IN ('DESTROYED', 'FAILED')";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            Set<String> names = new LinkedHashSet<>();
            while (rs.next()) {
                names.add(rs.getString(1));
            }
            return names;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list active deployments", e);
        }
    }

    // Helper methods

    private List<DeploymentRecord> mapRows(ResultSet rs) throws SQLException {
        List<DeploymentRecord> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private DeploymentRecord mapRow(ResultSet rs) throws SQLException {
        return DeploymentRecord.builder()
                .serviceName(rs.getString("service_name"))
                .status(DeploymentStatus.valueOf(rs.getString("status")))
                .modelName(rs.getString("model_name"))
                .gpu(rs.getString("gpu"))
                .gpuCount(rs.getInt("gpu_count"))
                .serverlessProvider(rs.getString("serverless_provider"))
                .spotProvider(rs.getString("spot_provider"))
                .region(rs.getString("region"))
                .routerUrl(rs.getString("router_url"))
                .request(fromJson(rs.getString("request_json"), OBJECT_MAP))
                .serverlessStatus(componentStatus(rs.getString("serverless_status")))
                .serverlessEndpoint(rs.getString("serverless_endpoint"))
                .serverlessDeploymentId(rs.getString("serverless_deployment_id"))
                .serverlessMetadata(fromJson(rs.getString("serverless_metadata"), STRING_MAP))
                .serverlessError(rs.getString("serverless_error"))
                .spotStatus(componentStatus(rs.getString("spot_status")))
                .spotEndpoint(rs.getString("spot_endpoint"))
                .spotDeploymentId(rs.getString("spot_deployment_id"))
                .spotMetadata(fromJson(rs.getString("spot_metadata"), STRING_MAP))
                .spotError(rs.getString("spot_error"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static ComponentStatus componentStatus(String value) {
        return value == null ? ComponentStatus.PENDING : ComponentStatus.valueOf(value);
    }

    private static String toJson(Map<String, ?> map) {
        try {
            return JSON.writeValueAsString(map == null ? Map.of() : map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize map", e);
        }
    }

    private static <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return JSON.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) {
            return s;
        }
        return s.substring(0, MAX_ERROR_LENGTH);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
