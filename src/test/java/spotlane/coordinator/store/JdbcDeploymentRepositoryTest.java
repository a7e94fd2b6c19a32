package spotlane.coordinator.store;

import org.junit.jupiter.api.*;
import spotlane.coordinator.config.CoordinatorConfig;
import spotlane.coordinator.model.ComponentStatus;
import spotlane.coordinator.model.DeploymentRecord;
import spotlane.coordinator.model.DeploymentResult;
import spotlane.coordinator.model.DeploymentStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDeploymentRepositoryTest {

    private static Database db;
    private static JdbcDeploymentRepository repo;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-deployments;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcDeploymentRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanDeployments() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM deployments");
            conn.commit();
        }
    }

    private static DeploymentRecord.Builder record(String name) {
        return DeploymentRecord.builder()
                .serviceName(name)
                .status(DeploymentStatus.ACTIVE)
                .modelName("Qwen/Qwen2.5-7B-Instruct")
                .gpu("H100")
                .gpuCount(2)
                .serverlessProvider("runpod")
                .spotProvider("skyserve")
                .routerUrl("http://127.0.0.1:8080")
                .request(Map.of("model_name", "Qwen/Qwen2.5-7B-Instruct", "gpu_count", 2))
                .serverlessStatus(ComponentStatus.UP)
                .serverlessEndpoint("https://api.runpod.ai/v2/ep1/openai")
                .serverlessDeploymentId("ep1")
                .serverlessMetadata(Map.of("endpoint_id", "ep1", "template_id", "t1"))
                .spotStatus(ComponentStatus.PENDING)
                .createdAt(Instant.now());
    }

    @Test
    void saveAndFindByServiceName() {
        repo.save(record("svc-1").build());

        Optional<DeploymentRecord> found = repo.findByServiceName("svc-1");
        assertTrue(found.isPresent());
        DeploymentRecord r = found.get();
        assertEquals(DeploymentStatus.ACTIVE, r.status());
        assertEquals(2, r.gpuCount());
        assertEquals("ep1", r.serverlessDeploymentId());
        assertEquals(Map.of("endpoint_id", "ep1", "template_id", "t1"), r.serverlessMetadata());
        assertEquals(2, r.request().get("gpu_count"));
        assertEquals(ComponentStatus.PENDING, r.spotStatus());
        assertNotNull(r.createdAt());
        assertNotNull(r.updatedAt());

        assertTrue(repo.findByServiceName("missing").isEmpty());
    }

    @Test
    void saveIsAnUpsert() {
        Instant created = Instant.parse("2026-01-01T00:00:00Z");
        repo.save(record("svc-1").createdAt(created).build());
        repo.save(record("svc-1").createdAt(created).status(DeploymentStatus.DEGRADED).build());

        assertEquals(1, repo.findAll().size());
        DeploymentRecord r = repo.findByServiceName("svc-1").orElseThrow();
        assertEquals(DeploymentStatus.DEGRADED, r.status());
        assertEquals(created, r.createdAt());
    }

    @Test
    void updateSpot() {
        repo.save(record("svc-1").build());

        DeploymentResult spot = DeploymentResult.success("skyserve", "svc-1", "http://1.2.3.4:30001", null,
                Map.of("service_name", "svc-1"));
        assertTrue(repo.updateSpot("svc-1", DeploymentStatus.ACTIVE, ComponentStatus.UP, spot));
        assertFalse(repo.updateSpot("nope", DeploymentStatus.ACTIVE, ComponentStatus.UP, spot));

        DeploymentRecord r = repo.findByServiceName("svc-1").orElseThrow();
        assertEquals(ComponentStatus.UP, r.spotStatus());
        assertEquals("http://1.2.3.4:30001", r.spotEndpoint());
        assertEquals("svc-1", r.spotMetadata().get("service_name"));
        assertEquals("http://1.2.3.4:30001", r.spotResult().endpointUrl());
    }

    @Test
    void longErrorsAreTruncated() {
        String huge = "x".repeat(5000);
        repo.save(record("svc-1").spotStatus(ComponentStatus.FAILED).spotError(huge).build());

        assertEquals(2048, repo.findByServiceName("svc-1").orElseThrow().spotError().length());
    }

    @Test
    void destroyMarksComponentsButKeepsSkipped() {
        repo.save(record("svc-1").spotProvider(null).spotStatus(ComponentStatus.SKIPPED).build());

        assertTrue(repo.updateStatus("svc-1", DeploymentStatus.DESTROYED));

        DeploymentRecord r = repo.findByServiceName("svc-1").orElseThrow();
        assertEquals(DeploymentStatus.DESTROYED, r.status());
        assertEquals(ComponentStatus.DESTROYED, r.serverlessStatus());
        assertEquals(ComponentStatus.SKIPPED, r.spotStatus());
        assertFalse(repo.updateStatus("missing", DeploymentStatus.DESTROYED));
    }

    @Test
    void findByStatusAndActiveNames() {
        repo.save(record("svc-a").build());
        repo.save(record("svc-b").status(DeploymentStatus.FAILED).build());
        repo.save(record("svc-c").status(DeploymentStatus.DESTROYED).build());
        repo.save(record("svc-d").status(DeploymentStatus.DEGRADED).build());

        List<DeploymentRecord> failed = repo.findByStatus(DeploymentStatus.FAILED);
        assertEquals(1, failed.size());
        assertEquals("svc-b", failed.get(0).serviceName());

        assertEquals(Set.of("svc-a", "svc-d"), repo.activeServiceNames());
        assertEquals(4, repo.findAll().size());
    }

    @Test
    void healthCheck() {
        assertTrue(db.isHealthy());
    }
}
