package spotlane.coordinator.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import spotlane.coordinator.error.ValidationException;
import spotlane.coordinator.model.ScalingPolicy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScalingPolicyLoaderTest {

    @Test
    @DisplayName("Keys present override defaults; the rest keep them")
    void partialOverride() {
        ScalingPolicy policy = ScalingPolicyLoader.parse("""
                [spot]
                min_replicas = 1
                max_replicas = 3
                target_qps = 2.5

                [serverless]
                workers_max = 4
                """);

        assertEquals(1, policy.spot().minReplicas());
        assertEquals(3, policy.spot().maxReplicas());
        assertEquals(2.5, policy.spot().targetQps());
        assertEquals(300, policy.spot().downscaleDelaySeconds());
        assertEquals(4, policy.serverless().workersMax());
        assertEquals(32, policy.serverless().concurrency());
    }

    @Test
    @DisplayName("An empty file yields the defaults")
    void empty() {
        assertEquals(ScalingPolicy.defaults(), ScalingPolicyLoader.parse(""));
    }

    @Test
    @DisplayName("Unknown sections and keys are all reported")
    void unknownEntries() {
        ValidationException e = assertThrows(ValidationException.class, () -> ScalingPolicyLoader.parse("""
                [spot]
                min_replica = 1
                [gpu]
                type = H100
                """));
        assertTrue(e.getMessage().contains("unknown section [gpu]"), e.getMessage());
        assertTrue(e.getMessage().contains("unknown key spot.min_replica"), e.getMessage());
    }

    @Test
    @DisplayName("Non-numeric and out-of-range values are rejected")
    void badValues() {
        assertThrows(ValidationException.class, () -> ScalingPolicyLoader.parse("[spot]\nmax_replicas = many\n"));
        ValidationException range = assertThrows(ValidationException.class,
                () -> ScalingPolicyLoader.parse("[spot]\nmin_replicas = 4\nmax_replicas = 2\n"));
        assertTrue(range.getMessage().contains("max_replicas"), range.getMessage());
        assertThrows(ValidationException.class, () -> ScalingPolicyLoader.parse("[serverless]\nconcurrency = 0\n"));
    }

    @Test
    @DisplayName("Files load the same way, and a missing file is a validation error")
    void files(@TempDir Path dir) throws IOException {
        Path ini = dir.resolve("scaling.ini");
        Files.writeString(ini, "[serverless]\nworkers_min = 1\nworkers_max = 2\n", StandardCharsets.UTF_8);

        ScalingPolicy policy = ScalingPolicyLoader.load(ini.toFile());
        assertEquals(1, policy.serverless().workersMin());

        assertThrows(ValidationException.class,
                () -> ScalingPolicyLoader.load(new File(dir.toFile(), "missing.ini")));
    }

    @Test
    @DisplayName("Disabling scale-to-zero raises both minimums to one")
    void scaleToZeroOff() {
        ScalingPolicy policy = ScalingPolicy.defaults().applyScaleToZero(false);
        assertEquals(1, policy.spot().minReplicas());
        assertEquals(1, policy.serverless().workersMin());
        assertEquals(ScalingPolicy.defaults(), ScalingPolicy.defaults().applyScaleToZero(true));
    }
}
