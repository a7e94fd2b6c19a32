package spotlane.cloud.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IniLoaderTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("A complete file loads with defaults for optional keys")
    void loads() throws IOException {
        Path key = write("id.pub", "ssh-ed25519 AAAA me@host\n");
        Path ini = write("yandex.ini", """
                [AUTH]
                folder_id = b1g-folder
                zone_id = ru-central1-a

                [NETWORK]
                subnet_id = e9b-subnet

                [VM]
                image_id = fd8-image
                disk_gb = 200

                [SSH]
                user = ubuntu
                public_key_path = %s
                """.formatted(key.toString().replace("\\", "/")));

        CloudConfig cfg = IniLoader.load(ini.toFile()).orElseThrow();

        assertEquals("b1g-folder", cfg.folderId());
        assertEquals("e9b-subnet", cfg.subnetId());
        assertEquals(200, cfg.diskGb());
        assertEquals(0, cfg.cpu());
        assertTrue(cfg.preemptible());
        assertTrue(cfg.publicIp());
        assertNull(cfg.platformId());
        assertEquals("ssh-ed25519 AAAA me@host", cfg.sshPublicKey());
    }

    @Test
    @DisplayName("Missing sections, keys or SSH key yield empty")
    void incomplete() throws IOException {
        Path noSsh = write("a.ini", """
                [AUTH]
                folder_id = f
                zone_id = z
                [NETWORK]
                subnet_id = s
                [VM]
                image_id = i
                """);
        assertEquals(Optional.empty(), IniLoader.load(noSsh.toFile()));

        Path noKey = write("b.ini", """
                [AUTH]
                folder_id = f
                zone_id = z
                [NETWORK]
                subnet_id = s
                [VM]
                image_id = i
                [SSH]
                user = ubuntu
                """);
        assertEquals(Optional.empty(), IniLoader.load(noKey.toFile()));

        Path noImage = write("c.ini", """
                [AUTH]
                folder_id = f
                zone_id = z
                [NETWORK]
                subnet_id = s
                [VM]
                preemptible = false
                [SSH]
                user = ubuntu
                public_key = ssh-rsa AAAA
                """);
        assertEquals(Optional.empty(), IniLoader.load(noImage.toFile()));

        assertEquals(Optional.empty(), IniLoader.load(dir.resolve("missing.ini").toFile()));
    }
}
