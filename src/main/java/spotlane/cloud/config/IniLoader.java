package spotlane.cloud.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Loads Yandex Cloud settings from an INI file with sections
 * [AUTH], [NETWORK], [VM], [SSH].
 */
public class IniLoader {
    private static final Logger log = LoggerFactory.getLogger(IniLoader.class);

    public static Optional<CloudConfig> load(File file) {
        try {
            Ini ini = new Ini(file);

            Profile.Section auth = ini.get("AUTH");
            Profile.Section net  = ini.get("NETWORK");
            Profile.Section vm   = ini.get("VM");
            Profile.Section ssh  = ini.get("SSH");

            if (auth == null || net == null || vm == null || ssh == null) {
                log.warn("{}: [AUTH], [NETWORK], [VM] and [SSH] sections are required", file);
                return Optional.empty();
            }

            String keyPath = opt(ssh, "public_key_path");
            String keyText = opt(ssh, "public_key");
            if ((keyText == null || keyText.isBlank()) && keyPath != null && !keyPath.isBlank()) {
                keyText = Files.readString(new File(keyPath).toPath()).trim();
            }
            if (keyText == null || keyText.isBlank()) {
                log.warn("{}: no SSH public key (public_key or public_key_path)", file);
                return Optional.empty();
            }

            // the OAuth token itself always comes from the environment
            String folderId = auth.fetch("folder_id");
            String zoneId = auth.fetch("zone_id");
            String subnetId = net.fetch("subnet_id");
            String imageId = vm.fetch("image_id");
            String user = ssh.fetch("user");
            if (folderId == null || zoneId == null || subnetId == null || imageId == null || user == null) {
                log.warn("{}: folder_id, zone_id, subnet_id, image_id and user are required", file);
                return Optional.empty();
            }

            CloudConfig cfg = new CloudConfig(
                    opt(auth, "cloud_id"),
                    folderId,
                    zoneId,
                    subnetId,
                    opt(net, "security_group_id"),
                    Boolean.parseBoolean(opt(net, "public_ip", "true")),
                    imageId,
                    opt(vm, "platform_id"),
                    Integer.parseInt(opt(vm, "cpu", "0")),
                    Integer.parseInt(opt(vm, "ram_gb", "0")),
                    Integer.parseInt(opt(vm, "disk_gb", String.valueOf(CloudConfig.DEFAULT_DISK_GB))),
                    Boolean.parseBoolean(opt(vm, "preemptible", "true")),
                    user,
                    keyText.trim());
            log.debug("Loaded {} from {}", cfg, file);
            return Optional.of(cfg);
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to load cloud config {}: {}", file, ex.toString());
            return Optional.empty();
        }
    }

    static String opt(Profile.Section s, String key) {
        return s == null ? null : s.get(key);
    }

    static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }
}
