package spotlane.cloud.util;

import spotlane.cloud.template.TemplateRenderer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * cloud-init user data for a spot GPU VM that runs vLLM in Docker under
 * systemd, so the server comes back after a reboot.
 */
public final class CloudInitBuilder {

    static final String TEMPLATE = "templates/cloud_init_vllm.yaml.tpl";

    private CloudInitBuilder() {}

    public static String buildVllmUserData(String user, String sshPublicKey, String vllmVersion,
                                           String vllmCommand, String port, String hfToken) {
        if (vllmCommand.contains("'")) {
            throw new IllegalArgumentException("vLLM command must not contain single quotes");
        }
        Map<String, String> values = new LinkedHashMap<>();
        values.put("ssh_user", user);
        values.put("ssh_key", sshPublicKey);
        values.put("vllm_version", vllmVersion);
        values.put("vllm_cmd", vllmCommand);
        values.put("port", port);
        values.put("hf_token", hfToken == null ? "" : hfToken);
        return TemplateRenderer.renderResource(TEMPLATE, values);
    }
}
