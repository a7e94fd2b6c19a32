package spotlane.cloud.util;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class CloudInitBuilderTest {

    @Test
    @DisplayName("User data installs the key and runs vLLM under systemd")
    void rendersUserData() {
        String userData = CloudInitBuilder.buildVllmUserData("ubuntu", "ssh-ed25519 AAAA me@host", "0.15.1",
                "vllm serve Qwen/Qwen2.5-7B-Instruct --port 8001", "8001", null);

        assertTrue(userData.startsWith("#cloud-config"));
        assertTrue(userData.contains("- name: ubuntu"));
        assertTrue(userData.contains("- ssh-ed25519 AAAA me@host"));
        assertTrue(userData.contains("-p 8001:8001"));
        assertTrue(userData.contains("vllm/vllm-openai:v0.15.1"));
        assertTrue(userData.contains("-c 'vllm serve Qwen/Qwen2.5-7B-Instruct --port 8001'"));
        assertTrue(userData.contains("HF_TOKEN=\n"));
    }

    @Test
    @DisplayName("A command with single quotes would break the unit file and is refused")
    void rejectsQuotes() {
        assertThrows(IllegalArgumentException.class, () -> CloudInitBuilder.buildVllmUserData("ubuntu", "key",
                "0.15.1", "vllm serve 'x'", "8001", null));
    }
}
