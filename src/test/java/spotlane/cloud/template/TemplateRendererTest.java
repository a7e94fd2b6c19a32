package spotlane.cloud.template;

import org.junit.jupiter.api.*;
import spotlane.coordinator.error.ValidationException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRendererTest {

    @Test
    @DisplayName("Placeholders are replaced")
    void renders() {
        assertEquals("serve m on 8001", TemplateRenderer.render("serve {model} on {port}",
                Map.of("model", "m", "port", "8001")));
    }

    @Test
    @DisplayName("Substituted values are not scanned again")
    void noReinjection() {
        String out = TemplateRenderer.render("a={a} b={b}", Map.of("a", "{b}", "b", "x"));
        assertEquals("a={b} b=x", out);
    }

    @Test
    @DisplayName("Doubled braces are literal")
    void escapedBraces() {
        assertEquals("${{ secrets }} {model}", TemplateRenderer.render("${{{{ secrets }}}} {{model}}", Map.of()));
    }

    @Test
    @DisplayName("Every missing key is reported")
    void missingKeys() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> TemplateRenderer.render("{a} {b} {c}", Map.of("b", "1")));
        assertTrue(e.getMessage().contains("[a, c]"), e.getMessage());
    }

    @Test
    @DisplayName("Values with regex replacement characters are inserted verbatim")
    void dollarSignsInValues() {
        assertEquals("k=$1\\x", TemplateRenderer.render("k={v}", Map.of("v", "$1\\x")));
    }

    @Test
    @DisplayName("Bundled templates render and unknown ones fail")
    void resources() {
        String cmd = TemplateRenderer.renderResource("templates/vllm_serve_cmd.txt", Map.of(
                "model", "Qwen/Qwen2.5-7B", "host", "0.0.0.0", "port", "8001", "max_model_len", "4096",
                "tp_size", "1", "eager_flag", ""));
        assertTrue(cmd.startsWith("vllm serve Qwen/Qwen2.5-7B --host 0.0.0.0 --port 8001"));
        assertThrows(IllegalStateException.class,
                () -> TemplateRenderer.renderResource("templates/missing.tpl", Map.of()));
    }
}
