package spotlane.cloud.template;

import spotlane.coordinator.error.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {key}} placeholders in a single pass. Substituted values are
 * never re-scanned, so a value containing braces cannot inject another
 * placeholder. Doubled braces produce literal braces.
 *
 * <p>
 * Any placeholder left without a value is an error.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");
    private static final String LBRACE = "\u0000LBRACE\u0000";
    private static final String RBRACE = "\u0000RBRACE\u0000";

    private TemplateRenderer() {
    }

    public static String render(String template, Map<String, String> values) {
        String protectedText = template.replace("{{", LBRACE).replace("}}", RBRACE);

        Set<String> missing = new TreeSet<>();
        Matcher m = PLACEHOLDER.matcher(protectedText);
        StringBuilder out = new StringBuilder(protectedText.length() + 64);
        while (m.find()) {
            String key = m.group(1);
            String value = values.get(key);
            if (value == null) {
                missing.add(key);
                m.appendReplacement(out, Matcher.quoteReplacement(m.group(0)));
            } else {
                m.appendReplacement(out, Matcher.quoteReplacement(value));
            }
        }
        m.appendTail(out);

        if (!missing.isEmpty()) {
            throw new ValidationException("Unresolved template placeholders: " + missing);
        }
        return out.toString().replace(LBRACE, "{").replace(RBRACE, "}");
    }

    /**
     * Render a template bundled on the classpath, e.g.
     * {@code templates/skyserve_vllm.yaml.tpl}.
     */
    public static String renderResource(String resourcePath, Map<String, String> values) {
        return render(loadResource(resourcePath), values);
    }

    static String loadResource(String resourcePath) {
        try (InputStream in = TemplateRenderer.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Template not found on classpath: " + resourcePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template " + resourcePath, e);
        }
    }
}
