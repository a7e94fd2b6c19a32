package spotlane.router.proxy;

import org.junit.jupiter.api.*;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class ProxyTargetsTest {

    @Test
    @DisplayName("Path and query are appended to the base URL")
    void joinsPathAndQuery() {
        URI uri = ProxyTargets.build("http://spot:8000", "/v1/completions?stream=true&n=2");
        assertEquals("http://spot:8000/v1/completions?stream=true&n=2", uri.toString());
    }

    @Test
    @DisplayName("Base path prefixes are kept")
    void keepsBasePath() {
        URI uri = ProxyTargets.build("https://api.runpod.ai/v2/abc123/openai/", "/v1/models");
        assertEquals("https://api.runpod.ai/v2/abc123/openai/v1/models", uri.toString());
    }

    @Test
    @DisplayName("Dot segments and duplicate slashes are dropped")
    void sanitizesTraversal() {
        URI uri = ProxyTargets.build("http://spot:8000/base", "/../../etc/./passwd//x");
        assertEquals("http://spot:8000/base/etc/passwd/x", uri.toString());
    }

    @Test
    @DisplayName("An absolute URI in the request line cannot change the host")
    void absoluteRequestUriStaysOnBackend() {
        URI uri = ProxyTargets.build("http://spot:8000", "//evil.example/steal");
        assertEquals("spot", uri.getHost());
        assertEquals(8000, uri.getPort());
    }

    @Test
    @DisplayName("Fragments are stripped and an empty URI maps to the base root")
    void fragmentAndEmpty() {
        assertEquals("http://spot/a", ProxyTargets.build("http://spot", "/a#frag").toString());
        assertEquals("http://spot/", ProxyTargets.build("http://spot", "").toString());
        assertEquals("http://spot/", ProxyTargets.build("http://spot", "/?").toString());
    }

    @Test
    @DisplayName("Characters that do not form a URI are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> ProxyTargets.build("http://spot", "/a b"));
    }
}
