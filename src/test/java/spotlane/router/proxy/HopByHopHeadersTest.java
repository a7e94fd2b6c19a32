package spotlane.router.proxy;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import org.junit.jupiter.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HopByHopHeadersTest {

    @Test
    @DisplayName("Standard hop-by-hop headers are never forwarded")
    void standardHeaders() {
        for (String name : List.of("Connection", "Keep-Alive", "Proxy-Authenticate", "Proxy-Authorization",
                "TE", "Trailers", "Transfer-Encoding", "Upgrade")) {
            assertFalse(HopByHopHeaders.isForwardable(name, Set.of()), name);
        }
        assertFalse(HopByHopHeaders.isForwardable("Host", Set.of()));
        assertFalse(HopByHopHeaders.isForwardable("Content-Length", Set.of()));
        assertTrue(HopByHopHeaders.isForwardable("Content-Type", Set.of()));
        assertTrue(HopByHopHeaders.isForwardable("Authorization", Set.of()));
    }

    @Test
    @DisplayName("Headers named in Connection are treated as hop-by-hop")
    void connectionTokens() {
        Set<String> tokens = HopByHopHeaders.connectionTokens(List.of("keep-alive, X-Trace-Hop", " close "));
        assertEquals(Set.of("keep-alive", "x-trace-hop", "close"), tokens);
        assertFalse(HopByHopHeaders.isForwardable("X-Trace-Hop", tokens));
        assertTrue(HopByHopHeaders.isForwardable("X-Request-Id", tokens));
    }

    @Test
    @DisplayName("Response header copy drops hop-by-hop and pseudo headers")
    void copyResponseHeaders() {
        Map<String, List<String>> upstream = new LinkedHashMap<>();
        upstream.put(":status", List.of("200"));
        upstream.put("content-type", List.of("text/event-stream"));
        upstream.put("connection", List.of("x-internal"));
        upstream.put("x-internal", List.of("secret"));
        upstream.put("transfer-encoding", List.of("chunked"));
        upstream.put("set-cookie", List.of("a=1", "b=2"));

        HttpHeaders downstream = new DefaultHttpHeaders();
        HopByHopHeaders.copyResponseHeaders(upstream, downstream);

        assertEquals("text/event-stream", downstream.get("content-type"));
        assertEquals(List.of("a=1", "b=2"), downstream.getAll("set-cookie"));
        assertFalse(downstream.contains("connection"));
        assertFalse(downstream.contains("x-internal"));
        assertFalse(downstream.contains("transfer-encoding"));
        assertFalse(downstream.contains(":status"));
    }
}
