package spotlane.router.server;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Local upstream for router tests. Records every request and answers with a
 * fixed status and body unless a custom handler is installed.
 */
public final class TestBackend implements AutoCloseable {

    public record Recorded(String method, String uri, Headers headers, String body) {
        public String header(String name) {
            return headers.getFirst(name);
        }
    }

    @FunctionalInterface
    public interface Responder {
        void respond(HttpExchange exchange) throws IOException;
    }

    private final String name;
    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private volatile int healthStatus = 200;
    private volatile int status = 200;
    private volatile Responder responder;

    public TestBackend(String name) throws IOException {
        this.name = name;
        this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        Headers copy = new Headers();
        copy.putAll(exchange.getRequestHeaders());
        requests.add(new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().toString(), copy, body));

        if (exchange.getRequestURI().getPath().equals("/health")) {
            exchange.sendResponseHeaders(healthStatus, -1);
            exchange.close();
            return;
        }
        Responder custom = responder;
        if (custom != null) {
            custom.respond(exchange);
            return;
        }
        byte[] bytes = ("{\"backend\":\"" + name + "\",\"path\":\"" + exchange.getRequestURI().getPath() + "\"}")
                .getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("X-Backend", name);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    public String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public void healthStatus(int code) {
        this.healthStatus = code;
    }

    public void status(int code) {
        this.status = code;
    }

    public void responder(Responder responder) {
        this.responder = responder;
    }

    /** Requests other than readiness probes and pokes. */
    public List<Recorded> proxied() {
        return requests.stream().filter(r -> !r.uri().startsWith("/health")).toList();
    }

    public String lastHealthAuthorization() {
        List<Recorded> hits = requests.stream().filter(r -> r.uri().startsWith("/health")).toList();
        return hits.isEmpty() ? null : hits.get(hits.size() - 1).header("Authorization");
    }

    public long healthHits() {
        return requests.stream().filter(r -> r.uri().startsWith("/health")).count();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
