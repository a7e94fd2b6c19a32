package spotlane.cloud.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an external command with a timeout and captures its output. Shell
 * helpers go through here so adapters can be tested with a scripted runner.
 *
 * <p>
 * The child never outlives the call: on timeout or interruption it is killed
 * before returning.
 */
public class ProcessRunner {

    private static final AtomicInteger DRAIN_SEQ = new AtomicInteger();

    // blocking stream reads, kept off the common pool
    private static final ExecutorService DRAINS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "spotlane-process-drain-" + DRAIN_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /**
     * @param exitCode -1 when the process was killed on timeout
     */
    public record Result(int exitCode, String stdout, String stderr, boolean timedOut) {

        public boolean ok() {
            return exitCode == 0 && !timedOut;
        }

        /** Both streams, for matching on messages the CLI may print to either. */
        public String combined() {
            return stdout + stderr;
        }
    }

    /**
     * @throws InterruptedException after killing the child, when the calling
     *                              thread is interrupted while waiting
     */
    public Result run(Duration timeout, List<String> command) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(command).start();
        try {
            p.getOutputStream().close();
            CompletableFuture<String> out = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()), DRAINS);
            CompletableFuture<String> err = CompletableFuture.supplyAsync(() -> drain(p.getErrorStream()), DRAINS);

            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                kill(p);
                return new Result(-1, join(out), join(err), true);
            }
            return new Result(p.exitValue(), join(out), join(err), false);
        } finally {
            if (p.isAlive()) {
                kill(p);
            }
        }
    }

    private static void kill(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            p.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String join(CompletableFuture<String> stream) throws InterruptedException {
        try {
            return stream.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            return "";
        }
    }
}
