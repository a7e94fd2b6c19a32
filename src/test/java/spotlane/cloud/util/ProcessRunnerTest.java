package spotlane.cloud.util;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    @DisplayName("Exit code and both output streams are captured")
    void capturesOutput() throws Exception {
        ProcessRunner.Result result = runner.run(Duration.ofSeconds(10),
                List.of("sh", "-c", "echo hi; echo oops >&2; exit 3"));

        assertEquals(3, result.exitCode());
        assertEquals("hi\n", result.stdout());
        assertEquals("oops\n", result.stderr());
        assertFalse(result.timedOut());
        assertFalse(result.ok());
    }

    @Test
    @DisplayName("A command past its timeout is killed and reported as timed out")
    void timeoutKills() throws Exception {
        long started = System.nanoTime();
        ProcessRunner.Result result = runner.run(Duration.ofMillis(300), List.of("sleep", "30"));

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 10);
        assertTrue(waitForChild(Duration.ofSeconds(1)).isEmpty());
    }

    @Test
    @DisplayName("Interrupting the caller kills the child before the interrupt propagates")
    void interruptKillsChild() throws Exception {
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                runner.run(Duration.ofSeconds(45), List.of("sleep", "45"));
            } catch (Throwable t) {
                thrown.set(t);
            }
        }, "runner-caller");
        caller.start();

        ProcessHandle child = waitForChild(Duration.ofSeconds(10)).orElseThrow();
        caller.interrupt();
        caller.join(10_000);

        assertFalse(caller.isAlive());
        assertInstanceOf(InterruptedException.class, thrown.get());
        child.onExit().get(5, TimeUnit.SECONDS);
        assertFalse(child.isAlive());
    }

    private static Optional<ProcessHandle> waitForChild(Duration wait) throws InterruptedException {
        long deadline = System.nanoTime() + wait.toNanos();
        do {
            Optional<ProcessHandle> child = ProcessHandle.current().children()
                    .filter(ProcessHandle::isAlive)
                    .filter(h -> h.info().command().map(c -> c.endsWith("sleep")).orElse(true))
                    .findFirst();
            if (child.isPresent()) {
                return child;
            }
            Thread.sleep(20);
        } while (System.nanoTime() < deadline);
        return Optional.empty();
    }
}
