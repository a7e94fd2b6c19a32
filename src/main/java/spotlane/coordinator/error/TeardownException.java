package spotlane.coordinator.error;

import java.util.List;

/**
 * Aggregate of every teardown step that failed. Each failure is attached as a
 * suppressed exception; the steps after a failure were still attempted.
 */
public class TeardownException extends RuntimeException {

    public TeardownException(String message, List<? extends Throwable> failures) {
        super(message + " (" + failures.size() + " failure(s))");
        failures.forEach(this::addSuppressed);
    }

    public int failureCount() {
        return getSuppressed().length;
    }

    /**
     * Throw if anything was collected.
     */
    public static void throwIfAny(String message, List<? extends Throwable> failures) {
        if (!failures.isEmpty()) {
            throw new TeardownException(message, failures);
        }
    }
}
