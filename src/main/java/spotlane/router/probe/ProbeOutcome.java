package spotlane.router.probe;

/**
 * Result of one readiness probe. Probe failures are data, never exceptions.
 *
 * @param error {@code null} when {@code ok}
 */
public record ProbeOutcome(boolean ok, String error) {

    public static ProbeOutcome success() {
        return new ProbeOutcome(true, null);
    }

    public static ProbeOutcome failure(String error) {
        return new ProbeOutcome(false, error);
    }
}
