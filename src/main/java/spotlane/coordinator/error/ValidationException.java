package spotlane.coordinator.error;

/**
 * A deploy request (or provider configuration) that can never succeed.
 * Raised before any backend is contacted and never retried.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
