package spotlane.router.proxy;

import spotlane.router.state.Backend;

/**
 * Transport failure or timeout before the upstream response head arrived.
 * A backend-returned error status is not one of these.
 */
public class UpstreamException extends RuntimeException {

    private final Backend backend;

    public UpstreamException(Backend backend, String baseUrl, Throwable cause) {
        super(backend.label() + " " + baseUrl + ": " + describe(cause), cause);
        this.backend = backend;
    }

    public Backend backend() {
        return backend;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : " " + message);
    }
}
