package spotlane.coordinator.error;

/**
 * One backend did not come up. Isolated to that backend: the other half of a
 * hybrid deployment keeps running.
 */
public class ProviderDeployException extends RuntimeException {

    private final String provider;

    public ProviderDeployException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderDeployException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
