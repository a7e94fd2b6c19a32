package spotlane.router.state;

/**
 * The two upstream kinds the router can pick.
 */
public enum Backend {
    SERVERLESS("serverless"),
    SPOT("spot");

    private final String label;

    Backend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
