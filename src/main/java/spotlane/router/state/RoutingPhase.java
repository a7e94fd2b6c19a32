package spotlane.router.state;

/**
 * Observable phase of the router, derived from a snapshot and never stored.
 */
public enum RoutingPhase {
    /** Neither URL known */
    NO_BACKENDS,
    /** Only a spot URL is known and it is not ready yet */
    SPOT_WARMING,
    /** Serverless serves; spot unset or not ready */
    SERVERLESS_ONLY,
    /** Spot set and ready */
    SPOT_PREFERRED,
    /** Router stopped */
    SHUTDOWN
}
