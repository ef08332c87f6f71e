package tech.grantwell.engine;

/**
 * Access token encoding strategy.
 */
public enum TokenFormat {
    /** Random bearer string validated by storage lookup. */
    OPAQUE,
    /** Signed RS256 JWT validated by signature and expiry. */
    JWT
}
