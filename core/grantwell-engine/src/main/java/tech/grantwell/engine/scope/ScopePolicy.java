package tech.grantwell.engine.scope;

import org.jboss.logging.Logger;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;

/**
 * Decides which scopes a token may carry.
 *
 * <p>A requested scope is accepted only when it is a subset of the ceiling the grant
 * allows, and of the server-wide registry when one is configured. An empty request
 * falls back to the grant's defaults.
 */
public class ScopePolicy {

    private static final Logger LOG = Logger.getLogger(ScopePolicy.class);

    private final ScopeSet availableScopes;

    /**
     * @param availableScopes server-wide scope registry; empty means unrestricted
     */
    public ScopePolicy(ScopeSet availableScopes) {
        this.availableScopes = availableScopes == null ? ScopeSet.empty() : availableScopes;
    }

    public boolean isSubset(ScopeSet requested, ScopeSet allowed) {
        return requested.isSubsetOf(allowed);
    }

    public ScopeSet defaultFor(OAuthClient client) {
        return client.defaultScope();
    }

    /**
     * Upper bound for user-delegated grants (authorization code, password, implicit).
     */
    public ScopeSet ceilingFor(OAuthClient client) {
        return client.allowedScope().isEmpty() ? client.defaultScope() : client.allowedScope();
    }

    /**
     * Resolve the scope a token will carry.
     *
     * @param requested scope sent by the client, possibly empty
     * @param ceiling   the most the grant can authorize
     * @param defaults  scope used when nothing was requested
     * @return the resolved scope
     * @throws OAuthException {@code invalid_scope} when the request exceeds the ceiling
     */
    public ScopeSet resolve(ScopeSet requested, ScopeSet ceiling, ScopeSet defaults) {
        ScopeSet resolved = requested.isEmpty() ? defaults : requested;

        if (!requested.isEmpty() && !requested.isSubsetOf(ceiling)) {
            LOG.debugf("Requested scope exceeds ceiling by [%s]", requested.minus(ceiling));
            throw OAuthException.invalidScope("Requested scope exceeds the scope granted to this client");
        }
        if (!availableScopes.isEmpty() && !resolved.isSubsetOf(availableScopes)) {
            LOG.debugf("Scope not registered on this server: [%s]", resolved.minus(availableScopes));
            throw OAuthException.invalidScope("Unknown scope: " + resolved.minus(availableScopes));
        }
        return resolved;
    }
}
