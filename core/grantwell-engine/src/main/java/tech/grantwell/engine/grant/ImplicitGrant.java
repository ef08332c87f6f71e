package tech.grantwell.engine.grant;

import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.scope.ScopePolicy;
import tech.grantwell.engine.scope.ScopeSet;

/**
 * Implicit grant ({@code response_type=token}): the access token is returned from the
 * authorization step directly. Never issues a refresh token.
 */
public class ImplicitGrant {

    private final ScopePolicy scopePolicy;
    private final EngineConfig config;

    public ImplicitGrant(ScopePolicy scopePolicy, EngineConfig config) {
        this.scopePolicy = scopePolicy;
        this.config = config;
    }

    public GrantOutcome validate(OAuthClient client, String resourceOwner, ScopeSet requestedScope, String nonce) {
        if (!config.isGrantEnabled(GrantType.IMPLICIT)) {
            throw OAuthException.unsupportedResponseType("response_type token is not enabled");
        }
        if (!client.isGrantTypeAllowed(GrantType.IMPLICIT)) {
            throw OAuthException.unauthorizedClient("implicit grant not allowed for this client");
        }
        if (resourceOwner == null) {
            throw OAuthException.invalidRequest("An authenticated resource owner is required");
        }

        return GrantOutcome.builder()
            .grantType(GrantType.IMPLICIT)
            .resourceOwner(resourceOwner)
            .requestedScope(requestedScope)
            .scopeCeiling(scopePolicy.ceilingFor(client))
            .defaultScope(scopePolicy.defaultFor(client))
            .issueRefreshToken(false)
            .nonce(nonce)
            .build();
    }
}
