package tech.grantwell.engine.grant;

import lombok.Builder;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.store.RefreshToken;

/**
 * Result of validating a grant: everything issuance needs, and the compare-and-set
 * preconditions that must still hold when the tokens are persisted.
 *
 * @param resourceOwner         {@code null} for client credentials
 * @param requestedScope        scope asked for, possibly empty
 * @param scopeCeiling          most the grant can authorize
 * @param defaultScope          scope used when none was requested
 * @param issueRefreshToken     whether a refresh token accompanies the access token
 * @param consumedCode          authorization code to consume, or {@code null}
 * @param presentedRefreshToken refresh token being exchanged, or {@code null}
 * @param nonce                 OIDC nonce for the id_token, or {@code null}
 */
@Builder
public record GrantOutcome(
    GrantType grantType,
    String resourceOwner,
    ScopeSet requestedScope,
    ScopeSet scopeCeiling,
    ScopeSet defaultScope,
    boolean issueRefreshToken,
    String consumedCode,
    RefreshToken presentedRefreshToken,
    String nonce
) {

    public GrantOutcome {
        requestedScope = requestedScope == null ? ScopeSet.empty() : requestedScope;
        scopeCeiling = scopeCeiling == null ? ScopeSet.empty() : scopeCeiling;
        defaultScope = defaultScope == null ? ScopeSet.empty() : defaultScope;
    }
}
