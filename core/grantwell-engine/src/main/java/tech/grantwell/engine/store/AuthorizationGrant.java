package tech.grantwell.engine.store;

import lombok.Builder;
import lombok.With;
import tech.grantwell.engine.grant.PkceMethod;
import tech.grantwell.engine.scope.ScopeSet;

import java.time.Instant;

/**
 * OAuth2 authorization code, created at the authorization step and exchanged for
 * tokens at most once.
 *
 * <p>Codes are short-lived and single-use. Consumption is an atomic compare-and-set
 * performed by {@link TokenStore#consumeGrant(String)}.
 *
 * @param code                the authorization code value
 * @param clientId            client the code was issued to
 * @param resourceOwner       authenticated resource owner who approved the request
 * @param scope               scope approved at the authorization step
 * @param redirectUri         redirect URI used at the authorization step
 * @param codeChallenge       PKCE challenge, or {@code null}
 * @param codeChallengeMethod PKCE method, or {@code null} without a challenge
 * @param nonce               OIDC nonce to echo in the id_token, or {@code null}
 */
@Builder(toBuilder = true)
@With
public record AuthorizationGrant(
    String code,
    String clientId,
    String resourceOwner,
    ScopeSet scope,
    String redirectUri,
    String codeChallenge,
    PkceMethod codeChallengeMethod,
    String nonce,
    Instant issuedAt,
    Instant expiresAt,
    boolean consumed
) {

    public AuthorizationGrant {
        scope = scope == null ? ScopeSet.empty() : scope;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean hasCodeChallenge() {
        return codeChallenge != null;
    }
}
