package tech.grantwell.engine.token;

import tech.grantwell.engine.scope.ScopeSet;

import java.time.Instant;

/**
 * Claims carried by (or recorded for) an access token.
 *
 * @param tokenId   unique token id ({@code jti})
 * @param subject   resource owner, {@code null} for client-credentials tokens
 * @param clientId  client the token was issued to
 * @param scope     granted scope
 * @param issuedAt  issue instant, whole seconds
 * @param expiresAt absolute expiry, whole seconds
 */
public record TokenClaims(
    String tokenId,
    String subject,
    String clientId,
    ScopeSet scope,
    Instant issuedAt,
    Instant expiresAt
) {
}
