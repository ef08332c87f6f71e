package tech.grantwell.engine.store;

import lombok.Builder;
import lombok.With;
import tech.grantwell.engine.scope.ScopeSet;

import java.time.Instant;

/**
 * Issued access token.
 *
 * <p>Opaque tokens are looked up by {@code token}. Self-contained (JWT) tokens are
 * also recorded so that revocation can be checked by {@code tokenId}.
 *
 * @param token         the bearer value handed to the client
 * @param tokenId       unique id, the {@code jti} of JWT tokens
 * @param resourceOwner {@code null} for client-credentials tokens
 * @param refreshToken  refresh token this access token was issued with, or {@code null}
 */
@Builder(toBuilder = true)
@With
public record AccessToken(
    String token,
    String tokenId,
    String clientId,
    String resourceOwner,
    ScopeSet scope,
    Instant issuedAt,
    Instant expiresAt,
    String refreshToken,
    boolean revoked
) {

    public AccessToken {
        scope = scope == null ? ScopeSet.empty() : scope;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isActive(Instant now) {
        return !revoked && !isExpired(now);
    }
}
