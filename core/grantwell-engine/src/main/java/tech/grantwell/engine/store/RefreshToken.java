package tech.grantwell.engine.store;

import lombok.Builder;
import lombok.With;
import tech.grantwell.engine.scope.ScopeSet;

import java.time.Instant;

/**
 * Refresh token with rotation support.
 *
 * <p>Security features:
 * <ul>
 *   <li>Token rotation: each use issues a new token in the same family</li>
 *   <li>Reuse detection: a rotated token presented again can revoke its whole family</li>
 *   <li>At most one live access token is linked to a refresh token</li>
 * </ul>
 *
 * @param scope       scope originally authorized; unchanged across rotations
 * @param accessToken the access token currently linked to this refresh token
 * @param family      shared by every rotation of one original grant
 */
@Builder(toBuilder = true)
@With
public record RefreshToken(
    String token,
    String clientId,
    String resourceOwner,
    ScopeSet scope,
    String accessToken,
    String family,
    Instant issuedAt,
    Instant expiresAt,
    boolean revoked
) {

    public RefreshToken {
        scope = scope == null ? ScopeSet.empty() : scope;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isActive(Instant now) {
        return !revoked && !isExpired(now);
    }
}
