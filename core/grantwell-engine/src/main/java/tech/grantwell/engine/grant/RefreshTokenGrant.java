package tech.grantwell.engine.grant;

import org.jboss.logging.Logger;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.store.RefreshToken;
import tech.grantwell.engine.store.TokenStore;

import java.time.Clock;

/**
 * Refresh token grant.
 *
 * <p>The new access token may narrow the originally authorized scope but never widen
 * it. Rotation (or re-linking, when rotation is off) happens in the issuance
 * transaction as a compare-and-set on the presented token.
 */
public class RefreshTokenGrant {

    private static final Logger LOG = Logger.getLogger(RefreshTokenGrant.class);

    private final TokenStore tokenStore;
    private final EngineConfig config;
    private final Clock clock;

    public RefreshTokenGrant(TokenStore tokenStore, EngineConfig config, Clock clock) {
        this.tokenStore = tokenStore;
        this.config = config;
        this.clock = clock;
    }

    public GrantOutcome validate(TokenRequest request, OAuthClient client) {
        if (request.refreshToken() == null || request.refreshToken().isBlank()) {
            throw OAuthException.invalidRequest("refresh_token is required");
        }

        RefreshToken token = tokenStore.findRefreshToken(request.refreshToken()).orElse(null);
        if (token == null || !token.clientId().equals(client.clientId())) {
            throw OAuthException.invalidGrant("Invalid or expired refresh token");
        }

        if (token.revoked()) {
            if (config.refreshTokenReuseDetection() && token.family() != null) {
                // Replay of a rotated token: assume theft and cut off the whole family
                int revoked = tokenStore.revokeRefreshTokenFamily(token.family());
                LOG.warnf("Refresh token reuse detected for client %s, revoked %d token(s) in family",
                    client.clientId(), revoked);
            }
            throw OAuthException.invalidGrant("Invalid or expired refresh token");
        }
        if (token.isExpired(clock.instant())) {
            throw OAuthException.invalidGrant("Invalid or expired refresh token");
        }

        return GrantOutcome.builder()
            .grantType(GrantType.REFRESH_TOKEN)
            .resourceOwner(token.resourceOwner())
            .requestedScope(request.requestedScope())
            .scopeCeiling(token.scope())
            .defaultScope(token.scope())
            .issueRefreshToken(true)
            .presentedRefreshToken(token)
            .build();
    }
}
