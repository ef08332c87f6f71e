package tech.grantwell.engine.issuance;

import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.grant.GrantOutcome;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.store.AccessToken;
import tech.grantwell.engine.store.RefreshToken;
import tech.grantwell.engine.token.AccessTokenCodec;
import tech.grantwell.engine.token.IdTokenIssuer;
import tech.grantwell.engine.token.TokenClaims;
import tech.grantwell.engine.token.TokenGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Builds the token set for a validated grant. Minting has no side effects; nothing is
 * stored until {@link TokenWriter#persist} runs.
 */
public class TokenMinter {

    private final EngineConfig config;
    private final AccessTokenCodec codec;
    private final IdTokenIssuer idTokenIssuer;
    private final Clock clock;

    /**
     * @param idTokenIssuer {@code null} when no signing keys are configured
     */
    public TokenMinter(EngineConfig config, AccessTokenCodec codec, IdTokenIssuer idTokenIssuer, Clock clock) {
        this.config = config;
        this.codec = codec;
        this.idTokenIssuer = idTokenIssuer;
        this.clock = clock;
    }

    public IssuedTokens mint(OAuthClient client, GrantOutcome outcome, ScopeSet scope) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(config.accessTokenLifetime()).truncatedTo(ChronoUnit.SECONDS);

        String tokenId = TokenGenerator.randomId();
        String accessValue = codec.encode(new TokenClaims(
            tokenId, outcome.resourceOwner(), client.clientId(), scope, now, expiresAt));

        RefreshToken refreshToken = outcome.issueRefreshToken()
            ? refreshTokenFor(client, outcome, scope, accessValue, now)
            : null;

        AccessToken accessToken = AccessToken.builder()
            .token(accessValue)
            .tokenId(tokenId)
            .clientId(client.clientId())
            .resourceOwner(outcome.resourceOwner())
            .scope(scope)
            .issuedAt(now)
            .expiresAt(expiresAt)
            .refreshToken(refreshToken != null ? refreshToken.token() : null)
            .build();

        String idToken = null;
        if (idTokenIssuer != null && outcome.resourceOwner() != null && scope.contains(IdTokenIssuer.OPENID_SCOPE)) {
            idToken = idTokenIssuer.issue(outcome.resourceOwner(), client.clientId(), outcome.nonce(), accessValue, now);
        }

        return new IssuedTokens(accessToken, refreshToken, idToken);
    }

    private RefreshToken refreshTokenFor(OAuthClient client, GrantOutcome outcome, ScopeSet scope,
                                         String accessValue, Instant now) {
        RefreshToken presented = outcome.presentedRefreshToken();
        if (presented != null && !config.rotateRefreshTokens()) {
            return presented.withAccessToken(accessValue);
        }
        return RefreshToken.builder()
            .token(TokenGenerator.randomToken())
            .clientId(client.clientId())
            .resourceOwner(outcome.resourceOwner())
            .scope(presented != null ? presented.scope() : scope)
            .accessToken(accessValue)
            .family(presented != null ? presented.family() : TokenGenerator.randomId())
            .issuedAt(now)
            .expiresAt(now.plus(config.refreshTokenLifetime()).truncatedTo(ChronoUnit.SECONDS))
            .build();
    }
}
