package tech.grantwell.engine.issuance;

import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.grant.GrantOutcome;
import tech.grantwell.engine.store.RefreshToken;
import tech.grantwell.engine.store.TokenStore;

/**
 * Persists a minted token set in a single storage transaction.
 *
 * <p>Order inside the transaction: consume the code or rotate the presented refresh
 * token (compare-and-set), revoke the access token it was linked to, save the new
 * access token, save the new refresh token. A lost compare-and-set aborts the whole
 * transaction with {@code invalid_grant}.
 */
public class TokenWriter {

    private final TokenStore tokenStore;
    private final EngineConfig config;

    public TokenWriter(TokenStore tokenStore, EngineConfig config) {
        this.tokenStore = tokenStore;
        this.config = config;
    }

    public void persist(GrantOutcome outcome, IssuedTokens tokens) {
        tokenStore.inTransaction(() -> {
            if (outcome.consumedCode() != null && !tokenStore.consumeGrant(outcome.consumedCode())) {
                throw OAuthException.invalidGrant("Authorization code has already been used");
            }

            RefreshToken presented = outcome.presentedRefreshToken();
            if (presented != null) {
                boolean won = config.rotateRefreshTokens()
                    ? tokenStore.revokeRefreshToken(presented.token())
                    : tokenStore.relinkRefreshToken(presented.token(), presented.accessToken(), tokens.accessToken().token());
                if (!won) {
                    throw OAuthException.invalidGrant("Invalid or expired refresh token");
                }
                if (presented.accessToken() != null) {
                    tokenStore.revokeAccessToken(presented.accessToken());
                }
            }

            tokenStore.saveAccessToken(tokens.accessToken());
            if (tokens.refreshToken() != null && (presented == null || config.rotateRefreshTokens())) {
                tokenStore.saveRefreshToken(tokens.refreshToken());
            }
            return null;
        });
    }
}
