package tech.grantwell.engine.issuance;

import tech.grantwell.engine.store.AccessToken;
import tech.grantwell.engine.store.RefreshToken;

import java.time.Duration;

/**
 * Tokens minted for one request, before they are persisted.
 *
 * @param refreshToken {@code null} when the grant issues none
 * @param idToken      {@code null} unless an OIDC id_token was requested
 */
public record IssuedTokens(AccessToken accessToken, RefreshToken refreshToken, String idToken) {

    public TokenResponse toResponse() {
        long expiresIn = Duration.between(accessToken.issuedAt(), accessToken.expiresAt()).getSeconds();
        return new TokenResponse(
            accessToken.token(),
            TokenResponse.BEARER,
            expiresIn,
            refreshToken != null ? refreshToken.token() : null,
            accessToken.scope().toParameter(),
            idToken
        );
    }
}
