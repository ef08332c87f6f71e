package tech.grantwell.engine.introspection;

import org.jboss.logging.Logger;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.ClientAuthenticator;
import tech.grantwell.engine.client.ClientCredentials;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.error.OAuthResult;
import tech.grantwell.engine.error.StoreException;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.store.AccessToken;
import tech.grantwell.engine.store.RefreshToken;
import tech.grantwell.engine.store.TokenStore;
import tech.grantwell.engine.token.AccessTokenCodec;
import tech.grantwell.engine.token.TokenClaims;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Token introspection (RFC 7662) and revocation (RFC 7009).
 *
 * <p>Unknown, expired and revoked tokens produce the identical
 * {@link IntrospectionResponse#inactive()} response. Revocation is idempotent and
 * never reports whether the token existed.
 */
public class TokenIntrospectionService {

    private static final Logger LOG = Logger.getLogger(TokenIntrospectionService.class);

    private final EngineConfig config;
    private final TokenStore tokenStore;
    private final AccessTokenCodec codec;
    private final ClientAuthenticator clientAuthenticator;
    private final Clock clock;

    public TokenIntrospectionService(EngineConfig config,
                                     TokenStore tokenStore,
                                     AccessTokenCodec codec,
                                     ClientAuthenticator clientAuthenticator,
                                     Clock clock) {
        this.config = config;
        this.tokenStore = tokenStore;
        this.codec = codec;
        this.clientAuthenticator = clientAuthenticator;
        this.clock = clock;
    }

    // ==================== Introspection ====================

    /**
     * Introspect on behalf of an authenticated client.
     */
    public OAuthResult<IntrospectionResponse> introspect(ClientCredentials caller, String token, String tokenTypeHint) {
        try {
            clientAuthenticator.authenticate(caller);
            return OAuthResult.success(introspect(token, TokenTypeHint.fromParameter(tokenTypeHint)));
        } catch (OAuthException e) {
            return OAuthResult.failure(e.toError());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Introspection failed for caller %s", caller);
            return OAuthResult.serverError();
        }
    }

    /**
     * @param hint which token type to try first; {@code null} tries access tokens first
     * @throws StoreException if storage is unavailable
     */
    public IntrospectionResponse introspect(String token, TokenTypeHint hint) {
        if (token == null || token.isEmpty()) {
            return IntrospectionResponse.inactive();
        }
        if (hint == TokenTypeHint.REFRESH_TOKEN) {
            return introspectRefreshToken(token).or(() -> introspectAccessToken(token))
                .orElse(IntrospectionResponse.inactive());
        }
        return introspectAccessToken(token).or(() -> introspectRefreshToken(token))
            .orElse(IntrospectionResponse.inactive());
    }

    /**
     * Active access token details, or empty. Refresh tokens are never accepted here.
     */
    public Optional<IntrospectionResponse> introspectAccessToken(String token) {
        if (codec.isSelfContained()) {
            Optional<TokenClaims> claims = codec.decode(token);
            if (claims.isEmpty() || isRevoked(claims.get().tokenId())) {
                return Optional.empty();
            }
            TokenClaims c = claims.get();
            return Optional.of(active(c.clientId(), c.scope(), c.expiresAt(), c.issuedAt(), c.subject()));
        }

        Instant now = clock.instant();
        return tokenStore.findAccessToken(token)
            .filter(accessToken -> accessToken.isActive(now))
            .map(t -> active(t.clientId(), t.scope(), t.expiresAt(), t.issuedAt(), t.resourceOwner()));
    }

    private Optional<IntrospectionResponse> introspectRefreshToken(String token) {
        Instant now = clock.instant();
        return tokenStore.findRefreshToken(token)
            .filter(refreshToken -> refreshToken.isActive(now))
            .map(t -> active(t.clientId(), t.scope(), t.expiresAt(), t.issuedAt(), t.resourceOwner()));
    }

    private boolean isRevoked(String tokenId) {
        if (!config.jwtRevocationCheck()) {
            return false;
        }
        return tokenStore.findAccessTokenById(tokenId).map(AccessToken::revoked).orElse(false);
    }

    private static IntrospectionResponse active(String clientId, ScopeSet scope, Instant expiresAt,
                                                Instant issuedAt, String subject) {
        return new IntrospectionResponse(
            true,
            clientId,
            scope.toParameter(),
            expiresAt != null ? expiresAt.getEpochSecond() : null,
            issuedAt != null ? issuedAt.getEpochSecond() : null,
            subject);
    }

    // ==================== Revocation ====================

    /**
     * Revoke on behalf of an authenticated client. Tokens issued to another client are
     * left untouched, and the call still succeeds.
     */
    public OAuthResult<Void> revoke(ClientCredentials caller, String token, String tokenTypeHint) {
        try {
            OAuthClient client = clientAuthenticator.authenticate(caller);
            if (token == null || token.isEmpty()) {
                throw OAuthException.invalidRequest("token is required");
            }
            revoke(token, TokenTypeHint.fromParameter(tokenTypeHint), client.clientId());
            return OAuthResult.success(null);
        } catch (OAuthException e) {
            return OAuthResult.failure(e.toError());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Revocation failed for caller %s", caller);
            return OAuthResult.serverError();
        }
    }

    /**
     * Revoke a token of either type. Revoking a refresh token also revokes the access
     * token linked to it. Unknown and already-revoked tokens are ignored.
     *
     * @throws StoreException if storage is unavailable
     */
    public void revoke(String token, TokenTypeHint hint) {
        revoke(token, hint, null);
    }

    private void revoke(String token, TokenTypeHint hint, String requestingClientId) {
        if (token == null || token.isEmpty()) {
            return;
        }
        tokenStore.inTransaction(() -> {
            boolean found = hint == TokenTypeHint.REFRESH_TOKEN
                ? revokeRefreshToken(token, requestingClientId) || revokeAccessToken(token, requestingClientId)
                : revokeAccessToken(token, requestingClientId) || revokeRefreshToken(token, requestingClientId);
            if (!found) {
                LOG.debug("Revocation requested for an unknown token");
            }
            return null;
        });
    }

    private boolean revokeRefreshToken(String token, String requestingClientId) {
        RefreshToken refreshToken = tokenStore.findRefreshToken(token).orElse(null);
        if (refreshToken == null) {
            return false;
        }
        if (requestingClientId != null && !requestingClientId.equals(refreshToken.clientId())) {
            LOG.warnf("Client %s attempted to revoke a refresh token it does not own", requestingClientId);
            return true;
        }
        if (tokenStore.revokeRefreshToken(token)) {
            LOG.infof("Refresh token revoked for client %s", refreshToken.clientId());
        }
        if (refreshToken.accessToken() != null) {
            tokenStore.revokeAccessToken(refreshToken.accessToken());
        }
        return true;
    }

    private boolean revokeAccessToken(String token, String requestingClientId) {
        AccessToken accessToken = tokenStore.findAccessToken(token).orElse(null);
        if (accessToken == null) {
            return false;
        }
        if (requestingClientId != null && !requestingClientId.equals(accessToken.clientId())) {
            LOG.warnf("Client %s attempted to revoke an access token it does not own", requestingClientId);
            return true;
        }
        if (tokenStore.revokeAccessToken(token)) {
            LOG.infof("Access token revoked for client %s", accessToken.clientId());
        }
        return true;
    }
}
