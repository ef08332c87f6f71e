package tech.grantwell.engine.grant;

import org.jboss.logging.Logger;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.store.AuthorizationGrant;
import tech.grantwell.engine.store.TokenStore;

import java.time.Clock;
import java.util.Objects;

/**
 * Authorization code exchange, with PKCE.
 *
 * <p>Validation is read-only. The code is consumed later, inside the issuance
 * transaction, so two concurrent exchanges of one code yield at most one token.
 */
public class AuthorizationCodeGrant {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeGrant.class);

    private final TokenStore tokenStore;
    private final PkceVerifier pkceVerifier;
    private final EngineConfig config;
    private final Clock clock;

    public AuthorizationCodeGrant(TokenStore tokenStore, PkceVerifier pkceVerifier, EngineConfig config, Clock clock) {
        this.tokenStore = tokenStore;
        this.pkceVerifier = pkceVerifier;
        this.config = config;
        this.clock = clock;
    }

    public GrantOutcome validate(TokenRequest request, OAuthClient client) {
        if (isBlank(request.code())) {
            throw OAuthException.invalidRequest("code is required");
        }
        if (isBlank(request.redirectUri())) {
            throw OAuthException.invalidRequest("redirect_uri is required");
        }

        AuthorizationGrant grant = tokenStore.findGrant(request.code()).orElse(null);
        if (grant == null) {
            LOG.warnf("Token request with invalid authorization code from client %s", client.clientId());
            throw OAuthException.invalidGrant("Invalid or expired authorization code");
        }
        if (grant.consumed()) {
            LOG.warnf("Authorization code replayed by client %s", client.clientId());
            throw OAuthException.invalidGrant("Authorization code has already been used");
        }
        if (grant.isExpired(clock.instant())) {
            throw OAuthException.invalidGrant("Invalid or expired authorization code");
        }
        if (!grant.clientId().equals(client.clientId())) {
            LOG.warnf("Client %s presented a code issued to another client", client.clientId());
            throw OAuthException.invalidGrant("Invalid or expired authorization code");
        }
        if (!Objects.equals(grant.redirectUri(), request.redirectUri())) {
            throw OAuthException.invalidRequest("redirect_uri does not match the authorization request");
        }

        verifyPkce(request, grant, client);

        return GrantOutcome.builder()
            .grantType(GrantType.AUTHORIZATION_CODE)
            .resourceOwner(grant.resourceOwner())
            .requestedScope(grant.scope())
            .scopeCeiling(grant.scope())
            .defaultScope(grant.scope())
            .issueRefreshToken(config.isGrantEnabled(GrantType.REFRESH_TOKEN))
            .consumedCode(grant.code())
            .nonce(grant.nonce())
            .build();
    }

    private void verifyPkce(TokenRequest request, AuthorizationGrant grant, OAuthClient client) {
        String verifier = request.codeVerifier();

        if (!grant.hasCodeChallenge()) {
            if (verifier != null) {
                throw OAuthException.invalidRequest("code_verifier supplied but no code_challenge was registered");
            }
            if (config.isPkceRequiredFor(client)) {
                throw OAuthException.invalidRequest("PKCE is required for this client");
            }
            return;
        }

        if (isBlank(verifier)) {
            throw OAuthException.invalidRequest("code_verifier required");
        }
        if (!pkceVerifier.isValidCodeVerifier(verifier)
                || !pkceVerifier.verify(verifier, grant.codeChallenge(), grant.codeChallengeMethod())) {
            LOG.warnf("PKCE verification failed for client %s", client.clientId());
            throw OAuthException.invalidRequest("Invalid code_verifier");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
