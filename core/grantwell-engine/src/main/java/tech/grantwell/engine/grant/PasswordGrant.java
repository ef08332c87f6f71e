package tech.grantwell.engine.grant;

import org.jboss.logging.Logger;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.scope.ScopePolicy;

/**
 * Resource owner password credentials grant.
 *
 * <p>Disabled unless the deployment enables it and supplies a {@link PasswordVerifier}.
 */
public class PasswordGrant {

    private static final Logger LOG = Logger.getLogger(PasswordGrant.class);

    private final PasswordVerifier passwordVerifier;
    private final ScopePolicy scopePolicy;
    private final EngineConfig config;

    public PasswordGrant(PasswordVerifier passwordVerifier, ScopePolicy scopePolicy, EngineConfig config) {
        this.passwordVerifier = passwordVerifier;
        this.scopePolicy = scopePolicy;
        this.config = config;
    }

    public boolean isAvailable() {
        return passwordVerifier != null;
    }

    public GrantOutcome validate(TokenRequest request, OAuthClient client) {
        if (!isAvailable()) {
            throw OAuthException.unsupportedGrantType("Grant type not supported: password");
        }
        if (request.username() == null || request.username().isEmpty()) {
            throw OAuthException.invalidRequest("username is required");
        }
        if (request.password() == null || request.password().isEmpty()) {
            throw OAuthException.invalidRequest("password is required");
        }

        String resourceOwner = passwordVerifier.verify(request.username(), request.password()).orElse(null);
        if (resourceOwner == null) {
            LOG.warnf("Password grant rejected for client %s: invalid resource owner credentials", client.clientId());
            throw OAuthException.invalidGrant("Invalid resource owner credentials");
        }

        return GrantOutcome.builder()
            .grantType(GrantType.PASSWORD)
            .resourceOwner(resourceOwner)
            .requestedScope(request.requestedScope())
            .scopeCeiling(scopePolicy.ceilingFor(client))
            .defaultScope(scopePolicy.defaultFor(client))
            .issueRefreshToken(config.isGrantEnabled(GrantType.REFRESH_TOKEN))
            .build();
    }
}
