package tech.grantwell.engine.grant;

import org.jboss.logging.Logger;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;

/**
 * Client credentials grant: the client acts on its own behalf.
 * Only confidential clients qualify; no refresh token is ever issued.
 */
public class ClientCredentialsGrant {

    private static final Logger LOG = Logger.getLogger(ClientCredentialsGrant.class);

    public GrantOutcome validate(TokenRequest request, OAuthClient client) {
        if (!client.isConfidential()) {
            LOG.warnf("client_credentials grant requested by public client %s", client.clientId());
            throw OAuthException.unauthorizedClient("Public clients may not use the client_credentials grant");
        }

        return GrantOutcome.builder()
            .grantType(GrantType.CLIENT_CREDENTIALS)
            .requestedScope(request.requestedScope())
            .scopeCeiling(client.defaultScope())
            .defaultScope(client.defaultScope())
            .issueRefreshToken(false)
            .build();
    }
}
