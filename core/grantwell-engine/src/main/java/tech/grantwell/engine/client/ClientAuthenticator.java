package tech.grantwell.engine.client;

import org.jboss.logging.Logger;
import tech.grantwell.engine.error.OAuthException;

/**
 * Authenticates the client on a token, introspection or revocation request.
 *
 * <p>Every failure is reported as the same {@code invalid_client} error so that
 * callers cannot probe which client ids exist. Unknown clients still pay for one
 * hash verification to keep response times uniform.
 */
public class ClientAuthenticator {

    private static final Logger LOG = Logger.getLogger(ClientAuthenticator.class);

    private final ClientRegistry clientRegistry;
    private final ClientSecretHasher secretHasher;
    private final String dummyHash;

    public ClientAuthenticator(ClientRegistry clientRegistry, ClientSecretHasher secretHasher) {
        this.clientRegistry = clientRegistry;
        this.secretHasher = secretHasher;
        this.dummyHash = secretHasher.hash("grantwell-timing-equalizer");
    }

    /**
     * @return the authenticated client
     * @throws OAuthException {@code invalid_client} on any authentication failure
     */
    public OAuthClient authenticate(ClientCredentials credentials) {
        if (credentials == null || credentials.clientId() == null || credentials.clientId().isBlank()) {
            LOG.debug("Client authentication failed: no client_id presented");
            throw OAuthException.invalidClient();
        }

        OAuthClient client = clientRegistry.findByClientId(credentials.clientId()).orElse(null);
        if (client == null || client.disabled()) {
            if (credentials.hasSecret()) {
                secretHasher.verify(credentials.clientSecret(), dummyHash);
            }
            LOG.warnf("Client authentication failed: unknown or disabled client %s", credentials.clientId());
            throw OAuthException.invalidClient();
        }

        if (client.isPublic()) {
            if (credentials.hasSecret()) {
                LOG.warnf("Public client %s presented a secret", client.clientId());
                throw OAuthException.invalidClient();
            }
            return client;
        }

        if (!credentials.hasSecret()) {
            LOG.warnf("Confidential client %s presented no secret", client.clientId());
            throw OAuthException.invalidClient();
        }
        if (!secretHasher.verify(credentials.clientSecret(), client.secretHash())) {
            LOG.warnf("Invalid client secret for OAuth client: %s", client.clientId());
            throw OAuthException.invalidClient();
        }
        return client;
    }
}
