package tech.grantwell.engine.client;

import java.util.Optional;

/**
 * Read-only access to client registrations. Implemented by the deployment's storage
 * adapter; the engine never creates or edits clients.
 */
public interface ClientRegistry {

    Optional<OAuthClient> findByClientId(String clientId);
}
