package tech.grantwell.engine.store.memory;

import tech.grantwell.engine.client.ClientRegistry;
import tech.grantwell.engine.client.OAuthClient;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory client registry.
 *
 * <p>Single-node only. Good for development, tests and deployments that register
 * clients at startup.
 */
public class InMemoryClientRegistry implements ClientRegistry {

    private final ConcurrentMap<String, OAuthClient> clients = new ConcurrentHashMap<>();

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId));
    }

    public void register(OAuthClient client) {
        clients.put(client.clientId(), client);
    }

    public void remove(String clientId) {
        clients.remove(clientId);
    }
}
