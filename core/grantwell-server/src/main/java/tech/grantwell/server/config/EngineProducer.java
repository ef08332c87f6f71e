package tech.grantwell.server.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.OAuthEngine;
import tech.grantwell.engine.TokenFormat;
import tech.grantwell.engine.client.ClientSecretHasher;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.grant.PasswordVerifier;
import tech.grantwell.engine.scope.EndpointScopeRequirements;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.store.memory.InMemoryClientRegistry;
import tech.grantwell.engine.store.memory.InMemoryTokenStore;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CDI producers wiring the engine from {@link AuthConfig}.
 *
 * <p>Deployments may contribute a {@link PasswordVerifier} bean to back the password
 * grant, and an {@link EndpointScopeRequirements} bean for bearer validation.
 */
@ApplicationScoped
public class EngineProducer {

    private static final Logger LOG = Logger.getLogger(EngineProducer.class);

    @Produces
    @Singleton
    EngineConfig engineConfig(AuthConfig authConfig) {
        return toEngineConfig(authConfig);
    }

    @Produces
    @Singleton
    ClientSecretHasher clientSecretHasher(AuthConfig authConfig) {
        AuthConfig.SecretsConfig secrets = authConfig.secrets();
        return new ClientSecretHasher(secrets.iterations(), secrets.memoryCost(), secrets.parallelism());
    }

    @Produces
    @Singleton
    InMemoryClientRegistry clientRegistry(AuthConfig authConfig) {
        InMemoryClientRegistry registry = new InMemoryClientRegistry();
        for (Map.Entry<String, AuthConfig.ClientConfig> entry : authConfig.clients().entrySet()) {
            registry.register(toClient(entry.getKey(), entry.getValue()));
        }
        LOG.infof("Registered %d OAuth client(s) from configuration", authConfig.clients().size());
        return registry;
    }

    /**
     * The single clock used for token expiry and for purging.
     */
    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    InMemoryTokenStore tokenStore() {
        return new InMemoryTokenStore();
    }

    @Produces
    @Singleton
    OAuthEngine oauthEngine(EngineConfig config,
                            InMemoryClientRegistry clientRegistry,
                            InMemoryTokenStore tokenStore,
                            ClientSecretHasher secretHasher,
                            SigningKeyLoader signingKeyLoader,
                            Clock clock,
                            Instance<PasswordVerifier> passwordVerifier,
                            Instance<EndpointScopeRequirements> endpointScopes) {
        if (config.isGrantEnabled(GrantType.PASSWORD) && !passwordVerifier.isResolvable()) {
            LOG.warn("Password grant is enabled but no PasswordVerifier bean exists; the grant stays unsupported");
        }
        return OAuthEngine.builder()
            .config(config)
            .clientRegistry(clientRegistry)
            .tokenStore(tokenStore)
            .secretHasher(secretHasher)
            .signingKeys(signingKeyLoader.signingKeys())
            .passwordVerifier(passwordVerifier.isResolvable() ? passwordVerifier.get() : null)
            .endpointScopes(endpointScopes.isResolvable() ? endpointScopes.get() : EndpointScopeRequirements.none())
            .clock(clock)
            .build();
    }

    static EngineConfig toEngineConfig(AuthConfig authConfig) {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        return EngineConfig.builder()
            .issuer(authConfig.issuer())
            .accessTokenLifetime(jwt.accessTokenExpiry())
            .refreshTokenLifetime(jwt.refreshTokenExpiry())
            .authorizationCodeLifetime(jwt.authorizationCodeExpiry())
            .idTokenLifetime(jwt.idTokenExpiry())
            .enabledGrantTypes(grantTypes(authConfig.grants().enabled(), "grantwell.auth.grants.enabled"))
            .rotateRefreshTokens(authConfig.grants().rotateRefreshTokens())
            .refreshTokenReuseDetection(authConfig.grants().refreshReuseDetection())
            .tokenFormat(tokenFormat(authConfig.token().format()))
            .jwtRevocationCheck(jwt.revocationCheck())
            .pkceRequiredForPublicClients(authConfig.pkce().requiredPublic())
            .pkceRequiredForConfidentialClients(authConfig.pkce().requiredConfidential())
            .allowPlainPkce(authConfig.pkce().allowPlain())
            .availableScopes(authConfig.scopes().available().map(ScopeSet::of).orElse(ScopeSet.empty()))
            .build();
    }

    static OAuthClient toClient(String clientId, AuthConfig.ClientConfig config) {
        OAuthClient.ClientType type = switch (config.type().toLowerCase(Locale.ROOT)) {
            case "public" -> OAuthClient.ClientType.PUBLIC;
            case "confidential" -> OAuthClient.ClientType.CONFIDENTIAL;
            default -> throw new IllegalArgumentException(
                "grantwell.auth.clients." + clientId + ".type must be public or confidential");
        };
        if (type == OAuthClient.ClientType.CONFIDENTIAL && config.secretHash().isEmpty()) {
            throw new IllegalArgumentException(
                "grantwell.auth.clients." + clientId + ".secret-hash is required for confidential clients");
        }

        return OAuthClient.builder()
            .clientId(clientId)
            .clientName(config.clientName().orElse(clientId))
            .clientType(type)
            .secretHash(config.secretHash().orElse(null))
            .grantTypes(grantTypes(config.grantTypes(), "grantwell.auth.clients." + clientId + ".grant-types"))
            .redirectUris(config.redirectUris().orElse(List.of()))
            .redirectUriMatching(config.redirectUriPatterns()
                ? OAuthClient.RedirectUriMatching.PATTERN
                : OAuthClient.RedirectUriMatching.EXACT)
            .defaultScope(ScopeSet.parse(config.defaultScope().orElse(null)))
            .allowedScope(ScopeSet.parse(config.allowedScope().orElse(null)))
            .pkceRequired(config.pkceRequired())
            .disabled(config.disabled())
            .build();
    }

    private static Set<GrantType> grantTypes(Set<String> names, String key) {
        Set<GrantType> grantTypes = EnumSet.noneOf(GrantType.class);
        for (String name : names) {
            grantTypes.add(GrantType.fromParameter(name.strip())
                .orElseThrow(() -> new IllegalArgumentException("Unknown grant type '" + name + "' in " + key)));
        }
        return grantTypes;
    }

    private static TokenFormat tokenFormat(String value) {
        try {
            return TokenFormat.valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("grantwell.auth.token.format must be opaque or jwt, was: " + value, e);
        }
    }
}
