package tech.grantwell.engine;

import org.jboss.logging.Logger;
import tech.grantwell.engine.authorize.AuthorizationRedirect;
import tech.grantwell.engine.authorize.AuthorizationRequest;
import tech.grantwell.engine.authorize.AuthorizationService;
import tech.grantwell.engine.client.ClientAuthenticator;
import tech.grantwell.engine.client.ClientCredentials;
import tech.grantwell.engine.client.ClientRegistry;
import tech.grantwell.engine.client.ClientSecretHasher;
import tech.grantwell.engine.error.OAuthResult;
import tech.grantwell.engine.grant.AuthorizationCodeGrant;
import tech.grantwell.engine.grant.ClientCredentialsGrant;
import tech.grantwell.engine.grant.ImplicitGrant;
import tech.grantwell.engine.grant.PasswordGrant;
import tech.grantwell.engine.grant.PasswordVerifier;
import tech.grantwell.engine.grant.PkceVerifier;
import tech.grantwell.engine.grant.RefreshTokenGrant;
import tech.grantwell.engine.grant.TokenRequest;
import tech.grantwell.engine.introspection.BearerTokenValidator;
import tech.grantwell.engine.introspection.IntrospectionResponse;
import tech.grantwell.engine.introspection.TokenIntrospectionService;
import tech.grantwell.engine.issuance.TokenIssuer;
import tech.grantwell.engine.issuance.TokenMinter;
import tech.grantwell.engine.issuance.TokenResponse;
import tech.grantwell.engine.issuance.TokenWriter;
import tech.grantwell.engine.scope.EndpointScopeRequirements;
import tech.grantwell.engine.scope.ScopePolicy;
import tech.grantwell.engine.store.TokenStore;
import tech.grantwell.engine.token.AccessTokenCodec;
import tech.grantwell.engine.token.IdTokenIssuer;
import tech.grantwell.engine.token.JwtTokenCodec;
import tech.grantwell.engine.token.OpaqueTokenCodec;
import tech.grantwell.engine.token.SigningKeys;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point to the authorization-server engine.
 *
 * <p>Wires every component from one immutable {@link EngineConfig} and the
 * deployment's collaborators:
 * <pre>{@code
 * OAuthEngine engine = OAuthEngine.builder()
 *     .config(EngineConfig.defaults())
 *     .clientRegistry(registry)
 *     .tokenStore(store)
 *     .build();
 *
 * OAuthResult<TokenResponse> result = engine.token(request);
 * }</pre>
 *
 * <p>The engine holds no mutable state and is safe to share between threads.
 */
public class OAuthEngine {

    private static final Logger LOG = Logger.getLogger(OAuthEngine.class);

    private final EngineConfig config;
    private final SigningKeys signingKeys;
    private final TokenIssuer tokenIssuer;
    private final AuthorizationService authorizationService;
    private final TokenIntrospectionService introspectionService;
    private final BearerTokenValidator bearerTokenValidator;

    private OAuthEngine(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        ClientRegistry clientRegistry = Objects.requireNonNull(builder.clientRegistry, "clientRegistry");
        TokenStore tokenStore = Objects.requireNonNull(builder.tokenStore, "tokenStore");
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        ClientSecretHasher secretHasher = builder.secretHasher != null ? builder.secretHasher : new ClientSecretHasher();
        this.signingKeys = builder.signingKeys;

        AccessTokenCodec codec = switch (config.tokenFormat()) {
            case OPAQUE -> new OpaqueTokenCodec();
            case JWT -> {
                if (signingKeys == null) {
                    throw new IllegalStateException("JWT token format requires signing keys");
                }
                yield new JwtTokenCodec(config.issuer(), signingKeys, clock);
            }
        };
        IdTokenIssuer idTokenIssuer = signingKeys != null
            ? new IdTokenIssuer(config.issuer(), signingKeys, config.idTokenLifetime())
            : null;

        ScopePolicy scopePolicy = new ScopePolicy(config.availableScopes());
        ClientAuthenticator clientAuthenticator = new ClientAuthenticator(clientRegistry, secretHasher);
        PkceVerifier pkceVerifier = new PkceVerifier();
        TokenMinter tokenMinter = new TokenMinter(config, codec, idTokenIssuer, clock);
        TokenWriter tokenWriter = new TokenWriter(tokenStore, config);

        this.tokenIssuer = new TokenIssuer(
            config,
            clientAuthenticator,
            scopePolicy,
            new AuthorizationCodeGrant(tokenStore, pkceVerifier, config, clock),
            new ClientCredentialsGrant(),
            new RefreshTokenGrant(tokenStore, config, clock),
            new PasswordGrant(builder.passwordVerifier, scopePolicy, config),
            tokenMinter,
            tokenWriter);
        this.authorizationService = new AuthorizationService(
            config,
            clientRegistry,
            tokenStore,
            scopePolicy,
            pkceVerifier,
            new ImplicitGrant(scopePolicy, config),
            tokenMinter,
            tokenWriter,
            clock);
        this.introspectionService = new TokenIntrospectionService(config, tokenStore, codec, clientAuthenticator, clock);
        this.bearerTokenValidator = new BearerTokenValidator(introspectionService,
            builder.endpointScopes != null ? builder.endpointScopes : EndpointScopeRequirements.none());

        LOG.infof("OAuth engine initialized: format=%s, grants=%s, rotation=%s",
            config.tokenFormat(), config.enabledGrantTypes(), config.rotateRefreshTokens());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Token endpoint.
     */
    public OAuthResult<TokenResponse> token(TokenRequest request) {
        return tokenIssuer.issue(request);
    }

    /**
     * Authorization endpoint, after the resource owner has logged in and approved.
     */
    public OAuthResult<AuthorizationRedirect> authorize(AuthorizationRequest request, String resourceOwner) {
        return authorizationService.authorize(request, resourceOwner);
    }

    /**
     * Introspection endpoint: authenticates the caller, then introspects.
     */
    public OAuthResult<IntrospectionResponse> introspect(ClientCredentials caller, String token, String tokenTypeHint) {
        return introspectionService.introspect(caller, token, tokenTypeHint);
    }

    /**
     * Revocation endpoint: authenticates the caller, then revokes.
     */
    public OAuthResult<Void> revoke(ClientCredentials caller, String token, String tokenTypeHint) {
        return introspectionService.revoke(caller, token, tokenTypeHint);
    }

    public Optional<IntrospectionResponse> validateBearer(String token, String endpoint) {
        return bearerTokenValidator.validate(token, endpoint);
    }

    public TokenIntrospectionService introspectionService() {
        return introspectionService;
    }

    public BearerTokenValidator bearerTokenValidator() {
        return bearerTokenValidator;
    }

    public EngineConfig config() {
        return config;
    }

    public Optional<SigningKeys> signingKeys() {
        return Optional.ofNullable(signingKeys);
    }

    public static final class Builder {
        private EngineConfig config;
        private ClientRegistry clientRegistry;
        private TokenStore tokenStore;
        private ClientSecretHasher secretHasher;
        private PasswordVerifier passwordVerifier;
        private SigningKeys signingKeys;
        private EndpointScopeRequirements endpointScopes;
        private Clock clock;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder clientRegistry(ClientRegistry clientRegistry) {
            this.clientRegistry = clientRegistry;
            return this;
        }

        public Builder tokenStore(TokenStore tokenStore) {
            this.tokenStore = tokenStore;
            return this;
        }

        /** Defaults to Argon2id with production cost. */
        public Builder secretHasher(ClientSecretHasher secretHasher) {
            this.secretHasher = secretHasher;
            return this;
        }

        /** Required for the password grant; without it the grant is unsupported. */
        public Builder passwordVerifier(PasswordVerifier passwordVerifier) {
            this.passwordVerifier = passwordVerifier;
            return this;
        }

        /** Required for the JWT token format; also enables OIDC id_tokens. */
        public Builder signingKeys(SigningKeys signingKeys) {
            this.signingKeys = signingKeys;
            return this;
        }

        public Builder endpointScopes(EndpointScopeRequirements endpointScopes) {
            this.endpointScopes = endpointScopes;
            return this;
        }

        /** Defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public OAuthEngine build() {
            return new OAuthEngine(this);
        }
    }
}
