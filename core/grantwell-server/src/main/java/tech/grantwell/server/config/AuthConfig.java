package tech.grantwell.server.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration for the Grantwell authorization server.
 *
 * Example configuration:
 * <pre>
 * grantwell.auth.issuer=https://auth.example.com
 * grantwell.auth.token.format=jwt
 * grantwell.auth.jwt.private-key-path=/keys/private.pem
 * grantwell.auth.jwt.public-key-path=/keys/public.pem
 * grantwell.auth.grants.enabled=authorization_code,client_credentials,refresh_token
 *
 * grantwell.auth.clients.billing.type=confidential
 * grantwell.auth.clients.billing.secret-hash=$argon2id$v=19$m=65536,t=3,p=4$...
 * grantwell.auth.clients.billing.grant-types=client_credentials
 * grantwell.auth.clients.billing.default-scope=invoices:read
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "grantwell.auth")
public interface AuthConfig {

    /**
     * Token issuer (iss claim).
     * Should match the public URL of this auth service.
     */
    @WithDefault("grantwell")
    String issuer();

    JwtConfig jwt();

    TokenConfig token();

    GrantsConfig grants();

    PkceConfig pkce();

    ScopesConfig scopes();

    SecretsConfig secrets();

    /**
     * Clients registered at startup, keyed by client_id.
     */
    Map<String, ClientConfig> clients();

    /**
     * Public URL of the authorization endpoint, hosted by the deployment's login front end.
     * When absent, discovery metadata omits the endpoint and its response types.
     */
    @WithName("authorization-endpoint")
    Optional<String> authorizationEndpoint();

    /**
     * How often expired codes and tokens are dropped from the in-memory store.
     * Binds {@code grantwell.auth.purge-interval}, which {@link TokenPurgeScheduler} reads
     * through its {@code @Scheduled} expression and logs when it starts.
     */
    @WithName("purge-interval")
    @WithDefault("15m")
    String purgeInterval();

    /**
     * JWT signing and token lifetimes.
     */
    interface JwtConfig {
        /**
         * Path to the RSA private key for signing tokens (PEM format).
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key for validating tokens (PEM format).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Where generated development keys are kept when no key paths are configured.
         */
        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();

        /**
         * Access token expiry duration.
         * Default: 1 hour
         */
        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        /**
         * Refresh token expiry duration.
         * Default: 30 days
         */
        @WithName("refresh-token-expiry")
        @WithDefault("P30D")
        Duration refreshTokenExpiry();

        /**
         * Authorization code expiry duration.
         * Default: 10 minutes
         */
        @WithName("authorization-code-expiry")
        @WithDefault("PT10M")
        Duration authorizationCodeExpiry();

        @WithName("id-token-expiry")
        @WithDefault("PT1H")
        Duration idTokenExpiry();

        /**
         * Look up revoked token ids when validating JWT access tokens.
         * When false, a revoked JWT stays valid until it expires.
         */
        @WithName("revocation-check")
        @WithDefault("true")
        boolean revocationCheck();
    }

    interface TokenConfig {
        /**
         * Access token format: opaque or jwt.
         */
        @WithDefault("opaque")
        String format();
    }

    interface GrantsConfig {
        /**
         * Enabled grant types. password and implicit must be listed explicitly.
         */
        @WithDefault("authorization_code,client_credentials,refresh_token")
        Set<String> enabled();

        @WithName("rotate-refresh-tokens")
        @WithDefault("true")
        boolean rotateRefreshTokens();

        /**
         * Revoke every token descended from a grant when a rotated refresh token is replayed.
         */
        @WithName("refresh-reuse-detection")
        @WithDefault("false")
        boolean refreshReuseDetection();
    }

    /**
     * PKCE (Proof Key for Code Exchange) configuration.
     */
    interface PkceConfig {
        /**
         * Whether PKCE is required for public clients (SPAs, mobile apps).
         */
        @WithName("required-public")
        @WithDefault("true")
        boolean requiredPublic();

        @WithName("required-confidential")
        @WithDefault("false")
        boolean requiredConfidential();

        @WithName("allow-plain")
        @WithDefault("true")
        boolean allowPlain();
    }

    interface ScopesConfig {
        /**
         * Server-wide scope registry. Unrestricted when absent.
         */
        Optional<Set<String>> available();
    }

    /**
     * Argon2id cost for client secrets.
     */
    interface SecretsConfig {
        @WithDefault("3")
        int iterations();

        /**
         * Memory cost in KiB.
         */
        @WithName("memory-cost")
        @WithDefault("65536")
        int memoryCost();

        @WithDefault("4")
        int parallelism();
    }

    interface ClientConfig {
        @WithName("name")
        Optional<String> clientName();

        /**
         * public or confidential.
         */
        @WithDefault("confidential")
        String type();

        /**
         * Argon2id PHC string of the client secret. Required for confidential clients.
         */
        @WithName("secret-hash")
        Optional<String> secretHash();

        @WithName("grant-types")
        Set<String> grantTypes();

        @WithName("redirect-uris")
        Optional<List<String>> redirectUris();

        /**
         * Allow {@code *} wildcards in the registered redirect URIs.
         */
        @WithName("redirect-uri-patterns")
        @WithDefault("false")
        boolean redirectUriPatterns();

        @WithName("default-scope")
        Optional<String> defaultScope();

        @WithName("allowed-scope")
        Optional<String> allowedScope();

        @WithName("pkce-required")
        @WithDefault("false")
        boolean pkceRequired();

        @WithDefault("false")
        boolean disabled();
    }
}
