package tech.grantwell.engine;

import lombok.Builder;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.scope.ScopeSet;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable engine configuration, fixed at construction.
 *
 * <p>Start from {@link #defaults()} and adjust with {@code toBuilder()}:
 * <pre>{@code
 * EngineConfig config = EngineConfig.defaults().toBuilder()
 *     .tokenFormat(TokenFormat.JWT)
 *     .rotateRefreshTokens(false)
 *     .build();
 * }</pre>
 *
 * @param issuer                      {@code iss} of JWT access tokens and id_tokens
 * @param accessTokenLifetime         default 1 hour
 * @param refreshTokenLifetime        default 30 days
 * @param authorizationCodeLifetime   default 10 minutes
 * @param idTokenLifetime             default 1 hour
 * @param enabledGrantTypes           password and implicit are off unless listed
 * @param rotateRefreshTokens         issue a new refresh token on every refresh
 * @param refreshTokenReuseDetection  revoke the token family when a rotated refresh token is replayed
 * @param tokenFormat                 access token encoding
 * @param jwtRevocationCheck          consult storage for revoked {@code jti}s when validating JWTs
 * @param pkceRequiredForPublicClients       PKCE policy for public clients
 * @param pkceRequiredForConfidentialClients PKCE policy for confidential clients
 * @param allowPlainPkce              accept the {@code plain} challenge method
 * @param availableScopes             server-wide scope registry; empty means unrestricted
 */
@Builder(toBuilder = true)
public record EngineConfig(
    String issuer,
    Duration accessTokenLifetime,
    Duration refreshTokenLifetime,
    Duration authorizationCodeLifetime,
    Duration idTokenLifetime,
    Set<GrantType> enabledGrantTypes,
    boolean rotateRefreshTokens,
    boolean refreshTokenReuseDetection,
    TokenFormat tokenFormat,
    boolean jwtRevocationCheck,
    boolean pkceRequiredForPublicClients,
    boolean pkceRequiredForConfidentialClients,
    boolean allowPlainPkce,
    ScopeSet availableScopes
) {

    public EngineConfig {
        Objects.requireNonNull(issuer, "issuer");
        requirePositive(accessTokenLifetime, "accessTokenLifetime");
        requirePositive(refreshTokenLifetime, "refreshTokenLifetime");
        requirePositive(authorizationCodeLifetime, "authorizationCodeLifetime");
        requirePositive(idTokenLifetime, "idTokenLifetime");
        enabledGrantTypes = enabledGrantTypes == null || enabledGrantTypes.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(enabledGrantTypes));
        tokenFormat = tokenFormat == null ? TokenFormat.OPAQUE : tokenFormat;
        availableScopes = availableScopes == null ? ScopeSet.empty() : availableScopes;
    }

    public static EngineConfig defaults() {
        return EngineConfig.builder()
            .issuer("grantwell")
            .accessTokenLifetime(Duration.ofHours(1))
            .refreshTokenLifetime(Duration.ofDays(30))
            .authorizationCodeLifetime(Duration.ofMinutes(10))
            .idTokenLifetime(Duration.ofHours(1))
            .enabledGrantTypes(EnumSet.of(
                GrantType.AUTHORIZATION_CODE,
                GrantType.CLIENT_CREDENTIALS,
                GrantType.REFRESH_TOKEN))
            .rotateRefreshTokens(true)
            .refreshTokenReuseDetection(false)
            .tokenFormat(TokenFormat.OPAQUE)
            .jwtRevocationCheck(true)
            .pkceRequiredForPublicClients(true)
            .pkceRequiredForConfidentialClients(false)
            .allowPlainPkce(true)
            .availableScopes(ScopeSet.empty())
            .build();
    }

    public boolean isGrantEnabled(GrantType grantType) {
        return enabledGrantTypes.contains(grantType);
    }

    public boolean isPkceRequiredFor(OAuthClient client) {
        if (client.pkceRequired()) {
            return true;
        }
        return client.isPublic() ? pkceRequiredForPublicClients : pkceRequiredForConfidentialClients;
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
