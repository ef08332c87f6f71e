package tech.grantwell.engine;

import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.grantwell.engine.authorize.AuthorizationRequest;
import tech.grantwell.engine.client.ClientCredentials;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.grant.TokenRequest;
import tech.grantwell.engine.introspection.IntrospectionResponse;
import tech.grantwell.engine.issuance.TokenResponse;
import tech.grantwell.engine.scope.EndpointScopeRequirements;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.store.memory.InMemoryClientRegistry;
import tech.grantwell.engine.store.memory.InMemoryTokenStore;
import tech.grantwell.engine.support.Fixtures;
import tech.grantwell.engine.support.MutableClock;
import tech.grantwell.engine.support.Results;
import tech.grantwell.engine.token.SigningKeys;
import tech.grantwell.engine.token.TokenGenerator;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

class OAuthEngineTest {

    private static final SigningKeys KEYS = SigningKeys.generate();
    private static final String ISSUER = "https://auth.example.com";
    private static final ClientCredentials C1 = ClientCredentials.basic("c1", "s1");

    private MutableClock clock;
    private InMemoryClientRegistry clientRegistry;
    private InMemoryTokenStore tokenStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now().truncatedTo(ChronoUnit.SECONDS));
        clientRegistry = new InMemoryClientRegistry();
        tokenStore = new InMemoryTokenStore();
        clientRegistry.register(Fixtures.confidentialClient("read", GrantType.AUTHORIZATION_CODE, GrantType.CLIENT_CREDENTIALS)
            .withAllowedScope(ScopeSet.of("openid", "read", "write")));
    }

    private OAuthEngine jwtEngine(boolean revocationCheck) {
        return OAuthEngine.builder()
            .config(EngineConfig.defaults().toBuilder()
                .issuer(ISSUER)
                .tokenFormat(TokenFormat.JWT)
                .jwtRevocationCheck(revocationCheck)
                .build())
            .clientRegistry(clientRegistry)
            .tokenStore(tokenStore)
            .secretHasher(Fixtures.HASHER)
            .signingKeys(KEYS)
            .endpointScopes(EndpointScopeRequirements.builder().require("GET /reports", "read").build())
            .clock(clock)
            .build();
    }

    private TokenResponse codeFlow(OAuthEngine engine, String scope, String nonce) {
        String location = Results.value(engine.authorize(AuthorizationRequest.builder()
            .responseType("code")
            .clientId("c1")
            .redirectUri(Fixtures.REDIRECT_URI)
            .scope(scope)
            .nonce(nonce)
            .build(), "alice")).location();
        Matcher matcher = Pattern.compile("[?&]code=([^&]+)").matcher(location);
        assertThat(matcher.find()).isTrue();

        return Results.value(engine.token(TokenRequest.builder()
            .grantType("authorization_code")
            .credentials(C1)
            .code(matcher.group(1))
            .redirectUri(Fixtures.REDIRECT_URI)
            .build()));
    }

    @Test
    @DisplayName("JWT access tokens should introspect without a storage round trip for the claims")
    void jwtAccessToken_shouldIntrospectFromClaims() {
        OAuthEngine engine = jwtEngine(true);

        TokenResponse response = codeFlow(engine, "read write", null);
        IntrospectionResponse introspection = engine.introspectionService().introspect(response.accessToken(), null);

        assertThat(response.accessToken().split("\\.")).hasSize(3);
        assertThat(introspection.active()).isTrue();
        assertThat(introspection.clientId()).isEqualTo("c1");
        assertThat(introspection.sub()).isEqualTo("alice");
        assertThat(introspection.scope()).isEqualTo("read write");
        assertThat(introspection.exp()).isEqualTo(clock.instant().plus(Duration.ofHours(1)).getEpochSecond());
    }

    @Test
    @DisplayName("openid scope should add an id_token carrying the nonce and at_hash")
    void openidScope_shouldIssueIdToken() throws Exception {
        OAuthEngine engine = jwtEngine(true);

        TokenResponse response = codeFlow(engine, "openid read", "n-0S6_WzA2Mj");

        assertThat(response.idToken()).isNotNull();
        JwtClaims claims = new JwtConsumerBuilder()
            .setExpectedIssuer(ISSUER)
            .setExpectedAudience("c1")
            .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
            .setVerificationKey(KEYS.publicKey())
            .build()
            .processToClaims(response.idToken());
        assertThat(claims.getSubject()).isEqualTo("alice");
        assertThat(claims.getStringClaimValue("nonce")).isEqualTo("n-0S6_WzA2Mj");
        assertThat(claims.getStringClaimValue("at_hash")).isEqualTo(TokenGenerator.leftHalfHash(response.accessToken()));
    }

    @Test
    @DisplayName("client_credentials should never produce an id_token")
    void clientCredentials_shouldNotIssueIdToken() {
        OAuthEngine engine = jwtEngine(true);

        TokenResponse response = Results.value(engine.token(TokenRequest.builder()
            .grantType("client_credentials")
            .credentials(C1)
            .build()));

        assertThat(response.idToken()).isNull();
    }

    @Test
    @DisplayName("revoking a JWT should deactivate it when the revocation check is on")
    void revokedJwt_shouldBeInactive_whenRevocationCheckEnabled() {
        OAuthEngine engine = jwtEngine(true);
        TokenResponse response = codeFlow(engine, "read", null);

        assertThat(engine.revoke(C1, response.accessToken(), "access_token").isSuccess()).isTrue();

        assertThat(engine.introspectionService().introspect(response.accessToken(), null).active()).isFalse();
    }

    @Test
    @DisplayName("revoked JWTs should stay valid until expiry when the revocation check is off")
    void revokedJwt_shouldStayActive_whenRevocationCheckDisabled() {
        OAuthEngine engine = jwtEngine(false);
        TokenResponse response = codeFlow(engine, "read", null);

        engine.revoke(C1, response.accessToken(), "access_token");

        assertThat(engine.introspectionService().introspect(response.accessToken(), null).active()).isTrue();
        clock.advance(Duration.ofHours(1).plusSeconds(1));
        assertThat(engine.introspectionService().introspect(response.accessToken(), null).active()).isFalse();
    }

    @Test
    @DisplayName("validateBearer should apply the endpoint scope requirements")
    void validateBearer_shouldApplyEndpointScopes() {
        OAuthEngine engine = jwtEngine(true);
        TokenResponse response = codeFlow(engine, "read", null);

        assertThat(engine.validateBearer(response.accessToken(), "GET /reports")).isPresent();
        assertThat(engine.validateBearer(response.accessToken(), "DELETE /reports")).isEmpty();
        assertThat(engine.validateBearer(response.refreshToken(), "GET /reports")).isEmpty();
    }

    @Test
    @DisplayName("build should refuse the JWT format without signing keys")
    void build_shouldThrow_whenJwtWithoutKeys() {
        assertThatThrownBy(() -> OAuthEngine.builder()
            .config(EngineConfig.defaults().toBuilder().tokenFormat(TokenFormat.JWT).build())
            .clientRegistry(clientRegistry)
            .tokenStore(tokenStore)
            .secretHasher(Fixtures.HASHER)
            .build())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("EngineConfig should reject non-positive lifetimes")
    void engineConfig_shouldRejectNonPositiveLifetime() {
        assertThatThrownBy(() -> EngineConfig.defaults().toBuilder().accessTokenLifetime(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("accessTokenLifetime");
    }
}
