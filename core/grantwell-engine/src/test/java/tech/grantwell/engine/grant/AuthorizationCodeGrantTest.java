package tech.grantwell.engine.grant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthErrorCode;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.store.AuthorizationGrant;
import tech.grantwell.engine.store.TokenStore;
import tech.grantwell.engine.support.Fixtures;
import tech.grantwell.engine.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorizationCodeGrantTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    TokenStore tokenStore;

    private MutableClock clock;
    private AuthorizationCodeGrant grant;
    private OAuthClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        grant = new AuthorizationCodeGrant(tokenStore, new PkceVerifier(), EngineConfig.defaults(), clock);
        client = Fixtures.confidentialClient("read", GrantType.AUTHORIZATION_CODE);
    }

    private AuthorizationGrant.AuthorizationGrantBuilder storedGrant() {
        return AuthorizationGrant.builder()
            .code("code-1")
            .clientId("c1")
            .resourceOwner("alice")
            .scope(ScopeSet.of("openid", "read"))
            .redirectUri(Fixtures.REDIRECT_URI)
            .nonce("n-1")
            .issuedAt(NOW)
            .expiresAt(NOW.plus(Duration.ofMinutes(10)));
    }

    private TokenRequest.TokenRequestBuilder request() {
        return TokenRequest.builder()
            .grantType("authorization_code")
            .code("code-1")
            .redirectUri(Fixtures.REDIRECT_URI);
    }

    private static OAuthErrorCode errorOf(Throwable thrown) {
        assertThat(thrown).isInstanceOf(OAuthException.class);
        return ((OAuthException) thrown).errorCode();
    }

    // ========================================
    // SUCCESS TESTS
    // ========================================

    @Test
    @DisplayName("validate should carry the approved scope, owner and nonce")
    void validate_shouldBuildOutcome_whenCodeValid() {
        // Arrange
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().build()));

        // Act
        GrantOutcome outcome = grant.validate(request().build(), client);

        // Assert
        assertThat(outcome.grantType()).isEqualTo(GrantType.AUTHORIZATION_CODE);
        assertThat(outcome.resourceOwner()).isEqualTo("alice");
        assertThat(outcome.scopeCeiling()).isEqualTo(ScopeSet.of("openid", "read"));
        assertThat(outcome.requestedScope()).isEqualTo(ScopeSet.of("openid", "read"));
        assertThat(outcome.consumedCode()).isEqualTo("code-1");
        assertThat(outcome.nonce()).isEqualTo("n-1");
        assertThat(outcome.issueRefreshToken()).isTrue();
    }

    @Test
    @DisplayName("validate should not consume the code itself")
    void validate_shouldNotConsumeCode() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().build()));

        grant.validate(request().build(), client);

        verify(tokenStore, never()).consumeGrant(anyString());
    }

    @Test
    @DisplayName("validate should skip the refresh token when the refresh grant is disabled")
    void validate_shouldNotIssueRefresh_whenRefreshGrantDisabled() {
        EngineConfig config = EngineConfig.defaults().toBuilder()
            .enabledGrantTypes(EnumSet.of(GrantType.AUTHORIZATION_CODE))
            .build();
        grant = new AuthorizationCodeGrant(tokenStore, new PkceVerifier(), config, clock);
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().build()));

        assertThat(grant.validate(request().build(), client).issueRefreshToken()).isFalse();
    }

    @Test
    @DisplayName("validate should accept a matching S256 verifier")
    void validate_shouldAccept_whenPkceVerifierMatches() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant()
            .codeChallenge(Fixtures.CODE_CHALLENGE)
            .codeChallengeMethod(PkceMethod.S256)
            .build()));

        GrantOutcome outcome = grant.validate(request().codeVerifier(Fixtures.CODE_VERIFIER).build(), client);

        assertThat(outcome.resourceOwner()).isEqualTo("alice");
    }

    // ========================================
    // INVALID GRANT TESTS
    // ========================================

    @Test
    @DisplayName("validate should reject unknown codes")
    void validate_shouldFail_whenCodeUnknown() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.empty());

        assertThat(errorOf(catchThrowable(() -> grant.validate(request().build(), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
    }

    @Test
    @DisplayName("validate should reject consumed codes")
    void validate_shouldFail_whenCodeConsumed() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().consumed(true).build()));

        assertThat(errorOf(catchThrowable(() -> grant.validate(request().build(), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
    }

    @Test
    @DisplayName("validate should reject a code at exactly its expiry instant")
    void validate_shouldFail_whenCodeExpired() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().build()));
        clock.advance(Duration.ofMinutes(10));

        assertThat(errorOf(catchThrowable(() -> grant.validate(request().build(), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
    }

    @Test
    @DisplayName("validate should reject codes issued to another client")
    void validate_shouldFail_whenCodeBelongsToAnotherClient() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().clientId("other").build()));

        assertThat(errorOf(catchThrowable(() -> grant.validate(request().build(), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
    }

    // ========================================
    // INVALID REQUEST TESTS
    // ========================================

    @Test
    @DisplayName("validate should require code and redirect_uri")
    void validate_shouldFail_whenParametersMissing() {
        assertThat(errorOf(catchThrowable(() -> grant.validate(request().code(null).build(), client))))
            .isEqualTo(OAuthErrorCode.INVALID_REQUEST);
        assertThat(errorOf(catchThrowable(() -> grant.validate(request().redirectUri(null).build(), client))))
            .isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("validate should reject a redirect_uri different from the authorization request")
    void validate_shouldFail_whenRedirectUriMismatch() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().build()));

        Throwable thrown = catchThrowable(() ->
            grant.validate(request().redirectUri("https://app.example.com/other").build(), client));

        assertThat(errorOf(thrown)).isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("validate should reject a wrong PKCE verifier")
    void validate_shouldFail_whenPkceVerifierWrong() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant()
            .codeChallenge(Fixtures.CODE_CHALLENGE)
            .codeChallengeMethod(PkceMethod.S256)
            .build()));

        Throwable thrown = catchThrowable(() ->
            grant.validate(request().codeVerifier("x".repeat(43)).build(), client));

        assertThat(errorOf(thrown)).isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("validate should require the verifier when a challenge was registered")
    void validate_shouldFail_whenPkceVerifierMissing() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant()
            .codeChallenge(Fixtures.CODE_CHALLENGE)
            .codeChallengeMethod(PkceMethod.S256)
            .build()));

        assertThat(errorOf(catchThrowable(() -> grant.validate(request().build(), client))))
            .isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("validate should reject a verifier when no challenge was registered")
    void validate_shouldFail_whenVerifierWithoutChallenge() {
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().build()));

        Throwable thrown = catchThrowable(() ->
            grant.validate(request().codeVerifier(Fixtures.CODE_VERIFIER).build(), client));

        assertThat(errorOf(thrown)).isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("validate should require PKCE from public clients")
    void validate_shouldFail_whenPublicClientSkippedPkce() {
        OAuthClient spa = Fixtures.publicClient("read", GrantType.AUTHORIZATION_CODE);
        when(tokenStore.findGrant("code-1")).thenReturn(Optional.of(storedGrant().clientId("spa").build()));

        assertThat(errorOf(catchThrowable(() -> grant.validate(request().build(), spa))))
            .isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }
}
