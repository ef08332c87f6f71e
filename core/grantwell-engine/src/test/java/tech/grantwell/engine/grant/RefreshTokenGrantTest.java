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
import tech.grantwell.engine.store.RefreshToken;
import tech.grantwell.engine.store.TokenStore;
import tech.grantwell.engine.support.Fixtures;
import tech.grantwell.engine.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RefreshTokenGrantTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    TokenStore tokenStore;

    private MutableClock clock;
    private RefreshTokenGrant grant;
    private OAuthClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        grant = new RefreshTokenGrant(tokenStore, EngineConfig.defaults(), clock);
        client = Fixtures.confidentialClient("read", GrantType.AUTHORIZATION_CODE);
    }

    private RefreshToken.RefreshTokenBuilder storedToken() {
        return RefreshToken.builder()
            .token("rt-1")
            .clientId("c1")
            .resourceOwner("alice")
            .scope(ScopeSet.of("read", "write"))
            .accessToken("at-1")
            .family("fam-1")
            .issuedAt(NOW.minus(Duration.ofDays(1)))
            .expiresAt(NOW.plus(Duration.ofDays(29)));
    }

    private static TokenRequest refresh(String scope) {
        return TokenRequest.builder().grantType("refresh_token").refreshToken("rt-1").scope(scope).build();
    }

    private static OAuthErrorCode errorOf(Throwable thrown) {
        assertThat(thrown).isInstanceOf(OAuthException.class);
        return ((OAuthException) thrown).errorCode();
    }

    @Test
    @DisplayName("validate should cap the scope at the originally authorized scope")
    void validate_shouldUseOriginalScopeAsCeiling() {
        when(tokenStore.findRefreshToken("rt-1")).thenReturn(Optional.of(storedToken().build()));

        GrantOutcome outcome = grant.validate(refresh("read"), client);

        assertThat(outcome.requestedScope()).isEqualTo(ScopeSet.of("read"));
        assertThat(outcome.scopeCeiling()).isEqualTo(ScopeSet.of("read", "write"));
        assertThat(outcome.defaultScope()).isEqualTo(ScopeSet.of("read", "write"));
        assertThat(outcome.resourceOwner()).isEqualTo("alice");
        assertThat(outcome.issueRefreshToken()).isTrue();
        assertThat(outcome.presentedRefreshToken().token()).isEqualTo("rt-1");
    }

    @Test
    @DisplayName("validate should require the refresh_token parameter")
    void validate_shouldFail_whenTokenMissing() {
        TokenRequest request = TokenRequest.builder().grantType("refresh_token").build();

        assertThat(errorOf(catchThrowable(() -> grant.validate(request, client))))
            .isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("validate should reject unknown tokens and tokens of another client")
    void validate_shouldFail_whenTokenUnknownOrForeign() {
        when(tokenStore.findRefreshToken("rt-1"))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(storedToken().clientId("other").build()));

        assertThat(errorOf(catchThrowable(() -> grant.validate(refresh(null), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
        assertThat(errorOf(catchThrowable(() -> grant.validate(refresh(null), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
    }

    @Test
    @DisplayName("validate should reject expired tokens")
    void validate_shouldFail_whenTokenExpired() {
        when(tokenStore.findRefreshToken("rt-1")).thenReturn(Optional.of(storedToken().build()));
        clock.advance(Duration.ofDays(29));

        assertThat(errorOf(catchThrowable(() -> grant.validate(refresh(null), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
    }

    @Test
    @DisplayName("validate should reject revoked tokens without side effects by default")
    void validate_shouldFail_whenTokenRevoked() {
        when(tokenStore.findRefreshToken("rt-1")).thenReturn(Optional.of(storedToken().revoked(true).build()));

        assertThat(errorOf(catchThrowable(() -> grant.validate(refresh(null), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
        verify(tokenStore, never()).revokeRefreshTokenFamily(anyString());
    }

    @Test
    @DisplayName("validate should revoke the family when a rotated token is replayed and reuse detection is on")
    void validate_shouldRevokeFamily_whenReuseDetected() {
        grant = new RefreshTokenGrant(tokenStore,
            EngineConfig.defaults().toBuilder().refreshTokenReuseDetection(true).build(), clock);
        when(tokenStore.findRefreshToken("rt-1")).thenReturn(Optional.of(storedToken().revoked(true).build()));
        when(tokenStore.revokeRefreshTokenFamily("fam-1")).thenReturn(2);

        assertThat(errorOf(catchThrowable(() -> grant.validate(refresh(null), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
        verify(tokenStore).revokeRefreshTokenFamily("fam-1");
    }
}
