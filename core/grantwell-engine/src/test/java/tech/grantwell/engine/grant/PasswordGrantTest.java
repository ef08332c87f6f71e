package tech.grantwell.engine.grant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthErrorCode;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.scope.ScopePolicy;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.support.Fixtures;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class PasswordGrantTest {

    private final PasswordVerifier verifier = (username, password) ->
        "alice".equals(username) && "wonderland".equals(password) ? Optional.of("user-42") : Optional.empty();

    private final OAuthClient client = Fixtures.confidentialClient("read", GrantType.PASSWORD)
        .withAllowedScope(ScopeSet.of("read", "write"));

    private PasswordGrant grant(PasswordVerifier passwordVerifier) {
        return new PasswordGrant(passwordVerifier, new ScopePolicy(ScopeSet.empty()), EngineConfig.defaults());
    }

    private static TokenRequest request(String username, String password) {
        return TokenRequest.builder().grantType("password").username(username).password(password).build();
    }

    private static OAuthErrorCode errorOf(Throwable thrown) {
        assertThat(thrown).isInstanceOf(OAuthException.class);
        return ((OAuthException) thrown).errorCode();
    }

    @Test
    @DisplayName("validate should map valid credentials to the verified resource owner")
    void validate_shouldReturnOwner_whenCredentialsValid() {
        GrantOutcome outcome = grant(verifier).validate(request("alice", "wonderland"), client);

        assertThat(outcome.resourceOwner()).isEqualTo("user-42");
        assertThat(outcome.scopeCeiling()).isEqualTo(ScopeSet.of("read", "write"));
        assertThat(outcome.defaultScope()).isEqualTo(ScopeSet.of("read"));
        assertThat(outcome.issueRefreshToken()).isTrue();
    }

    @Test
    @DisplayName("validate should reject wrong credentials with invalid_grant")
    void validate_shouldFail_whenCredentialsWrong() {
        assertThat(errorOf(catchThrowable(() -> grant(verifier).validate(request("alice", "nope"), client))))
            .isEqualTo(OAuthErrorCode.INVALID_GRANT);
    }

    @Test
    @DisplayName("validate should require username and password")
    void validate_shouldFail_whenParametersMissing() {
        assertThat(errorOf(catchThrowable(() -> grant(verifier).validate(request(null, "x"), client))))
            .isEqualTo(OAuthErrorCode.INVALID_REQUEST);
        assertThat(errorOf(catchThrowable(() -> grant(verifier).validate(request("alice", ""), client))))
            .isEqualTo(OAuthErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("validate should report the grant as unsupported without a verifier")
    void validate_shouldFail_whenNoVerifier() {
        PasswordGrant unavailable = grant(null);

        assertThat(unavailable.isAvailable()).isFalse();
        assertThat(errorOf(catchThrowable(() -> unavailable.validate(request("alice", "wonderland"), client))))
            .isEqualTo(OAuthErrorCode.UNSUPPORTED_GRANT_TYPE);
    }
}
