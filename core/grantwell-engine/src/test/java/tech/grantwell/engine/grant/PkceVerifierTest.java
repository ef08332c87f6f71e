package tech.grantwell.engine.grant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.grantwell.engine.support.Fixtures;

import static org.assertj.core.api.Assertions.*;

class PkceVerifierTest {

    private final PkceVerifier pkceVerifier = new PkceVerifier();

    @Test
    @DisplayName("computeS256Challenge should match the RFC 7636 example")
    void computeS256Challenge_shouldMatchRfcExample() {
        assertThat(pkceVerifier.computeS256Challenge(Fixtures.CODE_VERIFIER))
            .isEqualTo(Fixtures.CODE_CHALLENGE);
    }

    @Test
    @DisplayName("verify should accept the matching S256 verifier")
    void verify_shouldAccept_whenS256Matches() {
        assertThat(pkceVerifier.verify(Fixtures.CODE_VERIFIER, Fixtures.CODE_CHALLENGE, PkceMethod.S256)).isTrue();
    }

    @Test
    @DisplayName("verify should reject a different verifier")
    void verify_shouldReject_whenVerifierDiffers() {
        String other = Fixtures.CODE_VERIFIER.replace('d', 'e');

        assertThat(pkceVerifier.verify(other, Fixtures.CODE_CHALLENGE, PkceMethod.S256)).isFalse();
    }

    @Test
    @DisplayName("verify should compare plain challenges directly")
    void verify_shouldCompareDirectly_whenPlain() {
        assertThat(pkceVerifier.verify(Fixtures.CODE_VERIFIER, Fixtures.CODE_VERIFIER, PkceMethod.PLAIN)).isTrue();
        assertThat(pkceVerifier.verify(Fixtures.CODE_VERIFIER, Fixtures.CODE_CHALLENGE, PkceMethod.PLAIN)).isFalse();
    }

    @Test
    @DisplayName("verify should reject null arguments")
    void verify_shouldReject_whenArgumentsNull() {
        assertThat(pkceVerifier.verify(null, Fixtures.CODE_CHALLENGE, PkceMethod.S256)).isFalse();
        assertThat(pkceVerifier.verify(Fixtures.CODE_VERIFIER, null, PkceMethod.S256)).isFalse();
        assertThat(pkceVerifier.verify(Fixtures.CODE_VERIFIER, Fixtures.CODE_CHALLENGE, null)).isFalse();
    }

    @Test
    @DisplayName("isValidCodeVerifier should enforce length and character set")
    void isValidCodeVerifier_shouldEnforceFormat() {
        assertThat(pkceVerifier.isValidCodeVerifier("a".repeat(43))).isTrue();
        assertThat(pkceVerifier.isValidCodeVerifier("a".repeat(128))).isTrue();
        assertThat(pkceVerifier.isValidCodeVerifier("a".repeat(42))).isFalse();
        assertThat(pkceVerifier.isValidCodeVerifier("a".repeat(129))).isFalse();
        assertThat(pkceVerifier.isValidCodeVerifier("a".repeat(42) + "+")).isFalse();
        assertThat(pkceVerifier.isValidCodeVerifier(null)).isFalse();
    }

    @Test
    @DisplayName("PkceMethod.fromParameter should default to plain and reject unknown methods")
    void pkceMethod_fromParameter() {
        assertThat(PkceMethod.fromParameter("S256")).contains(PkceMethod.S256);
        assertThat(PkceMethod.fromParameter("plain")).contains(PkceMethod.PLAIN);
        assertThat(PkceMethod.fromParameter(null)).contains(PkceMethod.PLAIN);
        assertThat(PkceMethod.fromParameter("S512")).isEmpty();
    }
}
