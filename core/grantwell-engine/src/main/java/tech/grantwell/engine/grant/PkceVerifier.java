package tech.grantwell.engine.grant;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange) checks.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier))
 * 3. Client sends code_challenge in authorization request
 * 4. Server stores code_challenge with authorization code
 * 5. Client sends code_verifier in token request
 * 6. Server verifies the transformed code_verifier equals the stored code_challenge
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
public class PkceVerifier {

    private static final Pattern UNRESERVED = Pattern.compile("^[A-Za-z0-9\\-._~]+$");

    /**
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier)))
     */
    public String computeS256Challenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify that a code verifier matches the stored code challenge.
     */
    public boolean verify(String codeVerifier, String codeChallenge, PkceMethod method) {
        if (codeVerifier == null || codeChallenge == null || method == null) {
            return false;
        }
        return switch (method) {
            case S256 -> constantTimeEquals(computeS256Challenge(codeVerifier), codeChallenge);
            case PLAIN -> constantTimeEquals(codeVerifier, codeChallenge);
        };
    }

    /**
     * Challenges share the verifier's alphabet and length bounds; S256 always produces 43 characters.
     */
    public boolean isValidCodeChallenge(String codeChallenge) {
        return isValidCodeVerifier(codeChallenge);
    }

    /**
     * Per RFC 7636: 43-128 characters, unreserved characters only.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        if (codeVerifier == null) {
            return false;
        }
        if (codeVerifier.length() < 43 || codeVerifier.length() > 128) {
            return false;
        }
        return UNRESERVED.matcher(codeVerifier).matches();
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.US_ASCII), b.getBytes(StandardCharsets.US_ASCII));
    }
}
