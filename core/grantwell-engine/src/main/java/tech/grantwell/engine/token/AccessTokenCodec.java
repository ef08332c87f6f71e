package tech.grantwell.engine.token;

import java.util.Optional;

/**
 * Turns access-token claims into a bearer string and back.
 *
 * <p>Codecs never touch storage. An opaque codec cannot decode its own output; such
 * tokens are validated by a storage lookup instead.
 */
public interface AccessTokenCodec {

    String encode(TokenClaims claims);

    /**
     * Verify and decode a token.
     *
     * @return the claims if the token is well-formed, correctly signed and unexpired;
     *         always empty for codecs that are not self-contained
     */
    Optional<TokenClaims> decode(String token);

    /**
     * Whether {@link #decode(String)} can validate tokens without storage.
     */
    boolean isSelfContained();
}
