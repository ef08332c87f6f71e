package tech.grantwell.engine.token;

import java.util.Optional;

/**
 * Random bearer strings with no embedded meaning. The claims live only in storage.
 */
public class OpaqueTokenCodec implements AccessTokenCodec {

    @Override
    public String encode(TokenClaims claims) {
        return TokenGenerator.randomToken();
    }

    @Override
    public Optional<TokenClaims> decode(String token) {
        return Optional.empty();
    }

    @Override
    public boolean isSelfContained() {
        return false;
    }
}
