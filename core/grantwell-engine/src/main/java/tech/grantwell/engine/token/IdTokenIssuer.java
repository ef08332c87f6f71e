package tech.grantwell.engine.token;

import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;

import java.time.Duration;
import java.time.Instant;

/**
 * Issues OIDC id_tokens alongside access tokens when the {@code openid} scope is granted.
 *
 * <p>ID tokens describe the authenticated resource owner to the client; they carry no
 * authorization claims.
 */
public class IdTokenIssuer {

    public static final String OPENID_SCOPE = "openid";

    private final String issuer;
    private final SigningKeys keys;
    private final Duration lifetime;

    public IdTokenIssuer(String issuer, SigningKeys keys, Duration lifetime) {
        this.issuer = issuer;
        this.keys = keys;
        this.lifetime = lifetime;
    }

    /**
     * @param subject     resource owner ({@code sub})
     * @param clientId    audience ({@code aud})
     * @param nonce       nonce from the authorization request, or {@code null}
     * @param accessToken the access token issued in the same response, hashed into {@code at_hash}
     * @param issuedAt    issue instant
     */
    public String issue(String subject, String clientId, String nonce, String accessToken, Instant issuedAt) {
        JwtClaimsBuilder builder = Jwt.issuer(issuer)
                .subject(subject)
                .audience(clientId)
                .claim("azp", clientId)
                .claim("at_hash", TokenGenerator.leftHalfHash(accessToken))
                .issuedAt(issuedAt)
                .expiresAt(issuedAt.plus(lifetime));

        if (nonce != null) {
            builder.claim("nonce", nonce);
        }

        return builder.jws()
                .keyId(keys.keyId())
                .sign(keys.privateKey());
    }
}
