package tech.grantwell.engine.support;

import tech.grantwell.engine.client.ClientSecretHasher;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.scope.ScopeSet;

import java.util.EnumSet;
import java.util.List;

/**
 * Shared test data. Uses a cheap Argon2 cost so tests stay fast.
 */
public final class Fixtures {

    public static final ClientSecretHasher HASHER = new ClientSecretHasher(1, 1024, 1);

    public static final String REDIRECT_URI = "https://app.example.com/callback";

    /** A valid 43-character PKCE verifier. */
    public static final String CODE_VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
    /** S256 challenge of {@link #CODE_VERIFIER} (RFC 7636 Appendix B). */
    public static final String CODE_CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

    private static final String SECRET_HASH_S1 = HASHER.hash("s1");

    private Fixtures() {
    }

    /**
     * Confidential client "c1" with secret "s1".
     */
    public static OAuthClient confidentialClient(String defaultScope, GrantType... grantTypes) {
        return OAuthClient.builder()
            .clientId("c1")
            .clientName("Confidential test client")
            .clientType(OAuthClient.ClientType.CONFIDENTIAL)
            .secretHash(SECRET_HASH_S1)
            .grantTypes(grantTypes.length == 0 ? EnumSet.noneOf(GrantType.class) : EnumSet.of(grantTypes[0], grantTypes))
            .redirectUris(List.of(REDIRECT_URI))
            .defaultScope(ScopeSet.parse(defaultScope))
            .build();
    }

    /**
     * Public client "spa".
     */
    public static OAuthClient publicClient(String defaultScope, GrantType... grantTypes) {
        return OAuthClient.builder()
            .clientId("spa")
            .clientName("Public test client")
            .clientType(OAuthClient.ClientType.PUBLIC)
            .grantTypes(grantTypes.length == 0 ? EnumSet.noneOf(GrantType.class) : EnumSet.of(grantTypes[0], grantTypes))
            .redirectUris(List.of(REDIRECT_URI))
            .defaultScope(ScopeSet.parse(defaultScope))
            .build();
    }
}
