package tech.grantwell.engine.token;

import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import tech.grantwell.engine.scope.ScopeSet;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Self-contained RS256 access tokens.
 *
 * <p>Tokens are signed with the SmallRye JWT builder and verified with a jose4j
 * consumer whose evaluation time comes from the engine clock, so expiry is judged
 * against the same time source that minted the token.
 */
public class JwtTokenCodec implements AccessTokenCodec {

    private static final Logger LOG = Logger.getLogger(JwtTokenCodec.class);

    static final String CLIENT_ID_CLAIM = "client_id";
    static final String SCOPE_CLAIM = "scope";

    private final String issuer;
    private final SigningKeys keys;
    private final Clock clock;

    public JwtTokenCodec(String issuer, SigningKeys keys, Clock clock) {
        this.issuer = issuer;
        this.keys = keys;
        this.clock = clock;
    }

    @Override
    public String encode(TokenClaims claims) {
        JwtClaimsBuilder builder = Jwt.issuer(issuer)
                .claim(CLIENT_ID_CLAIM, claims.clientId())
                .claim("jti", claims.tokenId())
                .issuedAt(claims.issuedAt())
                .expiresAt(claims.expiresAt());

        if (claims.subject() != null) {
            builder.subject(claims.subject());
        }
        if (!claims.scope().isEmpty()) {
            builder.claim(SCOPE_CLAIM, claims.scope().toString());
        }

        return builder.jws()
                .keyId(keys.keyId())
                .sign(keys.privateKey());
    }

    @Override
    public Optional<TokenClaims> decode(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        JwtConsumer consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setRequireJwtId()
                .setExpectedIssuer(issuer)
                .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
                .setVerificationKey(keys.publicKey())
                .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT,
                        AlgorithmIdentifiers.RSA_USING_SHA256)
                .setSkipDefaultAudienceValidation()
                .build();
        try {
            JwtClaims claims = consumer.processToClaims(token);
            return Optional.of(new TokenClaims(
                    claims.getJwtId(),
                    claims.getSubject(),
                    claims.getStringClaimValue(CLIENT_ID_CLAIM),
                    ScopeSet.parse(claims.getStringClaimValue(SCOPE_CLAIM)),
                    Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue())));
        } catch (InvalidJwtException | MalformedClaimException e) {
            LOG.debugf("JWT access token rejected: %s", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isSelfContained() {
        return true;
    }
}
