package tech.grantwell.engine.store;

import tech.grantwell.engine.error.StoreException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage adapter for authorization grants and tokens.
 *
 * <p>Implementations own all locking. Operations returning {@code boolean} are
 * compare-and-set points: they report {@code true} only for the single caller that
 * performed the transition. Any I/O failure is raised as {@link StoreException}.
 */
public interface TokenStore {

    /**
     * Run {@code work} as one transaction. If it throws, every change made inside it
     * is rolled back and the exception propagates unchanged.
     */
    <T> T inTransaction(Supplier<T> work);

    void saveGrant(AuthorizationGrant grant);

    Optional<AuthorizationGrant> findGrant(String code);

    /**
     * Atomically mark a grant consumed.
     *
     * @return {@code true} if this call consumed it; {@code false} if it was unknown
     *         or already consumed
     */
    boolean consumeGrant(String code);

    void saveAccessToken(AccessToken token);

    Optional<AccessToken> findAccessToken(String token);

    Optional<AccessToken> findAccessTokenById(String tokenId);

    /**
     * @return {@code true} if the token went from live to revoked
     */
    boolean revokeAccessToken(String token);

    void saveRefreshToken(RefreshToken token);

    Optional<RefreshToken> findRefreshToken(String token);

    /**
     * @return {@code true} if the token went from live to revoked
     */
    boolean revokeRefreshToken(String token);

    /**
     * Point a live refresh token at a new access token, provided it is still linked
     * to {@code expectedAccessToken}.
     */
    boolean relinkRefreshToken(String refreshToken, String expectedAccessToken, String newAccessToken);

    /**
     * Revoke every refresh token of a family, and the access tokens linked to them.
     *
     * @return number of refresh tokens revoked
     */
    int revokeRefreshTokenFamily(String family);
}
