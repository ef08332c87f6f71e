package tech.grantwell.engine.store.memory;

import org.jboss.logging.Logger;
import tech.grantwell.engine.store.AccessToken;
import tech.grantwell.engine.store.AuthorizationGrant;
import tech.grantwell.engine.store.RefreshToken;
import tech.grantwell.engine.store.TokenStore;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory token store.
 *
 * <p>Writes and transactions are serialized on the write lock, which a transaction
 * holds until it commits or rolls back. Each write made inside
 * {@link #inTransaction(Supplier)} records an undo action; if the transaction throws,
 * the undo journal is replayed in reverse. Reads take the read lock, so other threads
 * only ever see committed state. The thread running a transaction reads its own writes.
 */
public class InMemoryTokenStore implements TokenStore {

    private static final Logger LOG = Logger.getLogger(InMemoryTokenStore.class);

    private final ConcurrentMap<String, AuthorizationGrant> grants = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AccessToken> accessTokens = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> accessTokensById = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RefreshToken> refreshTokens = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    private final Lock lock = readWriteLock.writeLock();
    private final Lock readLock = readWriteLock.readLock();
    private final ThreadLocal<Deque<Runnable>> undoJournal = new ThreadLocal<>();

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.lock();
        boolean outermost = undoJournal.get() == null;
        if (outermost) {
            undoJournal.set(new ArrayDeque<>());
        }
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            if (outermost) {
                rollback();
            }
            throw e;
        } finally {
            if (outermost) {
                undoJournal.remove();
            }
            lock.unlock();
        }
    }

    private void rollback() {
        Deque<Runnable> journal = undoJournal.get();
        LOG.debugf("Rolling back %d change(s)", journal.size());
        while (!journal.isEmpty()) {
            journal.pop().run();
        }
    }

    /**
     * Apply a change under the lock, remembering how to undo it when inside a transaction.
     */
    private <K, V> void put(ConcurrentMap<K, V> map, K key, V value) {
        lock.lock();
        try {
            V previous = map.put(key, value);
            Deque<Runnable> journal = undoJournal.get();
            if (journal != null) {
                journal.push(() -> {
                    if (previous == null) {
                        map.remove(key);
                    } else {
                        map.put(key, previous);
                    }
                });
            }
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> reader) {
        readLock.lock();
        try {
            return reader.get();
        } finally {
            readLock.unlock();
        }
    }

    // ==================== Authorization grants ====================

    @Override
    public void saveGrant(AuthorizationGrant grant) {
        put(grants, grant.code(), grant);
    }

    @Override
    public Optional<AuthorizationGrant> findGrant(String code) {
        return code == null ? Optional.empty() : read(() -> Optional.ofNullable(grants.get(code)));
    }

    @Override
    public boolean consumeGrant(String code) {
        lock.lock();
        try {
            AuthorizationGrant grant = code == null ? null : grants.get(code);
            if (grant == null || grant.consumed()) {
                return false;
            }
            put(grants, code, grant.withConsumed(true));
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Access tokens ====================

    @Override
    public void saveAccessToken(AccessToken token) {
        lock.lock();
        try {
            put(accessTokens, token.token(), token);
            if (token.tokenId() != null) {
                put(accessTokensById, token.tokenId(), token.token());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<AccessToken> findAccessToken(String token) {
        return token == null ? Optional.empty() : read(() -> Optional.ofNullable(accessTokens.get(token)));
    }

    @Override
    public Optional<AccessToken> findAccessTokenById(String tokenId) {
        if (tokenId == null) {
            return Optional.empty();
        }
        return read(() -> Optional.ofNullable(accessTokensById.get(tokenId)).map(accessTokens::get));
    }

    @Override
    public boolean revokeAccessToken(String token) {
        lock.lock();
        try {
            AccessToken existing = token == null ? null : accessTokens.get(token);
            if (existing == null || existing.revoked()) {
                return false;
            }
            put(accessTokens, token, existing.withRevoked(true));
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Refresh tokens ====================

    @Override
    public void saveRefreshToken(RefreshToken token) {
        put(refreshTokens, token.token(), token);
    }

    @Override
    public Optional<RefreshToken> findRefreshToken(String token) {
        return token == null ? Optional.empty() : read(() -> Optional.ofNullable(refreshTokens.get(token)));
    }

    @Override
    public boolean revokeRefreshToken(String token) {
        lock.lock();
        try {
            RefreshToken existing = token == null ? null : refreshTokens.get(token);
            if (existing == null || existing.revoked()) {
                return false;
            }
            put(refreshTokens, token, existing.withRevoked(true));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean relinkRefreshToken(String refreshToken, String expectedAccessToken, String newAccessToken) {
        lock.lock();
        try {
            RefreshToken existing = refreshToken == null ? null : refreshTokens.get(refreshToken);
            if (existing == null || existing.revoked()
                    || !Objects.equals(existing.accessToken(), expectedAccessToken)) {
                return false;
            }
            put(refreshTokens, refreshToken, existing.withAccessToken(newAccessToken));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int revokeRefreshTokenFamily(String family) {
        if (family == null) {
            return 0;
        }
        return inTransaction(() -> {
            List<RefreshToken> members = refreshTokens.values().stream()
                .filter(token -> family.equals(token.family()) && !token.revoked())
                .toList();
            for (RefreshToken member : members) {
                revokeRefreshToken(member.token());
                if (member.accessToken() != null) {
                    revokeAccessToken(member.accessToken());
                }
            }
            return members.size();
        });
    }

    // ==================== Maintenance ====================

    /**
     * Drop grants and tokens that expired before {@code cutoff}.
     *
     * @return number of entries removed
     */
    public int purgeExpired(Instant cutoff) {
        lock.lock();
        try {
            int before = grants.size() + accessTokens.size() + refreshTokens.size();
            grants.values().removeIf(grant -> grant.expiresAt().isBefore(cutoff));
            accessTokens.values().removeIf(token -> token.expiresAt().isBefore(cutoff));
            accessTokensById.values().removeIf(token -> !accessTokens.containsKey(token));
            refreshTokens.values().removeIf(token -> token.expiresAt() != null && token.expiresAt().isBefore(cutoff));
            int removed = before - (grants.size() + accessTokens.size() + refreshTokens.size());
            if (removed > 0) {
                LOG.infof("Purged %d expired grant(s) and token(s)", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }
}
