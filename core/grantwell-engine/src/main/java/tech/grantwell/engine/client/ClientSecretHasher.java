package tech.grantwell.engine.client;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;

/**
 * Client secret hashing and verification using Argon2id.
 *
 * Default cost:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 */
public class ClientSecretHasher {

    public static final int DEFAULT_ITERATIONS = 3;
    public static final int DEFAULT_MEMORY_COST = 65536;
    public static final int DEFAULT_PARALLELISM = 4;

    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;
    private final int iterations;
    private final int memoryCost;
    private final int parallelism;

    public ClientSecretHasher() {
        this(DEFAULT_ITERATIONS, DEFAULT_MEMORY_COST, DEFAULT_PARALLELISM);
    }

    public ClientSecretHasher(int iterations, int memoryCost, int parallelism) {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
        this.iterations = iterations;
        this.memoryCost = memoryCost;
        this.parallelism = parallelism;
    }

    /**
     * Hash a client secret.
     *
     * @param secret the plain secret
     * @return PHC string, e.g. {@code $argon2id$v=19$m=65536,t=3,p=4$...}
     */
    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        return argon2.hash(iterations, memoryCost, parallelism, secret.toCharArray());
    }

    /**
     * Verify a secret against a stored hash. The comparison is constant-time; a
     * malformed hash verifies as {@code false}.
     */
    public boolean verify(String secret, String secretHash) {
        if (secret == null || secretHash == null) {
            return false;
        }
        try {
            return argon2.verify(secretHash, secret.toCharArray());
        } catch (RuntimeException e) {
            return false;
        }
    }
}
