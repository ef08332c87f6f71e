package tech.grantwell.server.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.grantwell.engine.token.SigningKeys;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the RSA key pair used for JWT access tokens and id_tokens.
 *
 * Supports two modes:
 * 1. File-based keys (production) - PEM files from the configured paths
 * 2. Generated keys (development) - persisted to a local directory so tokens
 *    survive restarts
 */
@ApplicationScoped
public class SigningKeyLoader {

    private static final Logger LOG = Logger.getLogger(SigningKeyLoader.class);

    @Inject
    AuthConfig authConfig;

    private SigningKeys signingKeys;

    @PostConstruct
    void init() {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        try {
            if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
                LOG.info("Loading JWT keys from files");
                signingKeys = SigningKeys.fromPem(
                    Files.readString(Path.of(jwt.privateKeyPath().get()), StandardCharsets.US_ASCII),
                    Files.readString(Path.of(jwt.publicKeyPath().get()), StandardCharsets.US_ASCII));
            } else {
                signingKeys = loadOrGenerateDevKeys(Path.of(jwt.devKeyDir()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize JWT keys", e);
        }
        LOG.infof("Signing keys initialized with key ID: %s", signingKeys.keyId());
    }

    public SigningKeys signingKeys() {
        return signingKeys;
    }

    /**
     * Load dev keys from a local directory, or generate and persist new ones.
     */
    static SigningKeys loadOrGenerateDevKeys(Path keyDir) throws IOException {
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        SigningKeys keys;
        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            keys = SigningKeys.fromDer(Files.readAllBytes(privateKeyFile), Files.readAllBytes(publicKeyFile));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            keys = SigningKeys.generate();
            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, keys.privateKey().getEncoded());
            Files.write(publicKeyFile, keys.publicKey().getEncoded());
        }
        LOG.warn("Using dev JWT keys. Configure grantwell.auth.jwt.private-key-path and grantwell.auth.jwt.public-key-path for production.");
        return keys;
    }
}
