package tech.grantwell.engine.grant;

import java.util.Optional;

/**
 * Resource-owner credential check used by the password grant. Supplied by the
 * deployment; the engine stores no user passwords.
 */
@FunctionalInterface
public interface PasswordVerifier {

    /**
     * @return the resource owner's subject id if the credentials are valid
     */
    Optional<String> verify(String username, String password);
}
