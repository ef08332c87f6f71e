package tech.grantwell.engine.grant;

import java.util.Optional;

/**
 * PKCE code challenge transformation.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636#section-4.2">RFC 7636 Section 4.2</a>
 */
public enum PkceMethod {

    S256("S256"),
    PLAIN("plain");

    private final String parameter;

    PkceMethod(String parameter) {
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    /**
     * Parse {@code code_challenge_method}. An absent method means {@code plain}.
     */
    public static Optional<PkceMethod> fromParameter(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.of(PLAIN);
        }
        for (PkceMethod method : values()) {
            if (method.parameter.equals(value)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
