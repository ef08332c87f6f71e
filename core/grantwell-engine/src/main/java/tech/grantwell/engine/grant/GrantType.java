package tech.grantwell.engine.grant;

import java.util.Optional;

/**
 * The closed set of grant types the engine understands.
 *
 * <p>Dispatch on a grant type is always an exhaustive {@code switch} over this enum;
 * there is no runtime registration of additional grants.
 */
public enum GrantType {

    AUTHORIZATION_CODE("authorization_code"),
    CLIENT_CREDENTIALS("client_credentials"),
    REFRESH_TOKEN("refresh_token"),
    PASSWORD("password"),
    /** Issued from the authorization endpoint only; never a token-endpoint grant_type. */
    IMPLICIT("implicit");

    private final String parameter;

    GrantType(String parameter) {
        this.parameter = parameter;
    }

    /** Wire value of the {@code grant_type} parameter. */
    public String parameter() {
        return parameter;
    }

    /**
     * Whether tokens issued through this grant may come with a refresh token.
     */
    public boolean issuesRefreshToken() {
        return this == AUTHORIZATION_CODE || this == PASSWORD || this == REFRESH_TOKEN;
    }

    public static Optional<GrantType> fromParameter(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (GrantType type : values()) {
            if (type.parameter.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
