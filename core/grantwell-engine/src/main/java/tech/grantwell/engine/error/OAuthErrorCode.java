package tech.grantwell.engine.error;

/**
 * Error codes returned by the token, authorization, introspection and revocation
 * endpoints, with the HTTP status each one maps to.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-5.2">RFC 6749 Section 5.2</a>
 */
public enum OAuthErrorCode {

    INVALID_REQUEST("invalid_request", 400),
    INVALID_CLIENT("invalid_client", 401),
    INVALID_GRANT("invalid_grant", 400),
    UNAUTHORIZED_CLIENT("unauthorized_client", 400),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", 400),
    INVALID_SCOPE("invalid_scope", 400),
    SERVER_ERROR("server_error", 500);

    private final String code;
    private final int httpStatus;

    OAuthErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    /** Wire value for the {@code error} field. */
    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
