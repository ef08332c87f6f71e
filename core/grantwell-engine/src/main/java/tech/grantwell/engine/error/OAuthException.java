package tech.grantwell.engine.error;

/**
 * Raised by grant validation, client authentication and scope resolution when a
 * request must be rejected with a protocol error. Caught at the engine boundary and
 * converted into an {@link OAuthResult.Failure}.
 */
public class OAuthException extends RuntimeException {

    private final OAuthErrorCode errorCode;

    public OAuthException(OAuthErrorCode errorCode, String description) {
        super(description);
        this.errorCode = errorCode;
    }

    public static OAuthException invalidRequest(String description) {
        return new OAuthException(OAuthErrorCode.INVALID_REQUEST, description);
    }

    public static OAuthException invalidClient() {
        return new OAuthException(OAuthErrorCode.INVALID_CLIENT, "Client authentication failed");
    }

    public static OAuthException invalidGrant(String description) {
        return new OAuthException(OAuthErrorCode.INVALID_GRANT, description);
    }

    public static OAuthException unauthorizedClient(String description) {
        return new OAuthException(OAuthErrorCode.UNAUTHORIZED_CLIENT, description);
    }

    public static OAuthException unsupportedGrantType(String description) {
        return new OAuthException(OAuthErrorCode.UNSUPPORTED_GRANT_TYPE, description);
    }

    public static OAuthException unsupportedResponseType(String description) {
        return new OAuthException(OAuthErrorCode.UNSUPPORTED_RESPONSE_TYPE, description);
    }

    public static OAuthException invalidScope(String description) {
        return new OAuthException(OAuthErrorCode.INVALID_SCOPE, description);
    }

    public OAuthErrorCode errorCode() {
        return errorCode;
    }

    public OAuthError toError() {
        return OAuthError.of(errorCode, getMessage());
    }
}
