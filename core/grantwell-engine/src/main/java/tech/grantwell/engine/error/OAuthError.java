package tech.grantwell.engine.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Protocol error body: {@code {"error": ..., "error_description": ...}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthError(
    @JsonIgnore OAuthErrorCode errorCode,
    @JsonProperty("error_description") String description
) {

    public static OAuthError of(OAuthErrorCode code, String description) {
        return new OAuthError(code, description);
    }

    @JsonProperty("error")
    public String error() {
        return errorCode.code();
    }

    @JsonIgnore
    public int httpStatus() {
        return errorCode.httpStatus();
    }
}
