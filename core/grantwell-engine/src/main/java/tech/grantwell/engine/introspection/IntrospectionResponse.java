package tech.grantwell.engine.introspection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token introspection response (RFC 7662 Section 2.2). An inactive token serializes
 * as exactly {@code {"active":false}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntrospectionResponse(
    @JsonProperty("active") boolean active,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("scope") String scope,
    @JsonProperty("exp") Long exp,
    @JsonProperty("iat") Long iat,
    @JsonProperty("sub") String sub
) {

    private static final IntrospectionResponse INACTIVE = new IntrospectionResponse(false, null, null, null, null, null);

    public static IntrospectionResponse inactive() {
        return INACTIVE;
    }
}
