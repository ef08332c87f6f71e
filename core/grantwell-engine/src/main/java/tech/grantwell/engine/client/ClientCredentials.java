package tech.grantwell.engine.client;

import tech.grantwell.engine.error.OAuthException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Client identifier and secret as presented on a request.
 *
 * @param clientId     presented client_id, may be {@code null}
 * @param clientSecret presented secret, {@code null} when none was sent
 * @param method       where the credentials came from
 */
public record ClientCredentials(String clientId, String clientSecret, Method method) {

    private static final String BASIC_PREFIX = "Basic ";

    public enum Method {
        /** HTTP Basic authentication header (client_secret_basic). */
        BASIC,
        /** client_id / client_secret form parameters (client_secret_post, or public clients). */
        BODY,
        NONE
    }

    public static ClientCredentials none() {
        return new ClientCredentials(null, null, Method.NONE);
    }

    public static ClientCredentials basic(String clientId, String clientSecret) {
        return new ClientCredentials(clientId, clientSecret, Method.BASIC);
    }

    public static ClientCredentials body(String clientId, String clientSecret) {
        return new ClientCredentials(clientId, emptyToNull(clientSecret), Method.BODY);
    }

    /**
     * Resolve credentials from the Authorization header or the form body. The Basic
     * header wins when both are present.
     *
     * @throws OAuthException {@code invalid_client} when a Basic header is malformed
     */
    public static ClientCredentials resolve(String authorizationHeader, String formClientId, String formClientSecret) {
        if (authorizationHeader != null && authorizationHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return parseBasic(authorizationHeader.substring(BASIC_PREFIX.length()).strip());
        }
        if (formClientId != null && !formClientId.isEmpty()) {
            return body(formClientId, formClientSecret);
        }
        return none();
    }

    /**
     * Both halves of the decoded header are form-urlencoded, see RFC 6749 Section 2.3.1.
     */
    private static ClientCredentials parseBasic(String encoded) {
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw OAuthException.invalidClient();
        }

        int colonIdx = decoded.indexOf(':');
        if (colonIdx < 0) {
            throw OAuthException.invalidClient();
        }
        try {
            String clientId = URLDecoder.decode(decoded.substring(0, colonIdx), StandardCharsets.UTF_8);
            String secret = URLDecoder.decode(decoded.substring(colonIdx + 1), StandardCharsets.UTF_8);
            return basic(clientId, emptyToNull(secret));
        } catch (IllegalArgumentException e) {
            throw OAuthException.invalidClient();
        }
    }

    public boolean hasSecret() {
        return clientSecret != null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public String toString() {
        return "ClientCredentials[clientId=" + clientId + ", method=" + method + "]";
    }
}
