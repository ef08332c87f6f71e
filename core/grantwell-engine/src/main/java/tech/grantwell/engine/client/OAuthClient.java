package tech.grantwell.engine.client;

import lombok.Builder;
import lombok.With;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.scope.ScopeSet;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * OAuth2 client registration as seen by the engine.
 *
 * <p>Supports two client types:
 * <ul>
 *   <li>PUBLIC: SPAs and native apps. No secret; authenticates by client_id only.</li>
 *   <li>CONFIDENTIAL: server-side apps holding an Argon2id-hashed secret.</li>
 * </ul>
 *
 * <p>Records are owned by the client registry and never modified during a request.
 *
 * @param clientId            unique client identifier used in OAuth flows
 * @param clientName          human-readable name
 * @param clientType          determines how the client authenticates
 * @param secretHash          Argon2id PHC string; {@code null} for public clients
 * @param grantTypes          grant types this client may use
 * @param redirectUris        registered redirect URIs
 * @param redirectUriMatching how a presented redirect URI is compared to the registered ones
 * @param defaultScope        scope granted when a request names none
 * @param allowedScope        ceiling for user-delegated grants; empty means {@code defaultScope}
 * @param pkceRequired        require PKCE regardless of client type
 * @param disabled            disabled clients cannot authenticate
 */
@Builder(toBuilder = true)
@With
public record OAuthClient(
    String clientId,
    String clientName,
    ClientType clientType,
    String secretHash,
    Set<GrantType> grantTypes,
    List<String> redirectUris,
    RedirectUriMatching redirectUriMatching,
    ScopeSet defaultScope,
    ScopeSet allowedScope,
    boolean pkceRequired,
    boolean disabled
) {

    public OAuthClient {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        clientType = clientType == null ? ClientType.PUBLIC : clientType;
        grantTypes = grantTypes == null || grantTypes.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(grantTypes));
        redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
        redirectUriMatching = redirectUriMatching == null ? RedirectUriMatching.EXACT : redirectUriMatching;
        defaultScope = defaultScope == null ? ScopeSet.empty() : defaultScope;
        allowedScope = allowedScope == null ? ScopeSet.empty() : allowedScope;
    }

    public boolean isPublic() {
        return clientType == ClientType.PUBLIC;
    }

    public boolean isConfidential() {
        return clientType == ClientType.CONFIDENTIAL;
    }

    /**
     * Check if a grant type is allowed for this client. The refresh_token grant is also
     * allowed to clients that use a grant which hands out refresh tokens.
     */
    public boolean isGrantTypeAllowed(GrantType grantType) {
        if (grantType == null) {
            return false;
        }
        if (grantType == GrantType.REFRESH_TOKEN) {
            return grantTypes.contains(GrantType.REFRESH_TOKEN)
                || grantTypes.contains(GrantType.AUTHORIZATION_CODE)
                || grantTypes.contains(GrantType.PASSWORD);
        }
        return grantTypes.contains(grantType);
    }

    /**
     * Check if a redirect URI is allowed for this client.
     */
    public boolean isRedirectUriAllowed(String uri) {
        if (uri == null) {
            return false;
        }
        return switch (redirectUriMatching) {
            case EXACT -> redirectUris.contains(uri);
            case PATTERN -> redirectUris.stream().anyMatch(pattern -> matchesPattern(pattern, uri));
        };
    }

    /**
     * The only registered redirect URI, used when an authorization request omits one.
     * Returns {@code null} if zero or several URIs are registered, or if the single
     * URI is a pattern.
     */
    public String defaultRedirectUri() {
        if (redirectUris.size() != 1) {
            return null;
        }
        String uri = redirectUris.get(0);
        return redirectUriMatching == RedirectUriMatching.PATTERN && uri.contains("*") ? null : uri;
    }

    private static boolean matchesPattern(String pattern, String uri) {
        StringBuilder regex = new StringBuilder();
        for (String part : pattern.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append("[^/]*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.matches(regex.toString(), uri);
    }

    /**
     * OAuth client type.
     */
    public enum ClientType {
        /**
         * Public client (SPA, mobile app).
         * No client secret.
         */
        PUBLIC,

        /**
         * Confidential client (server-side app).
         * Has client secret.
         */
        CONFIDENTIAL
    }

    public enum RedirectUriMatching {
        EXACT,
        /** Registered URIs may contain {@code *}, matching any run of characters except {@code /}. */
        PATTERN
    }
}
