package tech.grantwell.engine.authorize;

import tech.grantwell.engine.error.OAuthError;

/**
 * Where to send the user agent after the authorization step.
 *
 * @param location full redirect URI including the response (or error) parameters
 * @param error    the error carried by the redirect, or {@code null} on success
 */
public record AuthorizationRedirect(String location, OAuthError error) {

    public static AuthorizationRedirect success(String location) {
        return new AuthorizationRedirect(location, null);
    }

    public static AuthorizationRedirect error(String location, OAuthError error) {
        return new AuthorizationRedirect(location, error);
    }

    public boolean isError() {
        return error != null;
    }
}
