package tech.grantwell.server.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.grantwell.engine.OAuthEngine;
import tech.grantwell.engine.client.ClientCredentials;
import tech.grantwell.engine.error.OAuthError;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.error.OAuthResult;
import tech.grantwell.engine.grant.TokenRequest;

import java.util.function.Function;

/**
 * OAuth2 token, revocation and introspection endpoints.
 *
 * <p>Clients authenticate with HTTP Basic (client_secret_basic) or with
 * {@code client_id}/{@code client_secret} form parameters. Every response is marked
 * non-cacheable.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7009">RFC 7009 - Token Revocation</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7662">RFC 7662 - Token Introspection</a>
 */
@Path("/oauth")
@Tag(name = "OAuth2", description = "OAuth2 token, revocation and introspection endpoints")
@Consumes(MediaType.APPLICATION_FORM_URLENCODED)
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    private static final Logger LOG = Logger.getLogger(TokenResource.class);
    private static final String BASIC_CHALLENGE = "Basic realm=\"oauth\"";

    @Inject
    OAuthEngine engine;

    // ==================== Token Endpoint ====================

    /**
     * OAuth2 Token endpoint.
     *
     * Supports:
     * - authorization_code: Exchange code for tokens
     * - client_credentials: Service-to-service authentication
     * - refresh_token: Get new access token using refresh token
     * - password: Resource owner password credentials (when enabled)
     */
    @POST
    @Path("/token")
    @Operation(summary = "Exchange a grant for tokens")
    @APIResponse(responseCode = "200", description = "Tokens issued")
    @APIResponse(responseCode = "400", description = "Protocol error")
    @APIResponse(responseCode = "401", description = "Client authentication failed")
    public Response token(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,

            @Parameter(description = "Grant type")
            @FormParam("grant_type") String grantType,

            @Parameter(description = "Authorization code (for authorization_code grant)")
            @FormParam("code") String code,

            @Parameter(description = "Redirect URI (must match authorization request)")
            @FormParam("redirect_uri") String redirectUri,

            @Parameter(description = "Client ID")
            @FormParam("client_id") String formClientId,

            @Parameter(description = "Client secret (confidential clients)")
            @FormParam("client_secret") String formClientSecret,

            @Parameter(description = "PKCE code verifier")
            @FormParam("code_verifier") String codeVerifier,

            @Parameter(description = "Refresh token (for refresh_token grant)")
            @FormParam("refresh_token") String refreshToken,

            @Parameter(description = "Username (for password grant)")
            @FormParam("username") String username,

            @Parameter(description = "Password (for password grant)")
            @FormParam("password") String password,

            @Parameter(description = "Requested scopes")
            @FormParam("scope") String scope
    ) {
        ClientCredentials credentials;
        try {
            credentials = ClientCredentials.resolve(authHeader, formClientId, formClientSecret);
        } catch (OAuthException e) {
            return errorResponse(e.toError());
        }

        TokenRequest request = TokenRequest.builder()
            .grantType(grantType)
            .credentials(credentials)
            .code(code)
            .redirectUri(redirectUri)
            .codeVerifier(codeVerifier)
            .refreshToken(refreshToken)
            .username(username)
            .password(password)
            .scope(scope)
            .build();

        return respond(engine.token(request), Function.identity());
    }

    // ==================== Revocation Endpoint ====================

    @POST
    @Path("/revoke")
    @Operation(summary = "Revoke an access or refresh token")
    @APIResponse(responseCode = "200", description = "Token revoked, or was not active")
    public Response revoke(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @FormParam("token") String token,
            @FormParam("token_type_hint") String tokenTypeHint,
            @FormParam("client_id") String formClientId,
            @FormParam("client_secret") String formClientSecret
    ) {
        ClientCredentials credentials;
        try {
            credentials = ClientCredentials.resolve(authHeader, formClientId, formClientSecret);
        } catch (OAuthException e) {
            return errorResponse(e.toError());
        }
        return respond(engine.revoke(credentials, token, tokenTypeHint), ignored -> null);
    }

    // ==================== Introspection Endpoint ====================

    @POST
    @Path("/introspect")
    @Operation(summary = "Describe the state of a token")
    @APIResponse(responseCode = "200", description = "Token state; inactive tokens return only active=false")
    public Response introspect(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,
            @FormParam("token") String token,
            @FormParam("token_type_hint") String tokenTypeHint,
            @FormParam("client_id") String formClientId,
            @FormParam("client_secret") String formClientSecret
    ) {
        ClientCredentials credentials;
        try {
            credentials = ClientCredentials.resolve(authHeader, formClientId, formClientSecret);
        } catch (OAuthException e) {
            return errorResponse(e.toError());
        }
        return respond(engine.introspect(credentials, token, tokenTypeHint), Function.identity());
    }

    // ==================== Responses ====================

    private static <T> Response respond(OAuthResult<T> result, Function<T, ?> body) {
        if (result instanceof OAuthResult.Success<T> success) {
            return noStore(Response.ok(body.apply(success.value()))).build();
        }
        return errorResponse(((OAuthResult.Failure<T>) result).error());
    }

    static Response errorResponse(OAuthError error) {
        Response.ResponseBuilder builder = noStore(Response.status(error.httpStatus()).entity(error))
            .type(MediaType.APPLICATION_JSON);
        if (error.httpStatus() == Response.Status.UNAUTHORIZED.getStatusCode()) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, BASIC_CHALLENGE);
        }
        if (error.httpStatus() >= 500) {
            LOG.warnf("Returning %s to client", error.error());
        }
        return builder.build();
    }

    private static Response.ResponseBuilder noStore(Response.ResponseBuilder builder) {
        return builder
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .header("Pragma", "no-cache");
    }
}
