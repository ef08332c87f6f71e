package tech.grantwell.server.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.OAuthEngine;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.token.SigningKeys;
import tech.grantwell.server.config.AuthConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Well-known endpoints for OAuth2 discovery.
 * Enables resource servers to discover endpoints and validate JWT access tokens.
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "OAuth2 discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    @Inject
    OAuthEngine engine;

    @Inject
    AuthConfig authConfig;

    @Context
    UriInfo uriInfo;

    /**
     * JSON Web Key Set (JWKS) endpoint.
     * Returns the public keys used to verify tokens.
     */
    @GET
    @Path("/jwks.json")
    @Operation(summary = "Get JSON Web Key Set for token verification")
    @APIResponse(responseCode = "200", description = "JWKS document")
    public Map<String, Object> jwks() {
        return engine.signingKeys()
            .map(SigningKeys::toJwks)
            .orElse(Map.of("keys", List.of()));
    }

    /**
     * Authorization server metadata (RFC 8414).
     */
    @GET
    @Path("/oauth-authorization-server")
    @Operation(summary = "Get authorization server metadata")
    @APIResponse(responseCode = "200", description = "Authorization server metadata")
    public Map<String, Object> metadata() {
        EngineConfig config = engine.config();
        String baseUrl = getBaseUrl();

        List<String> grantTypes = new ArrayList<>();
        List<String> responseTypes = new ArrayList<>();
        for (GrantType grantType : GrantType.values()) {
            if (!config.isGrantEnabled(grantType)) {
                continue;
            }
            grantTypes.add(grantType.parameter());
            if (grantType == GrantType.AUTHORIZATION_CODE) {
                responseTypes.add("code");
            } else if (grantType == GrantType.IMPLICIT) {
                responseTypes.add("token");
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("issuer", config.issuer());
        authConfig.authorizationEndpoint().ifPresent(endpoint -> {
            metadata.put("authorization_endpoint", endpoint);
            metadata.put("response_types_supported", responseTypes);
        });
        metadata.put("token_endpoint", baseUrl + "/oauth/token");
        metadata.put("revocation_endpoint", baseUrl + "/oauth/revoke");
        metadata.put("introspection_endpoint", baseUrl + "/oauth/introspect");
        metadata.put("jwks_uri", baseUrl + "/.well-known/jwks.json");
        metadata.put("grant_types_supported", grantTypes);
        metadata.put("token_endpoint_auth_methods_supported", List.of("client_secret_basic", "client_secret_post", "none"));
        metadata.put("code_challenge_methods_supported",
            config.allowPlainPkce() ? List.of("S256", "plain") : List.of("S256"));
        if (!config.availableScopes().isEmpty()) {
            metadata.put("scopes_supported", List.copyOf(config.availableScopes().asSet()));
        }
        return metadata;
    }

    private String getBaseUrl() {
        return uriInfo.getBaseUri().toString().replaceAll("/$", "");
    }
}
