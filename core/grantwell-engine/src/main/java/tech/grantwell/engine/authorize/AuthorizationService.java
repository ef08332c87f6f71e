package tech.grantwell.engine.authorize;

import org.jboss.logging.Logger;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.ClientRegistry;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthError;
import tech.grantwell.engine.error.OAuthErrorCode;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.error.OAuthResult;
import tech.grantwell.engine.error.StoreException;
import tech.grantwell.engine.grant.GrantOutcome;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.grant.ImplicitGrant;
import tech.grantwell.engine.grant.PkceMethod;
import tech.grantwell.engine.grant.PkceVerifier;
import tech.grantwell.engine.issuance.IssuedTokens;
import tech.grantwell.engine.issuance.TokenMinter;
import tech.grantwell.engine.issuance.TokenResponse;
import tech.grantwell.engine.issuance.TokenWriter;
import tech.grantwell.engine.scope.ScopePolicy;
import tech.grantwell.engine.scope.ScopeSet;
import tech.grantwell.engine.store.AuthorizationGrant;
import tech.grantwell.engine.store.TokenStore;
import tech.grantwell.engine.token.TokenGenerator;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The authorization step, run once the resource owner has authenticated and approved
 * the request.
 *
 * <p>{@code response_type=code} records an {@link AuthorizationGrant} and redirects
 * with the code in the query. {@code response_type=token} runs the implicit grant and
 * redirects with the access token in the fragment.
 *
 * <p>Until the client and redirect URI are validated, errors are returned as a
 * {@link OAuthResult.Failure} and must be shown to the user, never redirected. After
 * that, errors travel back to the client in the redirect.
 */
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    private final EngineConfig config;
    private final ClientRegistry clientRegistry;
    private final TokenStore tokenStore;
    private final ScopePolicy scopePolicy;
    private final PkceVerifier pkceVerifier;
    private final ImplicitGrant implicitGrant;
    private final TokenMinter tokenMinter;
    private final TokenWriter tokenWriter;
    private final Clock clock;

    public AuthorizationService(EngineConfig config,
                                ClientRegistry clientRegistry,
                                TokenStore tokenStore,
                                ScopePolicy scopePolicy,
                                PkceVerifier pkceVerifier,
                                ImplicitGrant implicitGrant,
                                TokenMinter tokenMinter,
                                TokenWriter tokenWriter,
                                Clock clock) {
        this.config = config;
        this.clientRegistry = clientRegistry;
        this.tokenStore = tokenStore;
        this.scopePolicy = scopePolicy;
        this.pkceVerifier = pkceVerifier;
        this.implicitGrant = implicitGrant;
        this.tokenMinter = tokenMinter;
        this.tokenWriter = tokenWriter;
        this.clock = clock;
    }

    /**
     * @param request       the approved authorization request
     * @param resourceOwner id of the authenticated resource owner
     */
    public OAuthResult<AuthorizationRedirect> authorize(AuthorizationRequest request, String resourceOwner) {
        OAuthClient client;
        String redirectUri;
        try {
            client = clientRegistry.findByClientId(request.clientId())
                .filter(c -> !c.disabled())
                .orElse(null);
            if (client == null) {
                LOG.warnf("Authorization request for unknown client: %s", request.clientId());
                return OAuthResult.failure(OAuthError.of(OAuthErrorCode.INVALID_REQUEST, "Unknown client_id"));
            }
            redirectUri = request.redirectUri() != null ? request.redirectUri() : client.defaultRedirectUri();
            if (redirectUri == null || !client.isRedirectUriAllowed(redirectUri)) {
                LOG.warnf("Invalid redirect_uri for client %s", client.clientId());
                return OAuthResult.failure(OAuthError.of(OAuthErrorCode.INVALID_REQUEST,
                    "redirect_uri is not registered for this client"));
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failure while resolving client %s", request.clientId());
            return OAuthResult.serverError();
        }

        boolean fragment = ResponseType.TOKEN.parameter().equals(request.responseType());
        try {
            if (resourceOwner == null) {
                throw OAuthException.invalidRequest("An authenticated resource owner is required");
            }
            ResponseType responseType = ResponseType.fromParameter(request.responseType())
                .orElseThrow(() -> OAuthException.unsupportedResponseType(
                    "Unsupported response_type: " + request.responseType()));

            Map<String, String> params = switch (responseType) {
                case CODE -> issueCode(request, client, redirectUri, resourceOwner);
                case TOKEN -> issueImplicitToken(request, client, resourceOwner);
            };
            if (request.state() != null) {
                params.put("state", request.state());
            }
            return OAuthResult.success(AuthorizationRedirect.success(buildRedirect(redirectUri, params, fragment)));
        } catch (OAuthException e) {
            LOG.debugf("Authorization request rejected (%s): %s", e.errorCode().code(), e.getMessage());
            return OAuthResult.success(errorRedirect(redirectUri, e.toError(), request.state(), fragment));
        } catch (StoreException e) {
            LOG.errorf(e, "Storage failure during authorization for client %s", client.clientId());
            return OAuthResult.success(errorRedirect(redirectUri, serverError(), request.state(), fragment));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure during authorization for client %s", client.clientId());
            return OAuthResult.success(errorRedirect(redirectUri, serverError(), request.state(), fragment));
        }
    }

    private Map<String, String> issueCode(AuthorizationRequest request, OAuthClient client,
                                          String redirectUri, String resourceOwner) {
        if (!config.isGrantEnabled(GrantType.AUTHORIZATION_CODE)) {
            throw OAuthException.unsupportedResponseType("response_type code is not enabled");
        }
        if (!client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE)) {
            throw OAuthException.unauthorizedClient("authorization_code grant not allowed for this client");
        }

        ScopeSet scope = scopePolicy.resolve(
            ScopeSet.parse(request.scope()), scopePolicy.ceilingFor(client), scopePolicy.defaultFor(client));

        PkceMethod challengeMethod = null;
        if (request.codeChallenge() != null) {
            challengeMethod = PkceMethod.fromParameter(request.codeChallengeMethod())
                .orElseThrow(() -> OAuthException.invalidRequest("Unsupported code_challenge_method"));
            if (challengeMethod == PkceMethod.PLAIN && !config.allowPlainPkce()) {
                throw OAuthException.invalidRequest("code_challenge_method plain is not allowed");
            }
            if (!pkceVerifier.isValidCodeChallenge(request.codeChallenge())) {
                throw OAuthException.invalidRequest("Invalid code_challenge format");
            }
        } else if (config.isPkceRequiredFor(client)) {
            throw OAuthException.invalidRequest("code_challenge required");
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        AuthorizationGrant grant = AuthorizationGrant.builder()
            .code(TokenGenerator.randomToken())
            .clientId(client.clientId())
            .resourceOwner(resourceOwner)
            .scope(scope)
            .redirectUri(redirectUri)
            .codeChallenge(request.codeChallenge())
            .codeChallengeMethod(challengeMethod)
            .nonce(request.nonce())
            .issuedAt(now)
            .expiresAt(now.plus(config.authorizationCodeLifetime()))
            .build();
        tokenStore.saveGrant(grant);

        LOG.infof("Authorization code issued to client %s", client.clientId());
        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", grant.code());
        return params;
    }

    private Map<String, String> issueImplicitToken(AuthorizationRequest request, OAuthClient client, String resourceOwner) {
        GrantOutcome outcome = implicitGrant.validate(client, resourceOwner, ScopeSet.parse(request.scope()), request.nonce());
        ScopeSet scope = scopePolicy.resolve(outcome.requestedScope(), outcome.scopeCeiling(), outcome.defaultScope());
        IssuedTokens tokens = tokenMinter.mint(client, outcome, scope);
        tokenWriter.persist(outcome, tokens);

        LOG.infof("Tokens issued for client %s via implicit grant", client.clientId());
        TokenResponse response = tokens.toResponse();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("access_token", response.accessToken());
        params.put("token_type", response.tokenType());
        params.put("expires_in", String.valueOf(response.expiresIn()));
        if (response.scope() != null) {
            params.put("scope", response.scope());
        }
        if (response.idToken() != null) {
            params.put("id_token", response.idToken());
        }
        return params;
    }

    private AuthorizationRedirect errorRedirect(String redirectUri, OAuthError error, String state, boolean fragment) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("error", error.error());
        params.put("error_description", error.description());
        if (state != null) {
            params.put("state", state);
        }
        return AuthorizationRedirect.error(buildRedirect(redirectUri, params, fragment), error);
    }

    private static OAuthError serverError() {
        return OAuthError.of(OAuthErrorCode.SERVER_ERROR, "The authorization server encountered an unexpected condition");
    }

    private static String buildRedirect(String redirectUri, Map<String, String> params, boolean fragment) {
        StringBuilder url = new StringBuilder(redirectUri);
        if (fragment) {
            url.append('#');
        } else {
            url.append(redirectUri.contains("?") ? '&' : '?');
        }
        boolean first = true;
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (!first) {
                url.append('&');
            }
            url.append(urlEncode(param.getKey())).append('=').append(urlEncode(param.getValue()));
            first = false;
        }
        return url.toString();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
