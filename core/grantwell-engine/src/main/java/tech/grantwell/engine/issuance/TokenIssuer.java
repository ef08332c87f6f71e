package tech.grantwell.engine.issuance;

import org.jboss.logging.Logger;
import tech.grantwell.engine.EngineConfig;
import tech.grantwell.engine.client.ClientAuthenticator;
import tech.grantwell.engine.client.OAuthClient;
import tech.grantwell.engine.error.OAuthException;
import tech.grantwell.engine.error.OAuthResult;
import tech.grantwell.engine.error.StoreException;
import tech.grantwell.engine.grant.AuthorizationCodeGrant;
import tech.grantwell.engine.grant.ClientCredentialsGrant;
import tech.grantwell.engine.grant.GrantOutcome;
import tech.grantwell.engine.grant.GrantType;
import tech.grantwell.engine.grant.PasswordGrant;
import tech.grantwell.engine.grant.RefreshTokenGrant;
import tech.grantwell.engine.grant.TokenRequest;
import tech.grantwell.engine.scope.ScopePolicy;
import tech.grantwell.engine.scope.ScopeSet;

/**
 * Token endpoint orchestration.
 *
 * <p>Each request runs the same sequence:
 * <ol>
 *   <li>authenticate the client</li>
 *   <li>select the grant type</li>
 *   <li>validate the grant</li>
 *   <li>resolve the scope</li>
 *   <li>mint tokens</li>
 *   <li>persist them in one transaction</li>
 *   <li>build the response</li>
 * </ol>
 * Steps 1 to 5 have no side effects. Nothing is thrown to the caller: protocol errors
 * and storage failures both come back as {@link OAuthResult.Failure}.
 */
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    private final EngineConfig config;
    private final ClientAuthenticator clientAuthenticator;
    private final ScopePolicy scopePolicy;
    private final AuthorizationCodeGrant authorizationCodeGrant;
    private final ClientCredentialsGrant clientCredentialsGrant;
    private final RefreshTokenGrant refreshTokenGrant;
    private final PasswordGrant passwordGrant;
    private final TokenMinter tokenMinter;
    private final TokenWriter tokenWriter;

    public TokenIssuer(EngineConfig config,
                       ClientAuthenticator clientAuthenticator,
                       ScopePolicy scopePolicy,
                       AuthorizationCodeGrant authorizationCodeGrant,
                       ClientCredentialsGrant clientCredentialsGrant,
                       RefreshTokenGrant refreshTokenGrant,
                       PasswordGrant passwordGrant,
                       TokenMinter tokenMinter,
                       TokenWriter tokenWriter) {
        this.config = config;
        this.clientAuthenticator = clientAuthenticator;
        this.scopePolicy = scopePolicy;
        this.authorizationCodeGrant = authorizationCodeGrant;
        this.clientCredentialsGrant = clientCredentialsGrant;
        this.refreshTokenGrant = refreshTokenGrant;
        this.passwordGrant = passwordGrant;
        this.tokenMinter = tokenMinter;
        this.tokenWriter = tokenWriter;
    }

    public OAuthResult<TokenResponse> issue(TokenRequest request) {
        try {
            OAuthClient client = clientAuthenticator.authenticate(request.credentials());
            GrantType grantType = selectGrantType(request, client);

            GrantOutcome outcome = switch (grantType) {
                case AUTHORIZATION_CODE -> authorizationCodeGrant.validate(request, client);
                case CLIENT_CREDENTIALS -> clientCredentialsGrant.validate(request, client);
                case REFRESH_TOKEN -> refreshTokenGrant.validate(request, client);
                case PASSWORD -> passwordGrant.validate(request, client);
                case IMPLICIT -> throw OAuthException.unsupportedGrantType(
                    "Implicit tokens are issued by the authorization endpoint");
            };

            ScopeSet scope = scopePolicy.resolve(outcome.requestedScope(), outcome.scopeCeiling(), outcome.defaultScope());
            IssuedTokens tokens = tokenMinter.mint(client, outcome, scope);
            tokenWriter.persist(outcome, tokens);

            LOG.infof("Tokens issued for client %s via %s grant", client.clientId(), grantType.parameter());
            return OAuthResult.success(tokens.toResponse());
        } catch (OAuthException e) {
            LOG.debugf("Token request rejected (%s): %s", e.errorCode().code(), e.getMessage());
            return OAuthResult.failure(e.toError());
        } catch (StoreException e) {
            LOG.errorf(e, "Storage failure while handling %s", request);
            return OAuthResult.serverError();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure while handling %s", request);
            return OAuthResult.serverError();
        }
    }

    private GrantType selectGrantType(TokenRequest request, OAuthClient client) {
        String raw = request.grantType();
        if (raw == null || raw.isEmpty()) {
            throw OAuthException.invalidRequest("grant_type is required");
        }

        GrantType grantType = GrantType.fromParameter(raw)
            .filter(type -> type != GrantType.IMPLICIT)
            .filter(config::isGrantEnabled)
            .filter(type -> type != GrantType.PASSWORD || passwordGrant.isAvailable())
            .orElseThrow(() -> OAuthException.unsupportedGrantType("Grant type not supported: " + raw));

        if (!client.isGrantTypeAllowed(grantType)) {
            LOG.warnf("%s grant not allowed for OAuth client: %s", grantType.parameter(), client.clientId());
            throw OAuthException.unauthorizedClient(grantType.parameter() + " grant not allowed for this client");
        }
        return grantType;
    }
}
