package tech.grantwell.engine.grant;

import lombok.Builder;
import tech.grantwell.engine.client.ClientCredentials;
import tech.grantwell.engine.scope.ScopeSet;

/**
 * Token endpoint request, as decoded from the form body and Authorization header.
 * Fields that do not apply to the grant are {@code null}.
 *
 * @param grantType    raw {@code grant_type} parameter
 * @param credentials  client credentials from the Basic header or the body
 * @param scope        raw space-delimited {@code scope} parameter
 */
@Builder(toBuilder = true)
public record TokenRequest(
    String grantType,
    ClientCredentials credentials,
    String code,
    String redirectUri,
    String codeVerifier,
    String refreshToken,
    String username,
    String password,
    String scope
) {

    public TokenRequest {
        credentials = credentials == null ? ClientCredentials.none() : credentials;
    }

    public ScopeSet requestedScope() {
        return ScopeSet.parse(scope);
    }

    @Override
    public String toString() {
        return "TokenRequest[grantType=" + grantType + ", clientId=" + credentials.clientId() + "]";
    }
}
