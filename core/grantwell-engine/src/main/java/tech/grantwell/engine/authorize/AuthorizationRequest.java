package tech.grantwell.engine.authorize;

import lombok.Builder;

/**
 * Authorization endpoint request (RFC 6749 Section 4.1.1 and 4.2.1), received after
 * the resource owner has logged in and approved it.
 */
@Builder(toBuilder = true)
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String scope,
    String state,
    String codeChallenge,
    String codeChallengeMethod,
    String nonce
) {
}
