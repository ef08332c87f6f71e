package tech.grantwell.engine.introspection;

import tech.grantwell.engine.scope.EndpointScopeRequirements;
import tech.grantwell.engine.scope.ScopeSet;

import java.util.Optional;

/**
 * Checks a presented bearer token against the scopes a protected endpoint requires.
 * Answers the question only; enforcing the answer is up to the resource server.
 */
public class BearerTokenValidator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenIntrospectionService introspectionService;
    private final EndpointScopeRequirements requirements;

    public BearerTokenValidator(TokenIntrospectionService introspectionService, EndpointScopeRequirements requirements) {
        this.introspectionService = introspectionService;
        this.requirements = requirements;
    }

    /**
     * @return the token's details if it is an active access token whose scope meets
     *         the endpoint's registered requirement
     */
    public Optional<IntrospectionResponse> validate(String token, String endpoint) {
        return introspectionService.introspectAccessToken(token)
            .filter(response -> requirements.isSatisfiedBy(endpoint, ScopeSet.parse(response.scope())));
    }

    /**
     * Validate against an explicit scope requirement.
     */
    public Optional<IntrospectionResponse> validate(String token, ScopeSet requiredScope) {
        return introspectionService.introspectAccessToken(token)
            .filter(response -> requiredScope.isSubsetOf(ScopeSet.parse(response.scope())));
    }

    /**
     * Validate the value of an {@code Authorization: Bearer ...} header.
     */
    public Optional<IntrospectionResponse> validateHeader(String authorizationHeader, String endpoint) {
        if (authorizationHeader == null
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        return validate(authorizationHeader.substring(BEARER_PREFIX.length()).strip(), endpoint);
    }
}
