package tech.grantwell.engine.scope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scopes each protected endpoint requires of a bearer token.
 *
 * <p>Endpoints without a registered requirement are denied. Use
 * {@link Builder#open(String)} to register an endpoint that any active token may call.
 */
public final class EndpointScopeRequirements {

    private final Map<String, ScopeSet> requirements;

    private EndpointScopeRequirements(Map<String, ScopeSet> requirements) {
        this.requirements = Map.copyOf(requirements);
    }

    public static EndpointScopeRequirements none() {
        return new EndpointScopeRequirements(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ScopeSet> requiredFor(String endpoint) {
        return Optional.ofNullable(requirements.get(endpoint));
    }

    public boolean isSatisfiedBy(String endpoint, ScopeSet granted) {
        return requiredFor(endpoint)
            .map(required -> required.isSubsetOf(granted))
            .orElse(false);
    }

    public static final class Builder {
        private final Map<String, ScopeSet> requirements = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder require(String endpoint, String... scopes) {
            requirements.put(endpoint, ScopeSet.of(scopes));
            return this;
        }

        public Builder open(String endpoint) {
            requirements.put(endpoint, ScopeSet.empty());
            return this;
        }

        public EndpointScopeRequirements build() {
            return new EndpointScopeRequirements(requirements);
        }
    }
}
