package tech.grantwell.engine.scope;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable set of scope strings.
 *
 * <p>Scopes are case-sensitive and compared with set semantics. Insertion order is
 * kept so the wire form renders the way the scopes were granted.
 */
public final class ScopeSet {

    private static final ScopeSet EMPTY = new ScopeSet(Set.of());

    private final Set<String> scopes;

    private ScopeSet(Set<String> scopes) {
        this.scopes = scopes;
    }

    public static ScopeSet empty() {
        return EMPTY;
    }

    public static ScopeSet of(String... scopes) {
        return of(Arrays.asList(scopes));
    }

    public static ScopeSet of(Collection<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return EMPTY;
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String scope : scopes) {
            if (scope != null && !scope.isBlank()) {
                copy.add(scope.strip());
            }
        }
        return copy.isEmpty() ? EMPTY : new ScopeSet(Collections.unmodifiableSet(copy));
    }

    /**
     * Parse the space-delimited wire form. Null or blank input gives the empty set.
     */
    public static ScopeSet parse(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }
        return of(Arrays.asList(value.strip().split("\\s+")));
    }

    public boolean isEmpty() {
        return scopes.isEmpty();
    }

    public int size() {
        return scopes.size();
    }

    public boolean contains(String scope) {
        return scopes.contains(scope);
    }

    public boolean containsAll(ScopeSet other) {
        return scopes.containsAll(other.scopes);
    }

    public boolean isSubsetOf(ScopeSet other) {
        return other.scopes.containsAll(scopes);
    }

    public ScopeSet intersect(ScopeSet other) {
        Set<String> result = new LinkedHashSet<>(scopes);
        result.retainAll(other.scopes);
        return of(result);
    }

    public ScopeSet union(ScopeSet other) {
        Set<String> result = new LinkedHashSet<>(scopes);
        result.addAll(other.scopes);
        return of(result);
    }

    /**
     * Scopes in this set that are missing from {@code other}.
     */
    public ScopeSet minus(ScopeSet other) {
        Set<String> result = new LinkedHashSet<>(scopes);
        result.removeAll(other.scopes);
        return of(result);
    }

    public Set<String> asSet() {
        return scopes;
    }

    /**
     * Space-delimited wire form, or {@code null} when empty.
     */
    public String toParameter() {
        return scopes.isEmpty() ? null : String.join(" ", scopes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeSet other)) return false;
        return scopes.equals(other.scopes);
    }

    @Override
    public int hashCode() {
        return scopes.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", scopes);
    }
}
