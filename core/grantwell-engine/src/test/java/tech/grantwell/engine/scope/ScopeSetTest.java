package tech.grantwell.engine.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ScopeSetTest {

    @Test
    @DisplayName("parse should split on whitespace and drop duplicates")
    void parse_shouldSplitOnWhitespace_whenSeveralScopesGiven() {
        ScopeSet scopes = ScopeSet.parse("  read   write read ");

        assertThat(scopes.asSet()).containsExactly("read", "write");
        assertThat(scopes.toParameter()).isEqualTo("read write");
    }

    @Test
    @DisplayName("parse should return empty set for null or blank input")
    void parse_shouldReturnEmpty_whenNullOrBlank() {
        assertThat(ScopeSet.parse(null).isEmpty()).isTrue();
        assertThat(ScopeSet.parse("   ").isEmpty()).isTrue();
        assertThat(ScopeSet.empty().toParameter()).isNull();
    }

    @Test
    @DisplayName("scopes should be case-sensitive")
    void contains_shouldBeCaseSensitive() {
        ScopeSet scopes = ScopeSet.of("Read");

        assertThat(scopes.contains("Read")).isTrue();
        assertThat(scopes.contains("read")).isFalse();
    }

    @Test
    @DisplayName("equality should ignore order")
    void equals_shouldIgnoreOrder() {
        assertThat(ScopeSet.parse("a b c")).isEqualTo(ScopeSet.parse("c a b"));
        assertThat(ScopeSet.parse("a b").hashCode()).isEqualTo(ScopeSet.parse("b a").hashCode());
    }

    @Test
    @DisplayName("set operations should follow set semantics")
    void setOperations_shouldFollowSetSemantics() {
        ScopeSet readWrite = ScopeSet.of("read", "write");
        ScopeSet read = ScopeSet.of("read");

        assertThat(read.isSubsetOf(readWrite)).isTrue();
        assertThat(readWrite.isSubsetOf(read)).isFalse();
        assertThat(ScopeSet.empty().isSubsetOf(read)).isTrue();
        assertThat(readWrite.intersect(ScopeSet.of("write", "admin"))).isEqualTo(ScopeSet.of("write"));
        assertThat(read.union(ScopeSet.of("admin"))).isEqualTo(ScopeSet.of("read", "admin"));
        assertThat(readWrite.minus(read)).isEqualTo(ScopeSet.of("write"));
    }
}
