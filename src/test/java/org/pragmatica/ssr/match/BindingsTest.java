package org.pragmatica.ssr.match;

import com.github.javaparser.ast.expr.NameExpr;
import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.error.MatchException;
import org.pragmatica.ssr.error.PolicyMismatchException;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BindingsTest {

    private final ParsedUnit unit = JavaGrammar.parse("a + a * b", FragmentKind.EXPRESSION);
    private final List<NameExpr> names = unit.root().findAll(NameExpr.class);

    private BoundValue bound(int index, BindConflict conflict, BindMerge merge) {
        return BoundValue.of(Fragment.of(unit, names.get(index)), conflict, merge);
    }

    // === Disjoint Names Tests ===

    @Test
    void merge_disjointNames_keepsBoth() {
        var merged = Bindings.merge(Map.of("x", bound(0, BindConflict.SKIP, BindMerge.KEEP_FIRST)),
                                    Map.of("y", bound(2, BindConflict.SKIP, BindMerge.KEEP_FIRST)));

        assertThat(merged).hasValueSatisfying(bindings -> assertThat(bindings).containsOnlyKeys("x", "y"));
    }

    // === Conflict Policy Tests ===

    @Test
    void merge_mergePolicy_keepsLastValue() {
        var first = bound(0, BindConflict.MERGE, BindMerge.KEEP_LAST);
        var last = bound(2, BindConflict.MERGE, BindMerge.KEEP_LAST);

        var merged = Bindings.merge(Map.of("x", first), Map.of("x", last));

        assertThat(merged).hasValueSatisfying(bindings -> assertThat(bindings.get("x")).isSameAs(last));
    }

    @Test
    void merge_keepFirst_keepsFirstValue() {
        var first = bound(0, BindConflict.MERGE, BindMerge.KEEP_FIRST);
        var last = bound(2, BindConflict.MERGE, BindMerge.KEEP_FIRST);

        var merged = Bindings.merge(Map.of("x", first), Map.of("x", last));

        assertThat(merged).hasValueSatisfying(bindings -> assertThat(bindings.get("x")).isSameAs(first));
    }

    @Test
    void merge_skipPolicy_fails() {
        var merged = Bindings.merge(Map.of("x", bound(0, BindConflict.SKIP, BindMerge.KEEP_LAST)),
                                    Map.of("x", bound(1, BindConflict.SKIP, BindMerge.KEEP_LAST)));

        assertThat(merged).isEmpty();
    }

    @Test
    void merge_errorPolicy_throws() {
        assertThatThrownBy(() -> Bindings.merge(Map.of("x", bound(0, BindConflict.ERROR, BindMerge.KEEP_LAST)),
                                                Map.of("x", bound(1, BindConflict.ERROR, BindMerge.KEEP_LAST))))
            .isInstanceOf(MatchException.class)
            .hasMessageContaining("'x'");
    }

    @Test
    void merge_equivalentAst_mergesEqualNamesOnly() {
        var firstA = bound(0, BindConflict.MERGE_EQUIVALENT_AST, BindMerge.KEEP_LAST);
        var secondA = bound(1, BindConflict.MERGE_EQUIVALENT_AST, BindMerge.KEEP_LAST);
        var b = bound(2, BindConflict.MERGE_EQUIVALENT_AST, BindMerge.KEEP_LAST);

        assertThat(Bindings.merge(Map.of("x", firstA), Map.of("x", secondA))).isPresent();
        assertThat(Bindings.merge(Map.of("x", firstA), Map.of("x", b))).isEmpty();
    }

    @Test
    void merge_identical_requiresSameNode() {
        var firstA = bound(0, BindConflict.MERGE_IDENTICAL, BindMerge.KEEP_LAST);
        var sameA = bound(0, BindConflict.MERGE_IDENTICAL, BindMerge.KEEP_LAST);
        var secondA = bound(1, BindConflict.MERGE_IDENTICAL, BindMerge.KEEP_LAST);

        assertThat(Bindings.merge(Map.of("x", firstA), Map.of("x", sameA))).isPresent();
        assertThat(Bindings.merge(Map.of("x", firstA), Map.of("x", secondA))).isEmpty();
    }

    @Test
    void merge_differentPolicies_throwsPolicyMismatch() {
        assertThatThrownBy(() -> Bindings.merge(Map.of("x", bound(0, BindConflict.MERGE, BindMerge.KEEP_LAST)),
                                                Map.of("x", bound(0, BindConflict.SKIP, BindMerge.KEEP_LAST))))
            .isInstanceOf(PolicyMismatchException.class);
    }

    // === Run-once State Tests ===

    @Test
    void commit_publishesKeysToLaterAttempts() {
        var session = FileSession.of(unit);
        var failed = session.fork();
        failed.markSucceeded("key");
        assertThat(failed.hasSucceeded("key")).isTrue();
        assertThat(session.fork().hasSucceeded("key")).isFalse();

        var matched = session.fork();
        matched.markSucceeded("key");
        matched.commit();

        assertThat(session.fork().hasSucceeded("key")).isTrue();
    }

    @Test
    void memoize_sameKey_computesOnce() {
        var context = MatchContext.of(unit);
        var calls = new int[1];

        context.memoize(Integer.class, "fact", () -> ++calls[0]);
        var value = context.memoize(Integer.class, "fact", () -> ++calls[0]);

        assertThat(value).isEqualTo(1);
        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    void memoize_sameIdOfAnotherType_computesSeparately() {
        var context = MatchContext.of(unit);

        Integer number = context.memoize(Integer.class, "fact", () -> 7);
        String text = context.memoize(String.class, "fact", () -> "seven");

        assertThat(number).isEqualTo(7);
        assertThat(text).isEqualTo("seven");
        assertThat(context.memoize(String.class, () -> "by type")).isEqualTo("by type");
    }
}
