package org.pragmatica.ssr.search;

import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.pattern.SyntaxPattern;
import org.pragmatica.ssr.template.SafeTemplate;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.Span;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CombinedSearcherTest {
    private static final String PATH = "A.java";

    private static MatcherSearcher replacing(String pattern, String template) {
        return MatcherSearcher.of(SyntaxPattern.compile(pattern, FragmentKind.EXPRESSION),
                                  Map.of(MatcherSearcher.ROOT_LABEL, SafeTemplate.expression(template)));
    }

    @Test
    void findSubstitutions_collectsFromEverySearcherInOrder() {
        var combined = CombinedSearcher.of(replacing("$x + 0", "$x"), replacing("$s.equals(\"\")", "$s.isEmpty()"));
        var source = "class A { void f() { e = name.equals(\"\"); y = a + 0; } }";

        var rewritten = RewriteDriver.of(combined).rewrite(source, PATH);

        assertThat(rewritten).isEqualTo("class A { void f() { e = name.isEmpty(); y = a; } }");
    }

    @Test
    void findSubstitutions_overlappingMatches_smallerWins() {
        var combined = CombinedSearcher.of(replacing("$x + 0", "$x"), replacing("a", "b"));
        var source = "class A { int f() { return a + 0; } }";
        var unit = combined.parse(source, PATH);

        var found = combined.findSubstitutions(unit);

        assertThat(found).hasSize(1);
        assertThat(found.get(0).primarySpan().extract(source)).isEqualTo("a");
        assertThat(found.get(0).replacements()).containsEntry(MatcherSearcher.ROOT_LABEL, "b");
    }

    @Test
    void fragmentKindAt_delegatesToSearchers() {
        var combined = CombinedSearcher.of(replacing("a", "b"));
        var source = "class A { void f() { foo(); } }";
        var unit = combined.parse(source, PATH);
        int start = source.indexOf("foo();");

        assertThat(combined.fragmentKindAt(unit, Span.of(start, start + 6)))
            .contains(FragmentKind.STATEMENT);
    }

    @Test
    void of_noSearchers_throws() {
        assertThatThrownBy(() -> CombinedSearcher.of()).isInstanceOf(IllegalArgumentException.class);
    }
}
