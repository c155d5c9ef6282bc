package org.pragmatica.ssr.search;

import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.StructuralSearch;
import org.pragmatica.ssr.pattern.SyntaxPattern;
import org.pragmatica.ssr.template.SafeTemplate;
import org.pragmatica.ssr.tree.FragmentKind;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RewriteDriverTest {
    private static final String PATH = "A.java";
    private static final String NESTED = "class A { void f() { int y = a + 0 + 0; } }";

    private static RewriteDriver zeroRemoval(int maxIterations) {
        return StructuralSearch.builder("$x + 0", FragmentKind.EXPRESSION)
                               .replaceWith("$x")
                               .maxIterations(maxIterations)
                               .build();
    }

    private static MatcherSearcher rename(String from, String to, String url) {
        return MatcherSearcher.of(SyntaxPattern.compile(from, FragmentKind.EXPRESSION),
                                  Map.of(MatcherSearcher.ROOT_LABEL, SafeTemplate.expression(to)))
                              .withFinding(new MatcherSearcher.Finding("Rename " + from, url, null, true));
    }

    // === Single Pass Tests ===

    @Test
    void rewrite_singlePass_rewritesOutermostMatchOnly() {
        var driver = zeroRemoval(1);

        assertThat(driver.rewrite(NESTED, PATH)).isEqualTo("class A { void f() { int y = a + 0; } }");
    }

    @Test
    void findAll_singlePass_keepsSubstitutionsAsFound() {
        var found = zeroRemoval(1).findAll(NESTED, PATH);

        assertThat(found).hasSize(1);
        assertThat(found.get(0).primaryLabel()).isEqualTo(MatcherSearcher.ROOT_LABEL);
        assertThat(found.get(0).replacements()).containsEntry(MatcherSearcher.ROOT_LABEL, "a + 0");
    }

    // === Fixed Point Tests ===

    @Test
    void findAll_withIterations_composesOneSubstitutionForTheStatement() {
        var found = zeroRemoval(10).findAll(NESTED, PATH);

        assertThat(found).hasSize(1);
        var composed = found.get(0);
        assertThat(composed.primaryLabel()).isEqualTo(SubstitutionComposer.LABEL);
        assertThat(composed.primarySpan().extract(NESTED)).isEqualTo("int y = a + 0 + 0;");
        assertThat(composed.replacements()).containsEntry(SubstitutionComposer.LABEL, "int y = a;");
        assertThat(composed.category()).contains(SubstitutionComposer.SIGNIFICANT_CATEGORY);
        assertThat(composed.significant()).isTrue();
    }

    @Test
    void rewrite_withIterations_reachesFixedPoint() {
        assertThat(zeroRemoval(10).rewrite(NESTED, PATH)).isEqualTo("class A { void f() { int y = a; } }");
    }

    @Test
    void rewrite_withIterations_isIdempotent() {
        var driver = zeroRemoval(10);
        var once = driver.rewrite(NESTED, PATH);

        assertThat(driver.findAll(once, PATH)).isEmpty();
        assertThat(driver.rewrite(once, PATH)).isEqualTo(once);
    }

    @Test
    void rewrite_iterationBudget_limitsRewrites() {
        var source = "class A { void f() { int y = a + 0 + 0 + 0; } }";

        assertThat(zeroRemoval(2).rewrite(source, PATH)).isEqualTo("class A { void f() { int y = a + 0; } }");
    }

    @Test
    void findAll_rewriteWithoutEffect_stopsIterating() {
        var driver = StructuralSearch.builder("foo($a)", FragmentKind.EXPRESSION)
                                     .replaceWith("foo($a)")
                                     .maxIterations(5)
                                     .build();

        var found = driver.findAll("class A { void f() { foo(1); } }", PATH);

        assertThat(found).hasSize(1);
        assertThat(found.get(0).primaryLabel()).isEqualTo(MatcherSearcher.ROOT_LABEL);
    }

    @Test
    void findAll_separateStatements_areIteratedSeparately() {
        var source = "class A { void f() { int y = a + 0 + 0; int z = b + 0; } }";

        var rewritten = zeroRemoval(10).rewrite(source, PATH);

        assertThat(rewritten).isEqualTo("class A { void f() { int y = a; int z = b; } }");
    }

    @Test
    void findAll_chainedRules_composeOneSubstitutionWithBothFindings() {
        var rules = CombinedSearcher.of(rename("a", "b", "https://example.org/a"),
                                        rename("b", "c", "https://example.org/b"));
        var driver = RewriteDriver.of(rules, RewriteConfig.DEFAULT.withMaxIterations(2));
        var source = "class A { int f() { return a; } }";

        var found = driver.findAll(source, PATH);

        assertThat(found).hasSize(1);
        var composed = found.get(0);
        assertThat(composed.primaryLabel()).isEqualTo(SubstitutionComposer.LABEL);
        assertThat(composed.primarySpan().extract(source)).isEqualTo("return a;");
        assertThat(composed.replacements()).containsEntry(SubstitutionComposer.LABEL, "return c;");
        assertThat(composed.category()).contains(SubstitutionComposer.SIGNIFICANT_CATEGORY);
        assertThat(composed.url()).contains(RewriteConfig.MERGED_URL);
        assertThat(composed.message()).contains(SubstitutionComposer.HEADER
                                                + "Rename a\n(https://example.org/a)\n\n"
                                                + "Rename b\n(https://example.org/b)");
        assertThat(driver.rewrite(source, PATH)).isEqualTo("class A { int f() { return c; } }");
    }

    // === State Tests ===

    @Test
    void state_movesFromIdleToDone() {
        var driver = zeroRemoval(10);
        assertThat(driver.state()).isEqualTo(RewriteDriver.State.IDLE);

        driver.findAll(NESTED, PATH);

        assertThat(driver.state()).isEqualTo(RewriteDriver.State.DONE);
    }
}
