package org.pragmatica.ssr.template;

import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.Span;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRewriterTest {

    @Test
    void rewriteTemplates_rendersEachSpannedLabel() {
        var unit = JavaGrammar.parse("a = b;", FragmentKind.STATEMENT);
        var bindings = Map.<String, Fragment>of("target", Fragment.spanned(unit.text(), Span.of(0, 1)),
                                                "source", Fragment.spanned(unit.text(), Span.of(4, 5)));

        var rendered = TemplateRewriter.rewriteTemplates(unit, bindings,
                                                         Map.of("target", NaiveTemplate.of("$source")));

        assertThat(rendered).containsExactly(Map.entry("target", "b"));
    }

    @Test
    void rewriteTemplates_skipsUnspannedAndUnboundLabels() {
        var unit = JavaGrammar.parse("a = b;", FragmentKind.STATEMENT);
        var bindings = Map.<String, Fragment>of("text", new Fragment.Text("b"));

        var rendered = TemplateRewriter.rewriteTemplates(unit, bindings,
                                                         Map.of("text", new LiteralTemplate("c"),
                                                                "absent", new LiteralTemplate("d")));

        assertThat(rendered).isEmpty();
    }

    @Test
    void rewriteTemplates_unboundReservedLabel_rendersFromEmptyFragment() {
        var unit = JavaGrammar.parse("a = b;", FragmentKind.STATEMENT);

        var rendered = TemplateRewriter.rewriteTemplates(unit, Map.of(),
                                                         Map.of("__insert", new LiteralTemplate("c")));

        assertThat(rendered).containsEntry("__insert", "c");
    }

    @Test
    void templateVariables_includesLabelsAndReferencedVariables() {
        var variables = TemplateRewriter.templateVariables(Map.of("target", NaiveTemplate.of("$source + ${other}")));

        assertThat(variables).containsExactlyInAnyOrder("target", "source", "other");
    }
}
