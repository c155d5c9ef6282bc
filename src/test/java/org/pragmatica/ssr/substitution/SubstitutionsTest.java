package org.pragmatica.ssr.substitution;

import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.substitution.DiffPart.DiffSpan;
import org.pragmatica.ssr.substitution.DiffPart.LabeledSpan;
import org.pragmatica.ssr.tree.Span;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubstitutionsTest {

    private static Substitution replacing(int start, int end, String text) {
        return Substitution.builder()
                           .span("root", Span.of(start, end))
                           .primaryLabel("root")
                           .replacement("root", text)
                           .build();
    }

    private static Substitution finding(int start, int end) {
        return Substitution.builder()
                           .span("root", Span.of(start, end))
                           .primaryLabel("root")
                           .build();
    }

    // === Labeled Spans Tests ===

    @Test
    void labeledSpans_nestedLabels_partitionWithoutGaps() {
        var substitution = Substitution.builder()
                                       .span("outer", Span.of(0, 10))
                                       .span("inner", Span.of(3, 5))
                                       .primaryLabel("outer")
                                       .build();

        var spans = Substitutions.labeledSpans(substitution);

        assertThat(spans).containsExactly(new LabeledSpan(Span.of(0, 3), Set.of("outer")),
                                          new LabeledSpan(Span.of(3, 5), Set.of("outer", "inner")),
                                          new LabeledSpan(Span.of(5, 10), Set.of("outer")));
    }

    @Test
    void labeledSpans_adjacentLabels_splitAtBoundary() {
        var substitution = Substitution.builder()
                                       .span("a", Span.of(0, 2))
                                       .span("b", Span.of(2, 4))
                                       .primaryLabel("a")
                                       .build();

        var spans = Substitutions.labeledSpans(substitution);

        assertThat(spans).containsExactly(new LabeledSpan(Span.of(0, 2), Set.of("a")),
                                          new LabeledSpan(Span.of(2, 2), Set.of("a", "b")),
                                          new LabeledSpan(Span.of(2, 4), Set.of("b")));
    }

    @Test
    void labeledSpans_zeroWidthLabel_producesZeroWidthSpan() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(0, 4))
                                       .span("point", Span.of(2, 2))
                                       .primaryLabel("root")
                                       .build();

        var spans = Substitutions.labeledSpans(substitution);

        assertThat(spans).contains(new LabeledSpan(Span.of(2, 2), Set.of("root", "point")));
        assertThat(spans.get(0).span().start()).isZero();
        assertThat(spans.get(spans.size() - 1).span().end()).isEqualTo(4);
        for (int i = 1; i < spans.size(); i++) {
            assertThat(spans.get(i).span().start()).isEqualTo(spans.get(i - 1).span().end());
        }
    }

    // === Diff Tests ===

    @Test
    void asDiff_replacedInnerLabel_keepsSurroundingText() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(0, 10))
                                       .span("x", Span.of(3, 5))
                                       .primaryLabel("root")
                                       .replacement("x", "yy")
                                       .build();

        var diff = Substitutions.asDiff(substitution);

        assertThat(diff).containsExactly(new LabeledSpan(Span.of(0, 3), Set.of("root")),
                                         new DiffSpan(Span.of(3, 5), "x", "yy"),
                                         new LabeledSpan(Span.of(5, 10), Set.of("root")));
    }

    @Test
    void asDiff_replacedOuterLabel_swallowsInnerSpans() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(0, 10))
                                       .span("x", Span.of(3, 5))
                                       .primaryLabel("root")
                                       .replacement("root", "new")
                                       .build();

        assertThat(Substitutions.asDiff(substitution)).containsExactly(new DiffSpan(Span.of(0, 10), "root", "new"));
    }

    // === Disjoint Tests ===

    @Test
    void disjoint_overlappingSpans_keepsSmaller() {
        var large = finding(0, 10);
        var small = finding(2, 4);

        assertThat(Substitutions.disjoint(List.of(large, small))).containsExactly(small);
    }

    @Test
    void disjoint_separateSpans_keepsAllInOrder() {
        var first = finding(0, 2);
        var second = finding(5, 7);
        var third = finding(2, 5);

        assertThat(Substitutions.disjoint(List.of(second, first, third))).containsExactly(first, third, second);
    }

    @Test
    void disjoint_laterLongerOverlap_isDropped() {
        var first = finding(0, 3);
        var longer = finding(2, 9);

        assertThat(Substitutions.disjoint(List.of(first, longer))).containsExactly(first);
    }

    @Test
    void disjoint_equalSpans_keepsTheLater() {
        var earlier = replacing(0, 4, "one");
        var later = replacing(0, 4, "two");

        assertThat(Substitutions.disjoint(List.of(earlier, later))).containsExactly(later);
    }

    // === Apply Tests ===

    @Test
    void apply_noSubstitutions_returnsTextUnchanged() {
        assertThat(Substitutions.apply("int x = 1;", List.of())).isEqualTo("int x = 1;");
    }

    @Test
    void apply_substitutionsWithoutReplacements_returnTextUnchanged() {
        assertThat(Substitutions.apply("abcdef", List.of(finding(1, 3), finding(4, 5)))).isEqualTo("abcdef");
    }

    @Test
    void apply_severalSubstitutions_replacesEachSpan() {
        var text = "a + b + c";

        var rewritten = Substitutions.apply(text, List.of(replacing(8, 9, "z"), replacing(0, 1, "x")));

        assertThat(rewritten).isEqualTo("x + b + z");
    }

    @Test
    void apply_severalLabelsOfOneSubstitution_replacesEachLabel() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(0, 5))
                                       .span("left", Span.of(0, 1))
                                       .span("right", Span.of(4, 5))
                                       .primaryLabel("root")
                                       .replacement("left", "b")
                                       .replacement("right", "a")
                                       .build();

        assertThat(Substitutions.apply("a + b", List.of(substitution))).isEqualTo("b + a");
    }

    @Test
    void apply_overlappingReplacements_throws() {
        assertThatThrownBy(() -> Substitutions.apply("abcdef", List.of(replacing(0, 3, "x"), replacing(2, 4, "y"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("overlap");
    }

    // === Line Expansion Tests ===

    @Test
    void lineExpandedSpan_middleOfLine_coversWholeLine() {
        var text = "first\nsecond line\nthird";

        var span = Substitutions.lineExpandedSpan(text, 8, 10);

        assertThat(span.extract(text)).isEqualTo("second line");
    }

    @Test
    void lineExpandedSpan_negativeOffsets_countFromEnd() {
        var text = "first\nlast";

        var span = Substitutions.lineExpandedSpan(text, -2, -1);

        assertThat(span.extract(text)).isEqualTo("last");
    }
}
