package org.pragmatica.ssr.substitution;

import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.tree.Span;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubstitutionTest {

    @Test
    void build_primaryLabelWithoutSpan_throws() {
        var builder = Substitution.builder()
                                  .span("x", Span.of(0, 1))
                                  .primaryLabel("root");

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class)
                                          .hasMessageContaining("primary label");
    }

    @Test
    void build_replacementForUnknownLabel_throws() {
        var builder = Substitution.builder()
                                  .span("root", Span.of(0, 1))
                                  .primaryLabel("root")
                                  .replacement("other", "text");

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_categoryWithLeadingDash_throws() {
        var builder = Substitution.builder()
                                  .span("root", Span.of(0, 1))
                                  .primaryLabel("root")
                                  .category("-idiom");

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class)
                                          .hasMessageContaining("category");
    }

    @Test
    void allCategories_dottedCategory_listsEveryPrefix() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(0, 1))
                                       .primaryLabel("root")
                                       .category("idiom.collections.empty")
                                       .build();

        assertThat(substitution.allCategories()).containsExactly("idiom", "idiom.collections",
                                                                 "idiom.collections.empty");
    }

    @Test
    void allCategories_noCategory_isEmpty() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(0, 1))
                                       .primaryLabel("root")
                                       .build();

        assertThat(substitution.allCategories()).isEmpty();
        assertThat(substitution.significant()).isTrue();
    }

    @Test
    void relativeTo_spansInsideWindow_shiftsThemAndDropsKeySpan() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(12, 15))
                                       .primaryLabel("root")
                                       .replacement("root", "b")
                                       .keySpan(Span.of(10, 20))
                                       .build();

        var relative = substitution.relativeTo(10, 20);

        assertThat(relative).isPresent();
        assertThat(relative.get().primarySpan()).isEqualTo(Span.of(2, 5));
        assertThat(relative.get().keySpan()).isEmpty();
        assertThat(relative.get().replacements()).containsEntry("root", "b");
    }

    @Test
    void relativeTo_spanOutsideWindow_isEmpty() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(5, 15))
                                       .primaryLabel("root")
                                       .build();

        assertThat(substitution.relativeTo(10, 20)).isEmpty();
    }

    @Test
    void toBuilder_unchanged_isEqual() {
        var substitution = Substitution.builder()
                                       .span("root", Span.of(0, 3))
                                       .primaryLabel("root")
                                       .message("Use isEmpty()")
                                       .url("https://example.com/empty")
                                       .category("idiom")
                                       .build();

        assertThat(substitution.toBuilder().build()).isEqualTo(substitution)
                                                    .hasSameHashCodeAs(substitution);
    }
}
