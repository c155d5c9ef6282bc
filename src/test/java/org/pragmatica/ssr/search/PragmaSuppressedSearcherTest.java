package org.pragmatica.ssr.search;

import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.pattern.SyntaxPattern;
import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.template.SafeTemplate;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PragmaSuppressedSearcherTest {
    private static final String PATH = "A.java";

    private static PragmaSuppressedSearcher searcher(String category) {
        var delegate = MatcherSearcher.of(SyntaxPattern.compile("$x + 0", FragmentKind.EXPRESSION),
                                          Map.of(MatcherSearcher.ROOT_LABEL, SafeTemplate.expression("$x")))
                                      .withFinding(new MatcherSearcher.Finding("Drop + 0", null, category, true));
        return PragmaSuppressedSearcher.of(delegate);
    }

    private static List<String> matchedTexts(PragmaSuppressedSearcher searcher, String source) {
        var unit = searcher.parse(source, PATH);
        return searcher.findSubstitutions(unit)
                       .stream()
                       .map(Substitution::primarySpan)
                       .map(span -> span.extract(source))
                       .toList();
    }

    // === Suppression Tests ===

    @Test
    void findSubstitutions_ownLineDirective_suppressesRestOfBlock() {
        var source = """
            class A {
              void f() {
                x = a + 0;
                // ssr: disable=idiom
                x = b + 0;
              }
              void g() {
                x = c + 0;
              }
            }
            """;

        assertThat(matchedTexts(searcher("idiom.zero"), source)).containsExactly("a + 0", "c + 0");
    }

    @Test
    void findSubstitutions_trailingDirective_suppressesItsLine() {
        var source = """
            class A {
              void f() {
                x = a + 0; // ssr: disable=idiom.zero
                x = b + 0;
              }
            }
            """;

        assertThat(matchedTexts(searcher("idiom.zero"), source)).containsExactly("b + 0");
    }

    @Test
    void findSubstitutions_enableDirective_endsSuppression() {
        var source = """
            class A {
              void f() {
                // ssr: disable=idiom.zero
                x = a + 0;
                // ssr: enable=idiom.zero
                x = b + 0;
              }
            }
            """;

        assertThat(matchedTexts(searcher("idiom.zero"), source)).containsExactly("b + 0");
    }

    @Test
    void findSubstitutions_otherCategory_isNotSuppressed() {
        var source = """
            class A {
              void f() {
                x = a + 0; // ssr: disable=idiom.loops
              }
            }
            """;

        assertThat(matchedTexts(searcher("idiom.zero"), source)).containsExactly("a + 0");
        assertThat(matchedTexts(searcher(null), source)).containsExactly("a + 0");
    }

    @Test
    void findSubstitutions_checkstyleDirective_namesCheckstyleCategories() {
        var source = """
            class A {
              void f() {
                x = a + 0; // checkstyle: disable=zero
              }
            }
            """;

        assertThat(matchedTexts(searcher("checkstyle.zero"), source)).isEmpty();
        assertThat(matchedTexts(searcher("zero"), source)).containsExactly("a + 0");
    }

    // === Range Tests ===

    @Test
    void excludedRanges_disabledRangeIsCutAtEnable() {
        var source = "class A {\n  // ssr: disable=zero\n  int a;\n  // ssr: enable=zero\n  int b;\n}\n";
        var unit = JavaGrammar.parse(source, PATH, FragmentKind.UNIT);

        var ranges = PragmaSuppressedSearcher.excludedRanges(unit).get("zero");

        assertThat(ranges).hasSize(1);
        assertThat(ranges.get(0).start()).isEqualTo(source.indexOf("// ssr: disable"));
        assertThat(ranges.get(0).end()).isEqualTo(source.indexOf("// ssr: enable"));
    }
}
