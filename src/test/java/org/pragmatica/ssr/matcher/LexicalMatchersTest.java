package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.error.MatchException;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexicalMatchersTest {

    // === Regex Tests ===

    @Test
    void matchesRegex_wholeTextOfMatch_bindsNamedGroups() {
        var unit = JavaGrammar.parse("obj.getValue()", FragmentKind.EXPRESSION);
        var methodName = ((MethodCallExpr) unit.root()).getName();
        var matcher = MatchesRegex.of("get(?<prop>\\w+)", NodeMatcher.of(SimpleName.class));

        var result = matcher.match(MatchContext.of(unit), methodName);

        assertThat(result).hasValueSatisfying(found -> assertThat(found.bound("prop").flatMap(f -> f.text()))
            .contains("Value"));
        assertThat(matcher.bindVariables()).containsExactly("prop");
    }

    @Test
    void matchesRegex_partialMatch_fails() {
        var unit = JavaGrammar.parse("obj.getValue()", FragmentKind.EXPRESSION);

        assertThat(MatchesRegex.of("get").match(MatchContext.of(unit), ((MethodCallExpr) unit.root()).getName()))
            .isEmpty();
    }

    @Test
    void fileMatchesRegex_searchesWholeText() {
        var unit = JavaGrammar.parse("class A { int version = 42; }", FragmentKind.UNIT);
        var context = MatchContext.of(unit);

        var result = FileMatchesRegex.of("version = (?<number>\\d+)").match(context, unit.root());

        assertThat(result).hasValueSatisfying(found -> assertThat(found.bound("number").flatMap(f -> f.text()))
            .contains("42"));
        assertThat(FileMatchesRegex.of("absent").match(context, unit.root())).isEmpty();
    }

    // === Comment Tests ===

    @Test
    void hasComments_commentInsideMatch_matches() {
        var unit = JavaGrammar.parse("class A { void f() { f(/* why */ 1); g(2); } }", FragmentKind.UNIT);
        var context = MatchContext.of(unit);
        var statements = unit.root().findAll(ExpressionStmt.class);
        var anyStatement = NodeMatcher.of(ExpressionStmt.class);

        assertThat(new HasComments(anyStatement).match(context, statements.get(0))).isPresent();
        assertThat(new HasComments(anyStatement).match(context, statements.get(1))).isEmpty();
        assertThat(new NoComments(anyStatement).match(context, statements.get(1))).isPresent();
    }

    @Test
    void hasComments_matchWithoutSourceText_throws() {
        var unit = JavaGrammar.parse("a", FragmentKind.EXPRESSION);

        assertThatThrownBy(() -> new HasComments(Anything.INSTANCE).match(MatchContext.of(unit), "text"))
            .isInstanceOf(MatchException.class);
    }

    // === Import Tests ===

    @Test
    void withTopLevelImport_singleTypeImport_isVisible() {
        var unit = JavaGrammar.parse("import java.util.List;\nclass A { List<String> xs; }", FragmentKind.UNIT);
        var context = MatchContext.of(unit);

        assertThat(new WithTopLevelImport(Anything.INSTANCE, "java.util.List").match(context, unit.root()))
            .isPresent();
        assertThat(new WithTopLevelImport(Anything.INSTANCE, "java.util.Map").match(context, unit.root()))
            .isEmpty();
    }

    @Test
    void withTopLevelImport_onDemandImport_isVisible() {
        var unit = JavaGrammar.parse("import java.util.*;\nclass A {}", FragmentKind.UNIT);

        assertThat(new WithTopLevelImport(Anything.INSTANCE, "java.util.Map").match(MatchContext.of(unit),
                                                                                      unit.root()))
            .isPresent();
    }
}
