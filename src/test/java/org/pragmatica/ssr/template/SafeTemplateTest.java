package org.pragmatica.ssr.template;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.error.PatternCompileException;
import org.pragmatica.ssr.error.RewriteException;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafeTemplateTest {

    private static <T extends Node> Fragment fragmentOf(ParsedUnit unit, Class<T> type) {
        return Fragment.of(unit, unit.root().findFirst(type).orElseThrow());
    }

    // === Parenthesization Tests ===

    @Test
    void substitute_compoundBinding_isParenthesized() {
        var unit = JavaGrammar.parse("foo(x + 1);", FragmentKind.STATEMENT);
        var template = SafeTemplate.expression("$a * 2");

        var result = template.substitute(unit, Fragment.EMPTY, Map.of("a", fragmentOf(unit, BinaryExpr.class)));

        assertThat(result).isEqualTo("(x + 1) * 2");
    }

    @Test
    void substitute_simpleBinding_staysBare() {
        var unit = JavaGrammar.parse("foo(x + 1);", FragmentKind.STATEMENT);
        var template = SafeTemplate.expression("$a * 2");

        var result = template.substitute(unit, Fragment.EMPTY, Map.of("a", fragmentOf(unit, NameExpr.class)));

        assertThat(result).isEqualTo("x * 2");
    }

    @Test
    void substitute_bindingWithoutPrecedenceConflict_staysBare() {
        var unit = JavaGrammar.parse("y = a * b;", FragmentKind.STATEMENT);
        var template = SafeTemplate.expression("$a + 1");

        var result = template.substitute(unit, Fragment.EMPTY, Map.of("a", fragmentOf(unit, BinaryExpr.class)));

        assertThat(result).isEqualTo("a * b + 1");
    }

    @Test
    void substitute_replacementInsideLargerExpression_isParenthesizedForItsContext() {
        var unit = JavaGrammar.parse("return x * 2;", FragmentKind.STATEMENT);
        var template = SafeTemplate.expression("x+1");

        var result = template.substitute(unit, fragmentOf(unit, NameExpr.class), Map.of());

        assertThat(result).isEqualTo("(x+1)");
    }

    @Test
    void substitute_replacementOfWholeExpressionStatement_isLeftAlone() {
        var unit = JavaGrammar.parse("foo();", FragmentKind.STATEMENT);
        var template = SafeTemplate.expression("a + b");

        var result = template.substitute(unit, fragmentOf(unit, MethodCallExpr.class), Map.of());

        assertThat(result).isEqualTo("a + b");
    }

    @Test
    void variables_areTheMetavariableNames() {
        assertThat(SafeTemplate.expression("$f($x, $x)").variables()).containsExactlyInAnyOrder("f", "x");
        assertThat(SafeTemplate.statement("return;").variables()).isEmpty();
    }

    // === Error Tests ===

    @Test
    void of_malformedTemplate_throws() {
        assertThatThrownBy(() -> SafeTemplate.expression("a +"))
            .isInstanceOf(PatternCompileException.class);
    }

    @Test
    void substitute_missingBinding_throws() {
        var unit = JavaGrammar.parse("y = 1;", FragmentKind.STATEMENT);
        var template = SafeTemplate.expression("$a + 1");

        assertThatThrownBy(() -> template.substitute(unit, Fragment.EMPTY, Map.of()))
            .isInstanceOf(RewriteException.class)
            .hasMessageContaining("$a");
    }
}
