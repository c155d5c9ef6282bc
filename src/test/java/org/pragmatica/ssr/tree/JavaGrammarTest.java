package org.pragmatica.ssr.tree;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import org.junit.jupiter.api.Test;
import org.pragmatica.ssr.error.ParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaGrammarTest {

    // === Parsing Tests ===

    @Test
    void parse_compilationUnit_keepsTextAndPath() {
        var unit = JavaGrammar.parse("class A { int x = 1; }", "A.java", FragmentKind.UNIT);

        assertThat(unit.root()).isInstanceOf(CompilationUnit.class);
        assertThat(unit.path()).isEqualTo("A.java");
        assertThat(unit.kind()).isEqualTo(FragmentKind.UNIT);
    }

    @Test
    void parse_expression_rootSpansWholeText() {
        var unit = JavaGrammar.parse("a + b", FragmentKind.EXPRESSION);

        assertThat(unit.root()).isInstanceOf(BinaryExpr.class);
        assertThat(unit.spanOf(unit.root())).contains(Span.of(0, 5));
        assertThat(unit.path()).isEqualTo(JavaGrammar.DEFAULT_PATH);
    }

    @Test
    void parse_statement_producesStatementRoot() {
        var unit = JavaGrammar.parse("x = foo();", FragmentKind.STATEMENT);

        assertThat(unit.root()).isInstanceOf(ExpressionStmt.class);
        assertThat(unit.textOf(unit.spanOf(unit.root()).orElseThrow())).isEqualTo("x = foo();");
    }

    @Test
    void parse_multiLineText_spansUseCharacterOffsets() {
        var text = "class A {\n  void f() {\n    g();\n  }\n}\n";
        var unit = JavaGrammar.parse(text, FragmentKind.UNIT);

        var call = unit.root().findFirst(ExpressionStmt.class).orElseThrow();

        assertThat(unit.textOf(unit.spanOf(call).orElseThrow())).isEqualTo("g();");
    }

    @Test
    void tokens_includeComments() {
        var unit = JavaGrammar.parse("int f() { return 1; /* one */ }", FragmentKind.MEMBER);

        assertThat(unit.tokens()).anySatisfy(token -> {
            assertThat(token.isComment()).isTrue();
            assertThat(token.text()).isEqualTo("/* one */");
        });
    }

    // === Failure Tests ===

    @Test
    void parse_malformedText_throwsWithDiagnostic() {
        assertThatThrownBy(() -> JavaGrammar.parse("class A {", "A.java", FragmentKind.UNIT))
            .isInstanceOfSatisfying(ParseException.class, failure -> {
                assertThat(failure.path()).isEqualTo("A.java");
                assertThat(failure.diagnostic().message()).isNotBlank();
                assertThat(failure.getMessage()).startsWith("A.java:");
                assertThat(failure.formatted()).contains("error:").contains("class A {");
            });
    }

    @Test
    void parse_statementAsExpression_throws() {
        assertThatThrownBy(() -> JavaGrammar.parse("return 1;", FragmentKind.EXPRESSION))
            .isInstanceOf(ParseException.class);
    }
}
