package org.pragmatica.ssr.tree;

import com.github.javaparser.ParseStart;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

import java.util.Optional;

/**
 * The kinds of Java source fragment that can be parsed on their own.
 */
public enum FragmentKind {
    EXPRESSION(ParseStart.EXPRESSION),
    STATEMENT(ParseStart.STATEMENT),
    MEMBER(ParseStart.CLASS_BODY),
    UNIT(ParseStart.COMPILATION_UNIT);

    private final ParseStart<? extends Node> parseStart;

    FragmentKind(ParseStart<? extends Node> parseStart) {
        this.parseStart = parseStart;
    }

    ParseStart<? extends Node> parseStart() {
        return parseStart;
    }

    /**
     * The fragment kind a node would be reparsed as, if it can be reparsed on its own at all.
     */
    public static Optional<FragmentKind> of(Node node) {
        if (node instanceof Expression) {
            return Optional.of(EXPRESSION);
        }
        if (node instanceof Statement) {
            return Optional.of(STATEMENT);
        }
        if (node instanceof BodyDeclaration<?>) {
            return Optional.of(MEMBER);
        }
        if (node instanceof CompilationUnit) {
            return Optional.of(UNIT);
        }
        return Optional.empty();
    }
}
