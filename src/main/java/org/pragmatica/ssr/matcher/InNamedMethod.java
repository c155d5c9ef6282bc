package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches anything inside a method or constructor that matches {@code submatcher}. Only the
 * innermost method or constructor is considered; a lambda body belongs to its enclosing method.
 */
public final class InNamedMethod implements Matcher {
    private static final Matcher METHOD_OR_CONSTRUCTOR = AnyOf.of(NodeMatcher.of(MethodDeclaration.class),
                                                                  NodeMatcher.of(ConstructorDeclaration.class));

    private final Matcher submatcher;
    private final Matcher delegate;

    public InNamedMethod(Matcher submatcher) {
        this.submatcher = submatcher;
        this.delegate = new HasFirstAncestor(METHOD_OR_CONSTRUCTOR, submatcher);
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return delegate.match(context, candidate);
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
