package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.expr.EnclosedExpr;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.tree.Trees;

import java.util.Optional;
import java.util.Set;

/**
 * Strips any parentheses around the candidate before handing it to {@code submatcher}.
 */
public record Unparenthesized(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return submatcher.match(context, Trees.unparenthesized(candidate));
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return submatcher.typeFilter()
                         .map(filter -> ImmutableSet.<Class<?>>builder()
                                                    .addAll(filter)
                                                    .add(EnclosedExpr.class)
                                                    .build());
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
