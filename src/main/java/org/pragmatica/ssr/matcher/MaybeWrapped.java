package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Matches {@code inner}, or {@code inner} wrapped once by {@code wrapper}.
 */
public final class MaybeWrapped implements Matcher {
    private final AnyOf delegate;

    public MaybeWrapped(Matcher inner, UnaryOperator<Matcher> wrapper) {
        this.delegate = new AnyOf(List.of(inner, wrapper.apply(inner)));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return delegate.match(context, candidate);
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return delegate.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return delegate.bindVariables();
    }
}
