package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Matches {@code inner} wrapped by {@code wrapper} any number of times, including zero.
 *
 * <p>For example {@code new RecursivelyWrapped(name, m -> NodeMatcher.of(FieldAccessExpr.class).with("scope", m))}
 * matches {@code x}, {@code x.a}, {@code x.a.b} and so on. The wrapper is applied once, to a lazy
 * reference back to this matcher, which is followed only while matching.
 */
public final class RecursivelyWrapped implements Matcher {
    private final Matcher inner;
    private final AnyOf delegate;

    public RecursivelyWrapped(Matcher inner, UnaryOperator<Matcher> wrapper) {
        this.inner = inner;
        this.delegate = new AnyOf(List.of(inner, wrapper.apply(new Recurse(this))));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return delegate.match(context, candidate);
    }

    @Override
    public Set<String> bindVariables() {
        return delegate.bindVariables();
    }

    @Override
    public String toString() {
        return "RecursivelyWrapped[" + inner + "]";
    }

    // Neither filters nor reports variables: both would walk back into the owner.
    private static final class Recurse implements Matcher {
        private final RecursivelyWrapped target;

        private Recurse(RecursivelyWrapped target) {
            this.target = target;
        }

        @Override
        public Optional<MatchResult> match(MatchContext context, Object candidate) {
            return target.match(context, candidate);
        }

        @Override
        public String toString() {
            return "Recurse(...)";
        }
    }
}
