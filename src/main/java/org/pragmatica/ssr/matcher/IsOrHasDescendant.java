package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches a tree element if it or any of its descendants matches {@code submatcher}.
 *
 * <p>The candidate itself is tried first, then its children depth-first in source order. Bindings
 * come from the first element that matches.
 */
public final class IsOrHasDescendant implements Matcher {
    private final Matcher submatcher;
    private final Matcher delegate;

    public IsOrHasDescendant(Matcher submatcher) {
        this.submatcher = submatcher;
        this.delegate = new RecursivelyWrapped(submatcher, HasChild::new);
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return delegate.match(context, candidate);
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }

    @Override
    public String toString() {
        return "IsOrHasDescendant[" + submatcher + "]";
    }
}
