package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches a node with a strict descendant that matches the submatcher.
 */
public final class HasDescendant implements Matcher {
    private final Matcher submatcher;
    private final Matcher delegate;

    public HasDescendant(Matcher submatcher) {
        this.submatcher = submatcher;
        this.delegate = new HasChild(new IsOrHasDescendant(submatcher));
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
        return "HasDescendant[" + submatcher + "]";
    }
}
