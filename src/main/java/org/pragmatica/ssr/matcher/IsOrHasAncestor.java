package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches a tree element if it or any of its ancestors matches {@code submatcher}.
 */
public final class IsOrHasAncestor implements Matcher {
    private final Matcher submatcher;
    private final Matcher delegate;

    public IsOrHasAncestor(Matcher submatcher) {
        this.submatcher = submatcher;
        this.delegate = new RecursivelyWrapped(submatcher, HasParent::new);
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
        return "IsOrHasAncestor[" + submatcher + "]";
    }
}
