package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches a tree element if any of its ancestors matches {@code submatcher}. Same as
 * {@code HasParent(IsOrHasAncestor(submatcher))}, and that is how it is built.
 */
public final class HasAncestor implements Matcher {
    private final Matcher submatcher;
    private final Matcher delegate;

    public HasAncestor(Matcher submatcher) {
        this.submatcher = submatcher;
        this.delegate = new HasParent(new IsOrHasAncestor(submatcher));
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
        return "HasAncestor[" + submatcher + "]";
    }
}
