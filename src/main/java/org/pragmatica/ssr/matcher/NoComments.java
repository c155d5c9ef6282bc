package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Keeps only the matches of {@code submatcher} whose source text has no comment in it.
 */
public record NoComments(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return submatcher.match(context, candidate)
                         .filter(result -> !HasComments.containsComment(context, submatcher, result));
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return submatcher.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
