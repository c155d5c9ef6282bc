package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.error.MatchException;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Keeps only the matches of {@code submatcher} whose source text contains a comment.
 */
public record HasComments(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return submatcher.match(context, candidate)
                         .filter(result -> containsComment(context, submatcher, result));
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return submatcher.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }

    /**
     * @throws MatchException if the match carries no span of source text
     */
    static boolean containsComment(MatchContext context, Matcher submatcher, MatchResult result) {
        var span = result.match()
                         .span()
                         .orElseThrow(() -> new MatchException("expected a match with source text from " + submatcher
                                                               + ", got " + result.match()));
        return context.unit()
                      .tokensWithin(span)
                      .stream()
                      .anyMatch(token -> token.isComment());
    }
}
