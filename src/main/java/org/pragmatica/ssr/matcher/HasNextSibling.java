package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches a list item whose immediately following item matches {@code submatcher}. The result is
 * the sibling's match.
 */
public record HasNextSibling(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return context.unit()
                      .navigator()
                      .nextSibling(candidate)
                      .flatMap(sibling -> submatcher.match(context, sibling));
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
