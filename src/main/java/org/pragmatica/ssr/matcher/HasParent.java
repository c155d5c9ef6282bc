package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches a tree element whose direct parent matches {@code submatcher}. The parent of a list item
 * is its list.
 */
public record HasParent(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return context.unit()
                      .navigator()
                      .parent(candidate)
                      .flatMap(parent -> submatcher.match(context, parent))
                      .map(result -> MatchResult.of(Fragment.of(context.unit(), candidate), result.bindings())
                                                .withReplacements(result.replacements()));
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
