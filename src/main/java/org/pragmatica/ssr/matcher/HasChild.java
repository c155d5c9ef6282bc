package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.tree.Trees;

import java.util.Optional;
import java.util.Set;

/**
 * Matches a node or list with a direct child matching {@code submatcher}. Children are tried in
 * source order and the first match wins.
 */
public record HasChild(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        for (var child : Trees.children(candidate)) {
            var result = submatcher.match(context, child);
            if (result.isPresent()) {
                return Optional.of(result.get().withMatch(Fragment.of(context.unit(), candidate)));
            }
        }
        return Optional.empty();
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
