package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Bindings;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the nearest ancestor matching {@code firstAncestor} and requires that it also matches
 * {@code alsoMatches}. Farther ancestors are never considered.
 */
public record HasFirstAncestor(Matcher firstAncestor, Matcher alsoMatches) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        var navigator = context.unit().navigator();
        var current = navigator.parent(candidate);
        while (current.isPresent()) {
            var found = firstAncestor.match(context, current.get());
            if (found.isPresent()) {
                var ancestor = current.get();
                return alsoMatches.match(context, ancestor)
                                  .flatMap(also -> Bindings.merge(found.get().bindings(), also.bindings()))
                                  .map(bindings -> MatchResult.of(Fragment.of(context.unit(), candidate), bindings));
            }
            current = navigator.parent(current.get());
        }
        return Optional.empty();
    }

    @Override
    public Set<String> bindVariables() {
        return Matcher.bindVariablesOf(List.of(firstAncestor, alsoMatches));
    }
}
