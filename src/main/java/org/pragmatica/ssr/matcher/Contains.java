package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.NodeList;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a list with at least one item matching {@code submatcher}. Bindings come from the first
 * such item.
 */
public record Contains(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        if (!(candidate instanceof List<?> items)) {
            return Optional.empty();
        }
        for (var item : items) {
            var result = submatcher.match(context, item);
            if (result.isPresent()) {
                return Optional.of(result.get().withMatch(Fragment.of(context.unit(), candidate)));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return Optional.of(Set.of(NodeList.class));
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
