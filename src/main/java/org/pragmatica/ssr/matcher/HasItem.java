package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.NodeList;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a list whose item at {@code index} matches {@code submatcher}. Negative indexes count
 * from the end; an index out of range does not match.
 */
public record HasItem(int index, Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        if (!(candidate instanceof List<?> items)) {
            return Optional.empty();
        }
        int position = index < 0 ? items.size() + index : index;
        if (position < 0 || position >= items.size()) {
            return Optional.empty();
        }
        return submatcher.match(context, items.get(position))
                         .map(result -> result.withMatch(Fragment.of(context.unit(), candidate)));
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
