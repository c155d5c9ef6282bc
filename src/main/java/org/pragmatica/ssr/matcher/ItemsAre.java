package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.NodeList;
import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a list of exactly as many items as there are matchers, each item matching the matcher
 * at the same position.
 */
public record ItemsAre(List<Matcher> matchers) implements Matcher {

    public ItemsAre {
        matchers = ImmutableList.copyOf(matchers);
    }

    public static ItemsAre of(Matcher... matchers) {
        return new ItemsAre(List.of(matchers));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        if (!(candidate instanceof List<?> items) || items.size() != matchers.size()) {
            return Optional.empty();
        }
        var result = MatchResult.of(Fragment.of(context.unit(), candidate));
        for (int i = 0; i < matchers.size(); i++) {
            var next = matchers.get(i).match(context, items.get(i));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            var merged = result.mergedWith(next.get());
            if (merged.isEmpty()) {
                return Optional.empty();
            }
            result = merged.get();
        }
        return Optional.of(result);
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return Optional.of(Set.of(NodeList.class));
    }

    @Override
    public Set<String> bindVariables() {
        return Matcher.bindVariablesOf(matchers);
    }
}
