package org.pragmatica.ssr.matcher;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches when every submatcher matches the candidate; their bindings are merged in order.
 */
public record AllOf(List<Matcher> matchers) implements Matcher {

    public AllOf {
        matchers = ImmutableList.copyOf(matchers);
    }

    public static AllOf of(Matcher... matchers) {
        return new AllOf(List.of(matchers));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        var result = MatchResult.of(Fragment.of(context.unit(), candidate));
        for (var matcher : matchers) {
            var next = matcher.match(context, candidate);
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
        Set<Class<?>> filter = null;
        for (var matcher : matchers) {
            var next = matcher.typeFilter();
            if (next.isPresent()) {
                filter = filter == null ? next.get() : Sets.intersection(filter, next.get()).immutableCopy();
            }
        }
        return Optional.ofNullable(filter);
    }

    @Override
    public Set<String> bindVariables() {
        return Matcher.bindVariablesOf(matchers);
    }
}
