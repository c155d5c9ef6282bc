package org.pragmatica.ssr.matcher;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches with the first submatcher, in order, that matches the candidate.
 *
 * <p>When every submatcher declares a type filter, candidates are dispatched by their class so that
 * only submatchers that can match are tried, still in declaration order.
 */
public final class AnyOf implements Matcher {
    private final ImmutableList<Matcher> matchers;
    private final ImmutableListMultimap<Class<?>, Matcher> byKind;

    public AnyOf(List<? extends Matcher> matchers) {
        this.matchers = ImmutableList.copyOf(matchers);
        this.byKind = dispatchTable(this.matchers);
    }

    public static AnyOf of(Matcher... matchers) {
        return new AnyOf(List.of(matchers));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        for (var matcher : candidatesFor(candidate)) {
            var result = matcher.match(context, candidate);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        if (byKind == null) {
            return Optional.empty();
        }
        return Optional.of(byKind.keySet());
    }

    @Override
    public Set<String> bindVariables() {
        return Matcher.bindVariablesOf(matchers);
    }

    public List<Matcher> matchers() {
        return matchers;
    }

    private List<Matcher> candidatesFor(Object candidate) {
        if (byKind == null) {
            return matchers;
        }
        return candidate == null ? List.of() : byKind.get(candidate.getClass());
    }

    private static ImmutableListMultimap<Class<?>, Matcher> dispatchTable(List<Matcher> matchers) {
        var table = ImmutableListMultimap.<Class<?>, Matcher>builder();
        for (var matcher : matchers) {
            var filter = matcher.typeFilter();
            if (filter.isEmpty()) {
                return null;
            }
            for (var kind : ImmutableSet.copyOf(filter.get())) {
                table.put(kind, matcher);
            }
        }
        return table.build();
    }

    @Override
    public String toString() {
        return "AnyOf" + matchers;
    }
}
