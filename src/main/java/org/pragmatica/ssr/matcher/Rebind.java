package org.pragmatica.ssr.matcher;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.pragmatica.ssr.match.BindConflict;
import org.pragmatica.ssr.match.BindMerge;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Runs {@code submatcher} and gives every resulting binding new conflict and merge policies.
 */
public record Rebind(Matcher submatcher, BindConflict onConflict, BindMerge onMerge) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return submatcher.match(context, candidate)
                         .map(result -> result.withBindings(
                             ImmutableMap.copyOf(Maps.transformValues(
                                 result.bindings(), bound -> bound.rebind(onConflict, onMerge)))));
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return submatcher.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
