package org.pragmatica.ssr.matcher;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * A composable predicate over syntax tree elements that records metavariable bindings.
 *
 * <p>Candidates are syntax nodes, node lists, attribute values or {@code null}. A matcher that does
 * not match returns {@link Optional#empty()}; it throws only when it is misused, which aborts the
 * current top-level match attempt.
 */
public interface Matcher {

    Optional<MatchResult> match(MatchContext context, Object candidate);

    /**
     * The candidate classes this matcher can possibly match, or empty if it may match anything.
     * Used only to skip hopeless attempts.
     */
    default Optional<Set<Class<?>>> typeFilter() {
        return Optional.empty();
    }

    /**
     * Every metavariable this matcher may bind.
     */
    default Set<String> bindVariables() {
        return Set.of();
    }

    static Set<String> bindVariablesOf(Collection<? extends Matcher> matchers) {
        var names = ImmutableSet.<String>builder();
        for (var matcher : matchers) {
            names.addAll(matcher.bindVariables());
        }
        return names.build();
    }
}
