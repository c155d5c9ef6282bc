package org.pragmatica.ssr.matcher;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a node that starts on one of the given lines. Lines count from 1.
 */
public record InLines(Set<Integer> lines) implements Matcher {

    public InLines {
        lines = ImmutableSet.copyOf(lines);
    }

    public static InLines of(Collection<Integer> lines) {
        return new InLines(ImmutableSet.copyOf(lines));
    }

    public static InLines of(Integer... lines) {
        return new InLines(ImmutableSet.copyOf(lines));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        var unit = context.unit();
        return unit.spanOf(candidate)
                   .filter(span -> lines.contains(unit.lines().lineOf(span.start())))
                   .map(span -> MatchResult.of(Fragment.of(unit, candidate)));
    }
}
