package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Matches if {@code submatcher} has ever matched under {@code key} in this unit, including now.
 *
 * <p>Once the key is recorded, later candidates match without running the submatcher again and
 * without bindings. A success is recorded only when the whole top-level attempt succeeds.
 */
public record Once(Matcher submatcher, Object key) implements Matcher {

    public Once(Matcher submatcher) {
        this(submatcher, submatcher);
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        if (context.hasSucceeded(key)) {
            return Optional.of(MatchResult.of(Fragment.of(context.unit(), candidate)));
        }
        var result = submatcher.match(context, candidate);
        if (result.isPresent()) {
            context.markSucceeded(key);
        }
        return result;
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }
}
