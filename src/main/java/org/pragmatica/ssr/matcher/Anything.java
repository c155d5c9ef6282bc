package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;

/**
 * Matches every candidate.
 */
public record Anything() implements Matcher {

    public static final Anything INSTANCE = new Anything();

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return Optional.of(MatchResult.of(Fragment.of(context.unit(), candidate)));
    }
}
