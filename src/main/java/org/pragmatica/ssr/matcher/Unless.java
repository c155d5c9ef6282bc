package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;

/**
 * Matches exactly when {@code submatcher} does not. Never binds anything.
 */
public record Unless(Matcher submatcher) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        if (submatcher.match(context, candidate).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(Fragment.of(context.unit(), candidate)));
    }
}
