package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Matches a candidate equal to {@code value}. Used for attribute values such as identifiers,
 * operators and literal text, and for absent optional fields ({@code null}).
 */
public record Equals(Object value) implements Matcher {

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        if (!Objects.equals(value, candidate)) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(Fragment.of(context.unit(), candidate)));
    }
}
