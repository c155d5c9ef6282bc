package org.pragmatica.ssr.matcher;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matches any candidate when {@code pattern} is found anywhere in the unit's text. The search runs
 * once per unit; named groups of the first occurrence are bound.
 */
public final class FileMatchesRegex implements Matcher {
    private final Pattern pattern;
    private final Set<String> groups;

    public FileMatchesRegex(Pattern pattern) {
        this.pattern = pattern;
        this.groups = RegexGroups.names(pattern);
    }

    public static FileMatchesRegex of(String regex) {
        return new FileMatchesRegex(Pattern.compile(regex));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return context.memoize(Found.class, List.of(pattern.pattern(), pattern.flags()),
                               () -> new Found(search(context)))
                      .result();
    }

    @Override
    public Set<String> bindVariables() {
        return groups;
    }

    // Result of searching the whole file, shared by every candidate.
    private record Found(Optional<MatchResult> result) {}

    private Optional<MatchResult> search(MatchContext context) {
        var text = context.unit().text();
        var regexMatch = pattern.matcher(text);
        if (!regexMatch.find()) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(Fragment.EMPTY, RegexGroups.bindings(groups, regexMatch, text)));
    }
}
