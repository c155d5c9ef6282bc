package org.pragmatica.ssr.matcher;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.Bindings;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matches when the source text of what {@code submatcher} matched is fully matched by
 * {@code pattern}. Named groups bind the text they captured.
 *
 * <p>A match without a span never matches: there is no text to test.
 */
public final class MatchesRegex implements Matcher {
    private final Pattern pattern;
    private final Matcher submatcher;
    private final Set<String> groups;

    public MatchesRegex(Pattern pattern, Matcher submatcher) {
        this.pattern = pattern;
        this.submatcher = submatcher;
        this.groups = RegexGroups.names(pattern);
    }

    public static MatchesRegex of(String regex) {
        return new MatchesRegex(Pattern.compile(regex), Anything.INSTANCE);
    }

    public static MatchesRegex of(String regex, Matcher submatcher) {
        return new MatchesRegex(Pattern.compile(regex), submatcher);
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        var result = submatcher.match(context, candidate);
        if (result.isEmpty()) {
            return Optional.empty();
        }
        var span = result.get().match().span();
        if (span.isEmpty()) {
            return Optional.empty();
        }
        var text = context.unit().text();
        var regexMatch = pattern.matcher(text).region(span.get().start(), span.get().end());
        if (!regexMatch.matches()) {
            return Optional.empty();
        }
        return Bindings.merge(RegexGroups.bindings(groups, regexMatch, text), result.get().bindings())
                       .map(bindings -> result.get().withBindings(bindings));
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return submatcher.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return ImmutableSet.<String>builder().addAll(groups).addAll(submatcher.bindVariables()).build();
    }

    @Override
    public String toString() {
        return "MatchesRegex[" + pattern + ", " + submatcher + "]";
    }
}
