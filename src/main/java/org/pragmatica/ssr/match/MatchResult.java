package org.pragmatica.ssr.match;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.ssr.template.Template;

import java.util.Map;
import java.util.Optional;

/**
 * The outcome of one successful match: the matched fragment, metavariable bindings, and
 * replacements the matcher itself asks for.
 *
 * @param match        matched fragment
 * @param bindings     metavariable bindings
 * @param replacements templates to render for some metavariables, independent of any searcher templates
 */
public record MatchResult(Fragment match,
                          ImmutableMap<String, BoundValue> bindings,
                          ImmutableMap<String, Template> replacements) {

    public static MatchResult of(Fragment match) {
        return new MatchResult(match, ImmutableMap.of(), ImmutableMap.of());
    }

    public static MatchResult of(Fragment match, Map<String, BoundValue> bindings) {
        return new MatchResult(match, ImmutableMap.copyOf(bindings), ImmutableMap.of());
    }

    public MatchResult withMatch(Fragment newMatch) {
        return new MatchResult(newMatch, bindings, replacements);
    }

    public MatchResult withBindings(Map<String, BoundValue> newBindings) {
        return new MatchResult(match, ImmutableMap.copyOf(newBindings), replacements);
    }

    public MatchResult withReplacements(Map<String, Template> newReplacements) {
        return new MatchResult(match, bindings, ImmutableMap.copyOf(newReplacements));
    }

    /**
     * Combine with the result of a sibling matcher: bindings merge, replacements accumulate, and the
     * match of this result is kept.
     */
    public Optional<MatchResult> mergedWith(MatchResult other) {
        return Bindings.merge(bindings, other.bindings)
                       .map(merged -> new MatchResult(match, merged,
                                                      ImmutableMap.<String, Template>builder()
                                                                  .putAll(replacements)
                                                                  .putAll(other.replacements)
                                                                  .buildKeepingLast()));
    }

    public Optional<Fragment> bound(String name) {
        return Optional.ofNullable(bindings.get(name)).map(BoundValue::value);
    }
}
