package org.pragmatica.ssr.search;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.Span;

import java.util.List;
import java.util.Optional;

/**
 * Drops substitutions that comment directives switch off.
 *
 * <p>{@code // ssr: disable=idiom.loops} suppresses every substitution in category {@code idiom.loops}
 * or below it within the reach of the comment; {@code enable=} ends a disabled range early.
 * {@code checkstyle:} directives name categories under {@code checkstyle.}.
 */
public final class PragmaSuppressedSearcher implements Searcher {
    private static final Logger logger = LogManager.getLogger(PragmaSuppressedSearcher.class);

    static final String DISABLE = "disable";
    static final String ENABLE = "enable";

    private final Searcher delegate;

    private PragmaSuppressedSearcher(Searcher delegate) {
        this.delegate = delegate;
    }

    public static PragmaSuppressedSearcher of(Searcher delegate) {
        return new PragmaSuppressedSearcher(delegate);
    }

    @Override
    public ParsedUnit parse(String text, String path) {
        return delegate.parse(text, path);
    }

    @Override
    public List<Substitution> findSubstitutions(ParsedUnit unit) {
        var excluded = excludedRanges(unit);
        var kept = ImmutableList.<Substitution>builder();
        for (var substitution : delegate.findSubstitutions(unit)) {
            if (isSuppressed(substitution, excluded)) {
                logger.debug("Suppressed {} in {}", substitution, unit.path());
            } else {
                kept.add(substitution);
            }
        }
        return kept.build();
    }

    @Override
    public Optional<FragmentKind> fragmentKindAt(ParsedUnit unit, Span keySpan) {
        return delegate.fragmentKindAt(unit, keySpan);
    }

    /**
     * Disabled ranges per category, each cut short by the first enabling directive for the same
     * category inside it.
     */
    static ListMultimap<String, Span> excludedRanges(ParsedUnit unit) {
        var disabled = ranges(unit, DISABLE);
        var enabled = ranges(unit, ENABLE);
        var excluded = ArrayListMultimap.<String, Span>create();
        for (var entry : disabled.entries()) {
            int start = entry.getValue().start();
            int end = entry.getValue().end();
            for (var enabling : enabled.get(entry.getKey())) {
                if (start <= enabling.start() && enabling.start() < end) {
                    end = enabling.start();
                }
            }
            excluded.put(entry.getKey(), Span.of(start, end));
        }
        return excluded;
    }

    private static Multimap<String, Span> ranges(ParsedUnit unit, String key) {
        var ranges = ArrayListMultimap.<String, Span>create();
        for (var pragma : unit.pragmas()) {
            var value = pragma.data().get(key);
            if (value == null) {
                continue;
            }
            var prefix = categoryPrefix(pragma.tag());
            if (prefix.isPresent()) {
                ranges.put(prefix.get() + value.trim(), Span.of(pragma.start(), pragma.end()));
            }
        }
        return ranges;
    }

    private static Optional<String> categoryPrefix(String tag) {
        return switch (tag) {
            case "ssr" -> Optional.of("");
            case "checkstyle" -> Optional.of("checkstyle.");
            default -> Optional.empty();
        };
    }

    private static boolean isSuppressed(Substitution substitution, Multimap<String, Span> excluded) {
        var primary = substitution.primarySpan();
        for (var category : substitution.allCategories()) {
            for (var range : excluded.get(category)) {
                if (primary.end() > range.start() && primary.start() < range.end()) {
                    return true;
                }
            }
        }
        return false;
    }
}
