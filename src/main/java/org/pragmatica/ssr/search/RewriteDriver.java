package org.pragmatica.ssr.search;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.ssr.error.ParseException;
import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.substitution.Substitutions;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds the substitutions of a searcher in a text, rewriting groups that share a key span until
 * nothing changes or the iteration budget is spent.
 *
 * <p>A driver is stateful while it runs; use one per thread.
 */
public final class RewriteDriver {
    private static final Logger logger = LogManager.getLogger(RewriteDriver.class);

    public enum State {
        IDLE,
        MATCHING,
        ITERATING,
        COMPOSING,
        DONE
    }

    private final Searcher searcher;
    private final RewriteConfig config;
    private final SubstitutionComposer composer;
    private State state = State.IDLE;

    private RewriteDriver(Searcher searcher, RewriteConfig config) {
        this.searcher = searcher;
        this.config = config;
        this.composer = SubstitutionComposer.of(config);
    }

    public static RewriteDriver of(Searcher searcher) {
        return of(searcher, RewriteConfig.DEFAULT);
    }

    public static RewriteDriver of(Searcher searcher, RewriteConfig config) {
        return new RewriteDriver(searcher, config);
    }

    public State state() {
        return state;
    }

    /**
     * Every substitution for the text, in source order.
     *
     * @throws ParseException if the text does not parse
     */
    public List<Substitution> findAll(String text, String path) {
        state = State.MATCHING;
        try {
            var unit = searcher.parse(text, path);
            var found = searcher.findSubstitutions(unit);
            var substitutions = ImmutableList.<Substitution>builder();
            int index = 0;
            while (index < found.size()) {
                var keySpan = found.get(index).keySpan();
                int groupEnd = index + 1;
                while (groupEnd < found.size() && Objects.equals(found.get(groupEnd).keySpan(), keySpan)) {
                    groupEnd++;
                }
                var group = found.subList(index, groupEnd);
                logger.debug("Key span {} in {} groups {} substitutions", keySpan.orElse(null), path, group.size());
                if (keySpan.isPresent()) {
                    substitutions.addAll(fixedPoint(unit, group, keySpan.get()));
                    state = State.MATCHING;
                } else {
                    substitutions.addAll(group);
                }
                index = groupEnd;
            }
            return substitutions.build();
        } finally {
            state = State.DONE;
        }
    }

    /**
     * The text with every substitution applied.
     *
     * @throws ParseException if the text does not parse
     */
    public String rewrite(String text, String path) {
        return Substitutions.apply(text, Substitutions.disjoint(findAll(text, path)));
    }

    /**
     * Applies the group, reparses the text of the key span and searches it again, as long as the
     * budget allows and something is found. A rewrite that no longer parses ends the iteration with
     * the last text that did.
     */
    List<Substitution> fixedPoint(ParsedUnit unit, List<Substitution> initial, Span keySpan) {
        if (config.maxIterations() <= 1) {
            return initial;
        }
        var pending = new ArrayList<Substitution>();
        for (var substitution : initial) {
            var relative = substitution.relativeTo(keySpan.start(), keySpan.end());
            if (relative.isEmpty()) {
                logger.warn("Substitution {} is outside of its key span {} in {}", substitution, keySpan, unit.path());
                return initial;
            }
            pending.add(relative.get());
        }
        var kind = searcher.fragmentKindAt(unit, keySpan);
        if (kind.isEmpty()) {
            logger.debug("Text under key span {} in {} cannot be reparsed on its own", keySpan, unit.path());
            return initial;
        }

        state = State.ITERATING;
        var text = keySpan.extract(unit.text());
        var accumulated = new ArrayList<Substitution>();
        for (int iteration = 0; iteration < config.maxIterations(); iteration++) {
            var rewritten = Substitutions.apply(text, pending);
            ParsedUnit reparsed;
            try {
                reparsed = JavaGrammar.parse(rewritten, unit.path(), kind.get());
            } catch (ParseException e) {
                logger.warn("Could not parse rewritten text {} of {} in {}: {}", keySpan, rewritten, unit.path(),
                            e.getMessage());
                break;
            }
            accumulated.addAll(pending);
            if (rewritten.equals(text)) {
                break;
            }
            logger.debug("Iteration {} rewrote '{}' to '{}'", iteration, text, rewritten);
            text = rewritten;
            pending = new ArrayList<>(Substitutions.disjoint(searcher.findSubstitutions(reparsed)));
            if (pending.isEmpty()) {
                break;
            }
        }

        if (accumulated.isEmpty()) {
            return List.of();
        }
        if (accumulated.size() == initial.size()) {
            return initial;
        }
        state = State.COMPOSING;
        return composer.compose(accumulated, keySpan, text)
                       .map(List::of)
                       .orElse(List.of());
    }
}
