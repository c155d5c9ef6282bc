package org.pragmatica.ssr.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.ssr.error.MatchException;
import org.pragmatica.ssr.match.FileSession;
import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.matcher.Matcher;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.Trees;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Runs a matcher over every element of a unit.
 */
public final class MatchFinder {
    private static final Logger logger = LogManager.getLogger(MatchFinder.class);

    private MatchFinder() {}

    /**
     * All matches in preorder, source order among siblings. Node lists are candidates as well as
     * nodes. The children of a matched element are not searched.
     *
     * <p>Each candidate is a separate attempt: a {@link MatchException} skips only that candidate,
     * and run-once state is kept only from attempts that matched.
     */
    public static List<MatchResult> findMatches(Matcher matcher, ParsedUnit unit) {
        var filter = matcher.typeFilter();
        var session = FileSession.of(unit);
        var results = ImmutableList.<MatchResult>builder();
        var pending = new ArrayDeque<Object>();
        pending.push(unit.root());
        while (!pending.isEmpty()) {
            var candidate = pending.pop();
            if (filter.isEmpty() || filter.get().contains(candidate.getClass())) {
                var context = session.fork();
                try {
                    var result = matcher.match(context, candidate);
                    if (result.isPresent()) {
                        context.commit();
                        results.add(result.get());
                        continue;
                    }
                } catch (MatchException e) {
                    logger.warn("Skipped match attempt on {} in {}: {}", Trees.describe(candidate), unit.path(),
                                e.getMessage());
                }
            }
            for (var child : Lists.reverse(Trees.children(candidate))) {
                pending.push(child);
            }
        }
        return results.build();
    }
}
