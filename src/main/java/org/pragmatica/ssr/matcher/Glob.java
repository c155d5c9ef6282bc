package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.NodeList;
import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a list against a sequence of item matchers separated by {@link #STAR} wildcards, each of
 * which stands for any number of items.
 *
 * <p>The block before the first wildcard is anchored at the start and the block after the last one
 * at the end. Every block in between is placed at the earliest position where it matches and its
 * bindings merge, and is never moved afterwards, so matching is linear in the list length times
 * the pattern length.
 */
public final class Glob implements Matcher {
    /**
     * Wildcard element: any number of items, including none.
     */
    public static final Matcher STAR = new Star();

    private final ImmutableList<Matcher> elements;
    private final ImmutableList<List<Matcher>> blocks;

    private Glob(ImmutableList<Matcher> elements) {
        this.elements = elements;
        this.blocks = split(elements);
    }

    public static Glob of(Matcher... elements) {
        return new Glob(ImmutableList.copyOf(elements));
    }

    public static Glob of(List<Matcher> elements) {
        return new Glob(ImmutableList.copyOf(elements));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        if (!(candidate instanceof List<?> items)) {
            return Optional.empty();
        }
        var start = MatchResult.of(Fragment.of(context.unit(), candidate));
        if (blocks.size() == 1) {
            var only = blocks.get(0);
            if (only.size() != items.size()) {
                return Optional.empty();
            }
            return matchBlock(context, items, 0, only, start);
        }
        var head = blocks.get(0);
        var tail = blocks.get(blocks.size() - 1);
        int tailStart = items.size() - tail.size();
        if (tailStart < head.size()) {
            return Optional.empty();
        }
        var result = matchBlock(context, items, 0, head, start);
        if (result.isEmpty()) {
            return Optional.empty();
        }
        var current = result.get();
        int position = head.size();
        for (var block : blocks.subList(1, blocks.size() - 1)) {
            var placed = placeEarliest(context, items, position, tailStart, block, current);
            if (placed.isEmpty()) {
                return Optional.empty();
            }
            current = placed.get().result();
            position = placed.get().end();
        }
        return matchBlock(context, items, tailStart, tail, current);
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return Optional.of(Set.of(NodeList.class));
    }

    @Override
    public Set<String> bindVariables() {
        return Matcher.bindVariablesOf(elements);
    }

    @Override
    public String toString() {
        return "Glob" + elements;
    }

    private record Placement(MatchResult result, int end) {}

    private static Optional<Placement> placeEarliest(MatchContext context, List<?> items, int from, int limit,
                                                     List<Matcher> block, MatchResult current) {
        for (int offset = from; offset + block.size() <= limit; offset++) {
            var result = matchBlock(context, items, offset, block, current);
            if (result.isPresent()) {
                return Optional.of(new Placement(result.get(), offset + block.size()));
            }
        }
        return Optional.empty();
    }

    private static Optional<MatchResult> matchBlock(MatchContext context, List<?> items, int offset,
                                                    List<Matcher> block, MatchResult current) {
        var result = current;
        for (int i = 0; i < block.size(); i++) {
            var next = block.get(i).match(context, items.get(offset + i));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            var merged = result.mergedWith(next.get());
            if (merged.isEmpty()) {
                return Optional.empty();
            }
            result = merged.get();
        }
        return Optional.of(result);
    }

    private static ImmutableList<List<Matcher>> split(List<Matcher> elements) {
        var blocks = ImmutableList.<List<Matcher>>builder();
        var block = new ArrayList<Matcher>();
        for (var element : elements) {
            if (element == STAR) {
                blocks.add(List.copyOf(block));
                block.clear();
            } else {
                block.add(element);
            }
        }
        blocks.add(List.copyOf(block));
        return blocks.build();
    }

    private static final class Star implements Matcher {
        @Override
        public Optional<MatchResult> match(MatchContext context, Object candidate) {
            throw new IllegalStateException("Glob.STAR matches only inside a Glob");
        }

        @Override
        public String toString() {
            return "*";
        }
    }
}
