package org.pragmatica.ssr.substitution;

import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.substitution.DiffPart.DiffSpan;
import org.pragmatica.ssr.substitution.DiffPart.LabeledSpan;
import org.pragmatica.ssr.tree.Span;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Operations over substitutions: partitioning into labeled spans, diffs, selecting a disjoint
 * subset, and applying them to text.
 */
public final class Substitutions {
    private Substitutions() {}

    /**
     * Partition the covered text into consecutive spans, each under the set of labels active in it.
     *
     * <p>Spans are produced between every pair of adjacent label boundaries, so the result has no
     * gaps or overlaps. At a position where one label ends and another starts, the start is handled
     * first, which lets zero-width labels produce a zero-width span.
     */
    public static List<LabeledSpan> labeledSpans(Substitution substitution) {
        var startsAt = new TreeMap<Integer, Set<String>>();
        var endsAt = new TreeMap<Integer, Set<String>>();
        for (var entry : substitution.matchedSpans().entrySet()) {
            startsAt.computeIfAbsent(entry.getValue().start(), key -> new HashSet<>()).add(entry.getKey());
            endsAt.computeIfAbsent(entry.getValue().end(), key -> new HashSet<>()).add(entry.getKey());
        }
        var spans = ImmutableList.<LabeledSpan>builder();
        var current = new HashSet<String>();
        Integer rangeStart = null;
        while (!startsAt.isEmpty() || !endsAt.isEmpty()) {
            int position;
            if (!startsAt.isEmpty() && endsAt.isEmpty()) {
                throw new IllegalStateException("A span starts after all spans ended in " + substitution);
            }
            if (!startsAt.isEmpty() && startsAt.firstKey() <= endsAt.firstKey()) {
                var starting = startsAt.pollFirstEntry();
                position = starting.getKey();
                if (rangeStart != null) {
                    spans.add(new LabeledSpan(Span.of(rangeStart, position), current));
                }
                current.addAll(starting.getValue());
            } else {
                var ending = endsAt.pollFirstEntry();
                position = ending.getKey();
                if (rangeStart != null) {
                    spans.add(new LabeledSpan(Span.of(rangeStart, position), current));
                }
                current.removeAll(ending.getValue());
            }
            rangeStart = position;
        }
        return spans.build();
    }

    /**
     * The diff a substitution describes: labeled spans kept as they are, and one diff span per
     * replaced label.
     *
     * <p>Where replaced labels overlap, the label reaching farthest wins (then the greatest label),
     * and labeled spans starting inside an emitted diff span are dropped.
     */
    public static List<DiffPart> asDiff(Substitution substitution) {
        var replacements = substitution.replacements();
        var parts = ImmutableList.<DiffPart>builder();
        int lastDiffEnd = 0;
        for (var labeled : labeledSpans(substitution)) {
            if (labeled.span().start() < lastDiffEnd) {
                continue;
            }
            var replacing = labeled.labels()
                                   .stream()
                                   .filter(replacements::containsKey)
                                   .max(Comparator.<String>comparingInt(label -> substitution.matchedSpans()
                                                                                             .get(label)
                                                                                             .end())
                                                  .thenComparing(Comparator.naturalOrder()));
            if (replacing.isEmpty()) {
                parts.add(labeled);
                continue;
            }
            var label = replacing.get();
            var diff = new DiffSpan(substitution.matchedSpans().get(label), label, replacements.get(label));
            lastDiffEnd = diff.span().end();
            parts.add(diff);
        }
        return parts.build();
    }

    /**
     * A subset of substitutions with pairwise disjoint primary spans, ordered by primary span.
     *
     * <p>Greedy: going by start, an overlapping substitution replaces the previously kept one unless
     * its span is strictly longer, so of two equal spans the later one is kept. This is not
     * guaranteed to keep the most substitutions.
     */
    public static List<Substitution> disjoint(Collection<Substitution> substitutions) {
        var sorted = new ArrayList<>(substitutions);
        sorted.sort(Comparator.comparing(Substitution::primarySpan));
        var kept = ImmutableList.<Substitution>builder();
        Substitution last = null;
        for (var substitution : sorted) {
            var span = substitution.primarySpan();
            if (last != null) {
                var lastSpan = last.primarySpan();
                if (span.start() >= lastSpan.end()) {
                    kept.add(last);
                } else if (span.length() > lastSpan.length()) {
                    continue;
                }
            }
            last = substitution;
        }
        if (last != null) {
            kept.add(last);
        }
        return kept.build();
    }

    /**
     * Apply every replacement of every substitution to the text.
     *
     * @throws IllegalArgumentException if two replaced spans overlap
     */
    public static String apply(String text, Collection<Substitution> substitutions) {
        var edits = new ArrayList<Edit>();
        for (var substitution : substitutions) {
            if (substitution.hasReplacements()) {
                edits.add(concatenate(text, replacementsOf(substitution)));
            }
        }
        edits.sort(Comparator.comparingInt(Edit::start));
        if (edits.isEmpty()) {
            return text;
        }
        var interior = concatenate(text, edits);
        return text.substring(0, interior.start()) + interior.text() + text.substring(interior.end());
    }

    /**
     * Widen {@code [start, end)} to whole lines: back to just after the preceding line break and
     * forward to the next one. Negative offsets count from the end of the text.
     */
    public static Span lineExpandedSpan(String text, int start, int end) {
        int from = start < 0 ? text.length() + start : start;
        int to = end < 0 ? text.length() + end : end;
        to = Math.max(from, to);
        int left = text.lastIndexOf('\n', from - 1) + 1;
        int right = text.indexOf('\n', to);
        return Span.of(Math.min(from, left), right < 0 ? text.length() : right);
    }

    private record Edit(String text, int start, int end) {}

    private static List<Edit> replacementsOf(Substitution substitution) {
        return substitution.matchedSpans()
                           .entrySet()
                           .stream()
                           .filter(entry -> substitution.replacements().containsKey(entry.getKey()))
                           .sorted(Map.Entry.comparingByValue())
                           .map(entry -> new Edit(substitution.replacements().get(entry.getKey()),
                                                  entry.getValue().start(), entry.getValue().end()))
                           .toList();
    }

    private static Edit concatenate(String text, List<Edit> edits) {
        var joined = new StringBuilder();
        int firstStart = -1;
        int lastEnd = -1;
        for (var edit : edits) {
            if (firstStart < 0) {
                firstStart = edit.start();
            } else {
                if (lastEnd > edit.start()) {
                    throw new IllegalArgumentException("Rewrites overlap: end " + lastEnd + " > next start "
                                                       + edit.start() + " (was about to write text["
                                                       + edit.start() + ":" + edit.end() + "] <- '" + edit.text()
                                                       + "')");
                }
                joined.append(text, lastEnd, edit.start());
            }
            joined.append(edit.text());
            lastEnd = edit.end();
        }
        return new Edit(joined.toString(), Math.max(0, firstStart), Math.max(0, lastEnd));
    }
}
