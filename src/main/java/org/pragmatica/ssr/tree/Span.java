package org.pragmatica.ssr.tree;

import com.google.common.base.Preconditions;

import java.util.Comparator;

/**
 * Half-open range of character offsets {@code [start, end)}.
 */
public record Span(int start, int end) implements Comparable<Span> {

    private static final Comparator<Span> ORDER = Comparator.comparingInt(Span::start)
                                                            .thenComparingInt(Span::end);

    public Span {
        Preconditions.checkArgument(start >= 0, "Span start must not be negative: %s", start);
        Preconditions.checkArgument(start <= end, "Span start %s is after its end %s", start, end);
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean encloses(Span other) {
        return start <= other.start && other.end <= end;
    }

    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    public Span shift(int delta) {
        return new Span(start + delta, end + delta);
    }

    public String extract(String text) {
        return text.substring(start, end);
    }

    @Override
    public int compareTo(Span other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
