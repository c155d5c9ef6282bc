package org.pragmatica.ssr.tree;

/**
 * A range of source text with line/column information, used for diagnostics.
 * The start is inclusive and the end exclusive.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public Span offsets() {
        return Span.of(start.offset(), end.offset());
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
