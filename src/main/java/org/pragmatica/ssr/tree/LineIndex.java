package org.pragmatica.ssr.tree;

import com.github.javaparser.Position;

import java.util.Arrays;

/**
 * Maps between character offsets and 1-based line/column positions.
 * Recognizes {@code \n}, {@code \r\n} and {@code \r} as line terminators, the way the Java lexer does.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String text) {
        var starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
            } else if (c != '\n' && c != '\r') {
                continue;
            }
            if (count == starts.length) {
                starts = Arrays.copyOf(starts, count * 2);
            }
            starts[count++] = i + 1;
        }
        return new LineIndex(Arrays.copyOf(starts, count), text.length());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Offset of a 1-based line and column, clamped to the text.
     */
    public int offset(int line, int column) {
        if (line < 1) {
            return 0;
        }
        if (line > lineStarts.length) {
            return length;
        }
        return Math.min(length, lineStarts[line - 1] + Math.max(0, column - 1));
    }

    public int offset(Position position) {
        return offset(position.line, position.column);
    }

    public SourceLocation location(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return SourceLocation.at(line + 1, offset - lineStarts[line] + 1, offset);
    }

    public SourceSpan sourceSpan(Span span) {
        return SourceSpan.of(location(span.start()), location(span.end()));
    }

    public int lineStart(int offset) {
        return lineStarts[location(offset).line() - 1];
    }

    public int lineOf(int offset) {
        return location(offset).line();
    }
}
