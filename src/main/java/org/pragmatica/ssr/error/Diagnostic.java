package org.pragmatica.ssr.error;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A message about a span of source text, rendered with carets under the offending text.
 *
 * <p>Example output:
 * <pre>
 * error: Parse error. Found "+"
 *   --> Pattern.java:1:5
 *   |
 * 1 | a + + b
 *   |     ^ here
 *   |
 *   = note: pattern kind is EXPRESSION
 * </pre>
 *
 * @param severity severity level
 * @param message  primary message
 * @param span     where the problem is
 * @param labels   underlined spans; the implicit primary label is used when empty
 * @param notes    trailing notes
 */
public record Diagnostic(Severity severity, String message, SourceSpan span, List<Label> labels, List<String> notes) {

    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * An underlined span; the primary one is drawn with {@code ^}, others with {@code -}.
     */
    public record Label(SourceSpan span, String message, boolean primary) {}

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String label) {
        return withLabel(new Label(span, label, true));
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String label) {
        return withLabel(new Label(labelSpan, label, false));
    }

    public Diagnostic withNote(String note) {
        return new Diagnostic(severity, message, span, labels,
                              ImmutableList.<String>builder().addAll(notes).add(note).build());
    }

    private Diagnostic withLabel(Label label) {
        return new Diagnostic(severity, message, span,
                              ImmutableList.<Label>builder().addAll(labels).add(label).build(), notes);
    }

    /**
     * Render with the source lines the labels point into.
     */
    public String format(String source, String filename) {
        var lines = source.split("\r\n|\r|\n", -1);
        var shown = shownLabels();
        int firstLine = shown.stream().mapToInt(label -> label.span().start().line()).min().orElse(1);
        int lastLine = shown.stream().mapToInt(label -> label.span().end().line()).max().orElse(1);
        int gutter = String.valueOf(lastLine).length();
        var margin = Strings.repeat(" ", gutter + 1) + "|\n";

        var out = new StringBuilder()
            .append(severity.display()).append(": ").append(message).append('\n')
            .append("  --> ").append(filename).append(':').append(span.start()).append('\n')
            .append(margin);

        for (int line = Math.max(1, firstLine); line <= Math.min(lastLine, lines.length); line++) {
            var content = lines[line - 1];
            out.append(Strings.padStart(String.valueOf(line), gutter, ' ')).append(" | ").append(content).append('\n');
            var underline = underline(line, content, shown);
            if (!underline.isEmpty()) {
                out.append(Strings.repeat(" ", gutter)).append(" | ").append(underline).append('\n');
            }
        }
        out.append(margin);
        for (var note : notes) {
            out.append(Strings.repeat(" ", gutter + 1)).append("= note: ").append(note).append('\n');
        }
        return out.toString();
    }

    /**
     * One-line rendering: {@code file:line:column: severity: message}.
     */
    public String formatSimple(String filename) {
        return filename + ":" + span.start() + ": " + severity.display() + ": " + message;
    }

    private List<Label> shownLabels() {
        return labels.isEmpty() ? List.of(new Label(span, "", true)) : labels;
    }

    private static String underline(int line, String content, List<Label> labels) {
        var onLine = new ArrayList<Label>();
        for (var label : labels) {
            if (label.span().start().line() <= line && line <= label.span().end().line()) {
                onLine.add(label);
            }
        }
        onLine.sort(Comparator.comparingInt(label -> label.span().start().column()));

        var out = new StringBuilder();
        for (var label : onLine) {
            int from = label.span().start().line() == line ? label.span().start().column() : 1;
            int to = label.span().end().line() == line ? label.span().end().column() : content.length() + 1;
            if (out.length() < from - 1) {
                out.append(Strings.repeat(" ", from - 1 - out.length()));
            }
            out.append(Strings.repeat(label.primary() ? "^" : "-", Math.max(1, to - from)));
            if (!label.message().isEmpty()) {
                out.append(' ').append(label.message());
            }
        }
        return out.toString();
    }
}
