package org.pragmatica.ssr.matcher;

import com.github.difflib.DiffUtils;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.ssr.match.BoundValue;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.template.LiteralTemplate;
import org.pragmatica.ssr.template.Template;
import org.pragmatica.ssr.tree.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base class for rewrites that transform the text of a whole unit at once, e.g. an external
 * formatter.
 *
 * <p>Matches only the root of the unit, and only if {@link #rewrite} changes the text. The change is
 * reported as a line diff: every changed region {@code i} binds {@code <prefix>i} to the original
 * lines and carries a replacement with the new lines.
 */
public abstract class ExternalRewrite implements Matcher {
    public static final String DEFAULT_PREFIX = "__external";

    private final String labelPrefix;

    protected ExternalRewrite() {
        this(DEFAULT_PREFIX);
    }

    protected ExternalRewrite(String labelPrefix) {
        this.labelPrefix = labelPrefix;
    }

    /**
     * The rewritten text, or empty to leave the unit alone.
     */
    protected abstract Optional<String> rewrite(MatchContext context, String text);

    @Override
    public final Optional<MatchResult> match(MatchContext context, Object candidate) {
        var unit = context.unit();
        if (candidate != unit.root()) {
            return Optional.empty();
        }
        var rewritten = rewrite(context, unit.text());
        if (rewritten.isEmpty() || rewritten.get().equals(unit.text())) {
            return Optional.empty();
        }
        var source = splitLines(unit.text());
        var target = splitLines(rewritten.get());
        var starts = lineOffsets(source);

        var bindings = ImmutableMap.<String, BoundValue>builder();
        var replacements = ImmutableMap.<String, Template>builder();
        int index = 0;
        for (var delta : DiffUtils.diff(source, target).getDeltas()) {
            int first = delta.getSource().getPosition();
            var span = Span.of(starts.get(first), starts.get(first + delta.getSource().size()));
            var label = labelPrefix + index++;
            bindings.put(label, BoundValue.of(Fragment.spanned(unit.text(), span)));
            replacements.put(label, new LiteralTemplate(String.join("", delta.getTarget().getLines())));
        }
        return Optional.of(MatchResult.of(Fragment.of(unit, candidate), bindings.build())
                                      .withReplacements(replacements.build()));
    }

    /**
     * Lines with their terminators kept, so that joining them gives back the text.
     */
    static List<String> splitLines(String text) {
        var lines = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
            } else if (c != '\n' && c != '\r') {
                continue;
            }
            lines.add(text.substring(start, i + 1));
            start = i + 1;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    private static List<Integer> lineOffsets(List<String> lines) {
        var offsets = new ArrayList<Integer>(lines.size() + 1);
        int offset = 0;
        offsets.add(offset);
        for (var line : lines) {
            offset += line.length();
            offsets.add(offset);
        }
        return offsets;
    }
}
