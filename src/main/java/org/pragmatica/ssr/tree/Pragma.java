package org.pragmatica.ssr.tree;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A directive embedded in a comment, e.g. {@code // ssr: disable=idiom.loops}.
 *
 * <p>A directive comment on a line of its own applies from the comment to the end of the enclosing
 * block. A directive trailing code applies to the line it is on.
 *
 * @param tag   the directive namespace, e.g. {@code ssr}
 * @param data  key/value pairs of the directive
 * @param start first offset the directive applies to
 * @param end   offset after the last character the directive applies to
 */
public record Pragma(String tag, ImmutableMap<String, String> data, int start, int end) {

    private static final Pattern DIRECTIVE = Pattern.compile(
        "(?:[^-\\w]|\\A)(?<tag>[-\\w]+)\\s*:\\s*"
        + "(?<data>[-\\w]+\\s*=\\s*[-\\w.]+\\s*(?:,\\s*[-\\w]+\\s*=\\s*[-\\w.]+\\s*)*)(?:,\\s*)?\\z");
    private static final Splitter PAIRS = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Splitter KEY_VALUE = Splitter.on('=').trimResults().limit(2);

    /**
     * Parse the directive, if any, in the text of a comment token.
     */
    public static Optional<Pragma> fromComment(String comment, int start, int end) {
        var matcher = DIRECTIVE.matcher(commentBody(comment));
        if (!matcher.find()) {
            return Optional.empty();
        }
        var data = ImmutableMap.<String, String>builder();
        for (var pair : PAIRS.split(matcher.group("data"))) {
            var keyValue = KEY_VALUE.splitToList(pair);
            data.put(keyValue.get(0), keyValue.get(1));
        }
        return Optional.of(new Pragma(matcher.group("tag"), data.buildKeepingLast(), start, end));
    }

    /**
     * Find every directive among the comment tokens of a unit, sorted by start offset.
     */
    static ImmutableList<Pragma> scan(String text, LineIndex lines, List<LexicalToken> tokens) {
        var pragmas = new ArrayList<Pragma>();
        var pending = new ArrayList<Pending>();
        int depth = 0;

        for (var token : tokens) {
            if (token.text().equals("{") && !token.isComment()) {
                depth++;
            } else if (token.text().equals("}") && !token.isComment()) {
                closeBlock(pending, pragmas, depth, token.start());
                depth--;
            } else if (token.isComment()) {
                int lineStart = lines.lineStart(token.start());
                boolean ownLine = CharMatcher.whitespace().matchesAllOf(text.substring(lineStart, token.start()));
                if (ownLine) {
                    int level = depth;
                    fromComment(token.text(), token.start(), token.start())
                        .ifPresent(pragma -> pending.add(new Pending(pragma, level)));
                } else {
                    fromComment(token.text(), lineStart, token.end()).ifPresent(pragmas::add);
                }
            }
        }
        for (var open : pending) {
            pragmas.add(open.closeAt(text.length()));
        }
        pragmas.sort(Comparator.comparingInt(Pragma::start).thenComparingInt(Pragma::end));
        return ImmutableList.copyOf(pragmas);
    }

    private static void closeBlock(List<Pending> pending, List<Pragma> pragmas, int depth, int offset) {
        var iterator = pending.iterator();
        while (iterator.hasNext()) {
            var open = iterator.next();
            if (open.depth() >= depth) {
                pragmas.add(open.closeAt(offset));
                iterator.remove();
            }
        }
    }

    private static String commentBody(String comment) {
        var body = comment.strip();
        if (body.startsWith("//")) {
            return body.substring(2).strip();
        }
        if (body.startsWith("/*")) {
            body = body.substring(2);
            if (body.endsWith("*/")) {
                body = body.substring(0, body.length() - 2);
            }
            return CharMatcher.is('*').trimLeadingFrom(body.strip()).strip();
        }
        return body;
    }

    private record Pending(Pragma pragma, int depth) {
        Pragma closeAt(int end) {
            return new Pragma(pragma.tag(), pragma.data(), pragma.start(), end);
        }
    }
}
