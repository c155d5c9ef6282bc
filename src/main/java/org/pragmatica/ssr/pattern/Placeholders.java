package org.pragmatica.ssr.pattern;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.ssr.error.Diagnostic;
import org.pragmatica.ssr.error.ParseException;
import org.pragmatica.ssr.error.PatternCompileException;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.LexicalToken;
import org.pragmatica.ssr.tree.LineIndex;
import org.pragmatica.ssr.tree.Span;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The {@code $name} placeholders of a pattern or template source, located by lexing the source.
 *
 * <p>{@code $name} is itself a legal Java identifier, so the source is lexed as the requested kind
 * and identifier tokens starting with {@code $} are taken as placeholders. Each distinct name is
 * renamed to an identifier that does not otherwise occur in the source.
 *
 * @param source      the original source
 * @param occurrences every placeholder token, in source order
 * @param renamed     original name to fresh identifier
 * @param renamedText the source with every placeholder replaced by its fresh identifier
 */
public record Placeholders(String source,
                           ImmutableList<Occurrence> occurrences,
                           ImmutableMap<String, String> renamed,
                           String renamedText) {
    static final String PATTERN_PATH = "<pattern>";

    private static final Pattern NAME = Pattern.compile("[a-zA-Z_]\\w*");
    private static final Pattern SPACED_PLACEHOLDER = Pattern.compile("\\$\\s+[a-zA-Z_]");

    /**
     * One {@code $name} token.
     */
    public record Occurrence(Span span, String name) {}

    /**
     * @throws PatternCompileException if the source does not lex as {@code kind}, or holds a malformed
     *                                 placeholder
     */
    public static Placeholders scan(String source, FragmentKind kind) {
        var tokens = lex(source, kind);
        var lines = LineIndex.of(source);
        var occurrences = ImmutableList.<Occurrence>builder();
        var taken = new HashSet<String>();
        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            if (!token.isIdentifier()) {
                continue;
            }
            if (!token.text().startsWith("$")) {
                taken.add(token.text());
                continue;
            }
            var name = token.text().substring(1);
            if (name.isEmpty()) {
                throw bareDollar(source, lines, tokens, i);
            }
            if (!NAME.matcher(name).matches() || name.startsWith("__")) {
                throw error(source, lines, token.span(), "invalid metavariable name '" + name + "'",
                            "names are identifiers of letters, digits and '_' that do not start with '__'");
            }
            occurrences.add(new Occurrence(token.span(), name));
        }
        var found = occurrences.build();
        var renamed = rename(found, taken);
        return new Placeholders(source, found, renamed, substitute(source, found, renamed));
    }

    /**
     * Fresh identifier to original name.
     */
    public ImmutableMap<String, String> originals() {
        return ImmutableBiMap.copyOf(renamed).inverse();
    }

    private static List<LexicalToken> lex(String source, FragmentKind kind) {
        try {
            return JavaGrammar.parse(source, PATTERN_PATH, kind).tokens();
        } catch (ParseException e) {
            var spaced = SPACED_PLACEHOLDER.matcher(source);
            if (spaced.find()) {
                throw error(source, LineIndex.of(source), Span.of(spaced.start(), spaced.end() - 1),
                            "whitespace between '$' and the metavariable name",
                            "write '$name' without spaces");
            }
            throw new PatternCompileException("Failed to parse pattern as " + kind, source, e.diagnostic());
        }
    }

    private static PatternCompileException bareDollar(String source, LineIndex lines, List<LexicalToken> tokens,
                                                      int index) {
        var dollar = tokens.get(index).span();
        int next = index + 1;
        while (next < tokens.size() && tokens.get(next).isWhitespace()) {
            next++;
        }
        if (next > index + 1 && next < tokens.size() && tokens.get(next).isIdentifier()) {
            return error(source, lines, Span.of(dollar.start(), tokens.get(next).start()),
                         "whitespace between '$' and the metavariable name", "write '$name' without spaces");
        }
        return error(source, lines, dollar, "'$' without a metavariable name", "write '$name'");
    }

    private static ImmutableMap<String, String> rename(List<Occurrence> occurrences, HashSet<String> taken) {
        var renamed = new LinkedHashMap<String, String>();
        for (var occurrence : occurrences) {
            if (renamed.containsKey(occurrence.name())) {
                continue;
            }
            var candidate = "gensym_" + occurrence.name();
            for (int suffix = 0; taken.contains(candidate); suffix++) {
                candidate = "gensym" + suffix + "_" + occurrence.name();
            }
            taken.add(candidate);
            renamed.put(occurrence.name(), candidate);
        }
        return ImmutableMap.copyOf(renamed);
    }

    private static String substitute(String source, List<Occurrence> occurrences, ImmutableMap<String, String> names) {
        var text = new StringBuilder();
        int last = 0;
        for (var occurrence : occurrences) {
            text.append(source, last, occurrence.span().start())
                .append(names.get(occurrence.name()));
            last = occurrence.span().end();
        }
        return text.append(source.substring(last)).toString();
    }

    private static PatternCompileException error(String source, LineIndex lines, Span span, String message,
                                                 String help) {
        var diagnostic = Diagnostic.error(message, lines.sourceSpan(span))
                                   .withLabel("here")
                                   .withNote(help);
        return new PatternCompileException(message, source, diagnostic);
    }
}
