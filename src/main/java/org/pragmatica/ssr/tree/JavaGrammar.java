package org.pragmatica.ssr.tree;

import com.github.javaparser.JavaParser;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Providers;
import com.github.javaparser.ast.Node;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.error.Diagnostic;
import org.pragmatica.ssr.error.ParseException;

import java.util.List;

/**
 * Adapter over JavaParser: parses text as a {@link FragmentKind} and exposes the token stream.
 */
public final class JavaGrammar {
    public static final String DEFAULT_PATH = "<string>";

    private JavaGrammar() {}

    /**
     * Parse text into a {@link ParsedUnit}.
     *
     * @throws ParseException if the text is not a well-formed fragment of the requested kind
     */
    public static ParsedUnit parse(String text, String path, FragmentKind kind) {
        ParseResult<? extends Node> result = new JavaParser(configuration()).parse(kind.parseStart(),
                                                                                   Providers.provider(text));
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw failure(text, path, result.getProblems());
        }
        var root = TreeNormalizer.normalize(result.getResult().get());
        return ParsedUnit.create(text, path, kind, root);
    }

    public static ParsedUnit parse(String text, FragmentKind kind) {
        return parse(text, DEFAULT_PATH, kind);
    }

    static ParserConfiguration configuration() {
        return new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    /**
     * All tokens of the tree rooted at {@code root}, from the first token of the input to the last.
     */
    static List<LexicalToken> tokens(Node root, LineIndex lines) {
        var range = root.getTokenRange();
        if (range.isEmpty()) {
            return List.of();
        }
        var token = range.get().getBegin();
        while (token.getPreviousToken().isPresent()) {
            token = token.getPreviousToken().get();
        }
        var builder = ImmutableList.<LexicalToken>builder();
        for (JavaToken current = token; current != null; current = current.getNextToken().orElse(null)) {
            if (current.getText().isEmpty() || current.getRange().isEmpty()) {
                continue;
            }
            int start = lines.offset(current.getRange().get().begin);
            builder.add(new LexicalToken(Span.of(start, start + current.getText().length()),
                                         current.getCategory(),
                                         current.getText()));
        }
        return builder.build();
    }

    private static ParseException failure(String text, String path, List<Problem> problems) {
        var lines = LineIndex.of(text);
        if (problems.isEmpty()) {
            var end = lines.location(text.length());
            return new ParseException(path, text, Diagnostic.error("could not parse input", SourceSpan.at(end)));
        }
        var problem = problems.get(0);
        var message = Splitter.on('\n').splitToList(problem.getMessage()).get(0).strip();
        var span = problem.getLocation()
                          .flatMap(tokens -> tokens.getBegin().getRange()
                                                   .map(begin -> {
                                                       int start = lines.offset(begin.begin);
                                                       int end = tokens.getEnd().getRange()
                                                                       .map(last -> Math.min(text.length(), lines.offset(last.end) + 1))
                                                                       .orElse(start);
                                                       return lines.sourceSpan(Span.of(start, Math.max(start, end)));
                                                   }))
                          .orElseGet(() -> SourceSpan.at(lines.location(text.length())));
        var diagnostic = Diagnostic.error(message, span);
        for (var other : problems.subList(1, problems.size())) {
            diagnostic = diagnostic.withNote(other.getMessage().lines().findFirst().orElse(""));
        }
        return new ParseException(path, text, diagnostic);
    }
}
