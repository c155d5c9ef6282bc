package org.pragmatica.ssr.tree;

import com.github.javaparser.ast.Node;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * A parsed piece of Java source: the text, its syntax tree, token stream and directives.
 *
 * <p>Built once per distinct text and path, then treated as immutable. The navigator is derived
 * lazily on first use.
 */
public final class ParsedUnit {
    private final String text;
    private final String path;
    private final FragmentKind kind;
    private final Node root;
    private final LineIndex lines;
    private final ImmutableList<LexicalToken> tokens;
    private final ImmutableList<Pragma> pragmas;
    private final Supplier<TreeNavigator> navigator;

    private ParsedUnit(String text, String path, FragmentKind kind, Node root, LineIndex lines,
                       ImmutableList<LexicalToken> tokens) {
        this.text = text;
        this.path = path;
        this.kind = kind;
        this.root = root;
        this.lines = lines;
        this.tokens = tokens;
        this.pragmas = Pragma.scan(text, lines, tokens);
        this.navigator = Suppliers.memoize(() -> TreeNavigator.of(root));
    }

    static ParsedUnit create(String text, String path, FragmentKind kind, Node root) {
        var lines = LineIndex.of(text);
        return new ParsedUnit(text, path, kind, root, lines,
                              ImmutableList.copyOf(JavaGrammar.tokens(root, lines)));
    }

    public String text() {
        return text;
    }

    public String path() {
        return path;
    }

    public FragmentKind kind() {
        return kind;
    }

    public Node root() {
        return root;
    }

    public LineIndex lines() {
        return lines;
    }

    public List<LexicalToken> tokens() {
        return tokens;
    }

    public List<Pragma> pragmas() {
        return pragmas;
    }

    public TreeNavigator navigator() {
        return navigator.get();
    }

    /**
     * Character span of a syntax node, if the candidate is a node that carries a source range.
     */
    public Optional<Span> spanOf(Object candidate) {
        if (!(candidate instanceof Node node)) {
            return Optional.empty();
        }
        return node.getRange()
                   .map(range -> Span.of(lines.offset(range.begin),
                                         Math.min(text.length(), lines.offset(range.end) + 1)));
    }

    public String textOf(Span span) {
        return span.extract(text);
    }

    public List<LexicalToken> tokensWithin(Span span) {
        return tokens.stream()
                     .filter(token -> span.encloses(token.span()))
                     .toList();
    }

    @Override
    public String toString() {
        return "ParsedUnit[" + path + ", " + kind + "]";
    }
}
