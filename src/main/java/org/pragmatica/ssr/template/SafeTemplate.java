package org.pragmatica.ssr.template;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.ssr.error.ParseException;
import org.pragmatica.ssr.error.PatternCompileException;
import org.pragmatica.ssr.error.RewriteException;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.matcher.Matcher;
import org.pragmatica.ssr.pattern.Placeholders;
import org.pragmatica.ssr.pattern.SyntaxPattern;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.TreeNavigator;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Syntax-aware template: the rendered code is guaranteed to parse into the tree the template
 * describes, with every bound expression intact.
 *
 * <p>Bound expressions are first inserted in parentheses, and the result is checked against the
 * template's own pattern. The parentheses are then dropped one variable at a time wherever that
 * leaves the tree unchanged. When the replaced fragment is itself an expression, the same is done
 * for the replacement within its enclosing expression or statement, so that e.g. replacing {@code x}
 * with {@code x + 1} in {@code x * 2} gives {@code (x + 1) * 2}.
 */
public final class SafeTemplate implements Template {
    private static final Logger logger = LogManager.getLogger(SafeTemplate.class);
    private static final String CURRENT = "current_expr";
    private static final String TEMPLATE_PATH = "<template>";

    private final String source;
    private final FragmentKind kind;
    private final Placeholders placeholders;
    private final SyntaxPattern pattern;

    private SafeTemplate(String source, FragmentKind kind, Placeholders placeholders, SyntaxPattern pattern) {
        this.source = source;
        this.kind = kind;
        this.placeholders = placeholders;
        this.pattern = pattern;
    }

    /**
     * @throws PatternCompileException if the template is not a well-formed fragment of {@code kind}
     */
    public static SafeTemplate of(String source, FragmentKind kind) {
        return new SafeTemplate(source, kind, Placeholders.scan(source, kind), SyntaxPattern.compile(source, kind));
    }

    public static SafeTemplate expression(String source) {
        return of(source, FragmentKind.EXPRESSION);
    }

    public static SafeTemplate statement(String source) {
        return of(source, FragmentKind.STATEMENT);
    }

    public FragmentKind kind() {
        return kind;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public Set<String> variables() {
        return placeholders.renamed().keySet();
    }

    @Override
    public String substitute(ParsedUnit unit, Fragment match, Map<String, Fragment> bindings) {
        var texts = new LinkedHashMap<String, String>();
        var matchers = new HashMap<String, Matcher>();
        for (var entry : bindings.entrySet()) {
            var fragment = entry.getValue();
            if (fragment.text().isEmpty()) {
                continue;
            }
            texts.put(entry.getKey(), fragment.text().get());
            if (fragment instanceof Fragment.Syntax syntax && syntax.node() instanceof Expression) {
                matchers.put(entry.getKey(), SyntaxPattern.exactly(syntax.node()));
            }
        }
        var replacement = parenthesize(matchers, texts).replacement();
        if (match instanceof Fragment.Syntax syntax && syntax.node() instanceof Expression) {
            return inContext(unit, syntax, replacement);
        }
        return replacement;
    }

    @Override
    public String toString() {
        return "SafeTemplate[" + kind + " " + source + "]";
    }

    private record Parenthesized(String replacement, Map<String, String> texts) {}

    /**
     * Substitute with every bound expression parenthesized, verify, then drop the parentheses that
     * are not needed.
     */
    private Parenthesized parenthesize(Map<String, Matcher> matchers, Map<String, String> texts) {
        var safe = new HashMap<String, String>();
        var bare = new LinkedHashMap<String, String>();
        for (var entry : texts.entrySet()) {
            if (matchers.containsKey(entry.getKey()) && variables().contains(entry.getKey())) {
                safe.put(entry.getKey(), "(" + entry.getValue() + ")");
                bare.put(entry.getKey(), entry.getValue());
            } else {
                safe.put(entry.getKey(), entry.getValue());
            }
        }
        var replacement = render(safe);
        var parsed = parse(replacement);
        verify(parsed, matchers, texts, replacement);

        var exact = SyntaxPattern.exactly(parsed.root());
        for (var entry : bare.entrySet()) {
            var parenthesized = safe.put(entry.getKey(), entry.getValue());
            var alternative = render(safe);
            if (matchesExactly(exact, alternative)) {
                replacement = alternative;
            } else {
                safe.put(entry.getKey(), parenthesized);
            }
        }
        return new Parenthesized(replacement, safe);
    }

    private void verify(ParsedUnit parsed, Map<String, Matcher> matchers, Map<String, String> texts,
                        String replacement) {
        var context = MatchContext.of(parsed);
        var result = pattern.match(context, parsed.root())
                            .orElseThrow(() -> new RewriteException("Rendering " + this + " with " + texts
                                                                    + " produced a different tree: " + replacement));
        for (var entry : result.bindings().entrySet()) {
            var expected = matchers.get(entry.getKey());
            if (expected == null) {
                continue;
            }
            var node = entry.getValue().value().matched().orElse(null);
            if (expected.match(context, node).isEmpty()) {
                throw new RewriteException("Rendering " + this + " corrupted $" + entry.getKey() + " ("
                                           + texts.get(entry.getKey()) + "): " + replacement);
            }
        }
    }

    private boolean matchesExactly(Matcher exact, String alternative) {
        try {
            var parsed = JavaGrammar.parse(alternative, TEMPLATE_PATH, kind);
            return exact.match(MatchContext.of(parsed), parsed.root()).isPresent();
        } catch (ParseException e) {
            logger.debug("Keeping parentheses, '{}' does not parse: {}", alternative, e.getMessage());
            return false;
        }
    }

    private ParsedUnit parse(String replacement) {
        try {
            return JavaGrammar.parse(replacement, TEMPLATE_PATH, kind);
        } catch (ParseException e) {
            throw new RewriteException("Rendering " + this + " produced code that does not parse: " + replacement, e);
        }
    }

    private String render(Map<String, String> texts) {
        var text = new StringBuilder();
        int last = 0;
        for (var occurrence : placeholders.occurrences()) {
            var value = texts.get(occurrence.name());
            if (value == null) {
                throw new RewriteException("No source text bound to $" + occurrence.name() + " for " + this);
            }
            text.append(source, last, occurrence.span().start()).append(value);
            last = occurrence.span().end();
        }
        return text.append(source.substring(last)).toString();
    }

    /**
     * Parenthesize an expression replacement as its surroundings require.
     */
    private String inContext(ParsedUnit unit, Fragment.Syntax match, String replacement) {
        var navigator = unit.navigator();
        var parent = navigator.parent(match.node()).orElse(null);
        if (parent == null || parent instanceof ExpressionStmt || TreeNavigator.isCompoundStatement(parent)) {
            return replacement;
        }
        while (!isContext(unit, parent)) {
            var next = navigator.parent(parent).orElse(null);
            if (next == null || TreeNavigator.isCompoundStatement(next)) {
                return replacement;
            }
            parent = next;
        }
        var context = unit.spanOf(parent).orElseThrow();
        var prefix = unit.text().substring(context.start(), match.range().start());
        var suffix = unit.text().substring(match.range().end(), context.end());
        var wrapperKind = FragmentKind.STATEMENT;
        if (parent instanceof Expression) {
            prefix = "(" + prefix;
            suffix = suffix + ")";
            wrapperKind = FragmentKind.EXPRESSION;
        }
        Matcher current;
        try {
            current = SyntaxPattern.exactly(JavaGrammar.parse(replacement, TEMPLATE_PATH, FragmentKind.EXPRESSION).root());
        } catch (ParseException e) {
            throw new RewriteException("Non-expression " + this + " cannot replace an expression: " + replacement, e);
        }
        SafeTemplate wrapper;
        try {
            wrapper = of(prefix + "$" + CURRENT + suffix, wrapperKind);
        } catch (PatternCompileException e) {
            logger.debug("Not checking '{}' in its context: {}", replacement, e.getMessage());
            return replacement;
        }
        if (!wrapper.variables().equals(Set.of(CURRENT))) {
            return replacement;
        }
        return wrapper.parenthesize(ImmutableMap.of(CURRENT, current), ImmutableMap.of(CURRENT, replacement))
                      .texts()
                      .get(CURRENT);
    }

    private static boolean isContext(ParsedUnit unit, Object element) {
        return (element instanceof Expression && !(element instanceof VariableDeclarationExpr)
                || element instanceof Statement)
               && unit.spanOf(element).isPresent();
    }
}
