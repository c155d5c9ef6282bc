package org.pragmatica.ssr.pattern;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.pragmatica.ssr.error.ParseException;
import org.pragmatica.ssr.error.PatternCompileException;
import org.pragmatica.ssr.match.BindConflict;
import org.pragmatica.ssr.match.BindMerge;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.matcher.AllOf;
import org.pragmatica.ssr.matcher.Anything;
import org.pragmatica.ssr.matcher.Bind;
import org.pragmatica.ssr.matcher.Matcher;
import org.pragmatica.ssr.matcher.NodeMatcher;
import org.pragmatica.ssr.matcher.Rebind;
import org.pragmatica.ssr.matcher.Unparenthesized;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.Trees;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A matcher written as a fragment of Java source with {@code $name} metavariables.
 *
 * <p>The pattern matches syntax trees of the same shape, ignoring comments, formatting and
 * parentheses. Every metavariable stands for an identifier reference in the pattern and matches any
 * subtree in that position; a metavariable used twice requires structurally equivalent subtrees.
 *
 * <pre>{@code
 * var pattern = SyntaxPattern.compile("$list.size() == 0", FragmentKind.EXPRESSION);
 * }</pre>
 */
public final class SyntaxPattern implements Matcher {
    private final String source;
    private final FragmentKind kind;
    private final Matcher compiled;

    private SyntaxPattern(String source, FragmentKind kind, Matcher compiled) {
        this.source = source;
        this.kind = kind;
        this.compiled = compiled;
    }

    public static SyntaxPattern compile(String source, FragmentKind kind) {
        return compile(source, kind, Map.of());
    }

    /**
     * Compile a pattern whose metavariables are further restricted.
     *
     * @param restrictions matcher per metavariable name; unrestricted metavariables match anything
     * @throws PatternCompileException if the pattern does not parse, a metavariable is malformed or
     *                                 not in an identifier reference position, or a restriction names
     *                                 an unknown metavariable
     */
    public static SyntaxPattern compile(String source, FragmentKind kind, Map<String, ? extends Matcher> restrictions) {
        var placeholders = Placeholders.scan(source, kind);
        var unknown = Sets.difference(restrictions.keySet(), placeholders.renamed().keySet());
        if (!unknown.isEmpty()) {
            throw new PatternCompileException("Restrictions name metavariables missing from the pattern: "
                                              + new TreeSet<>(unknown) + ". Did you misplace a '$'?");
        }
        var binds = ImmutableMap.<String, Matcher>builder();
        placeholders.renamed().forEach((name, fresh) -> {
            Matcher restriction = restrictions.containsKey(name) ? restrictions.get(name) : Anything.INSTANCE;
            binds.put(fresh, Bind.of(name, new Unparenthesized(restriction),
                                     BindConflict.MERGE_EQUIVALENT_AST, BindMerge.KEEP_LAST));
        });
        var compiler = TreeCompiler.withPlaceholders(binds.build());
        var tree = parseRenamed(source, placeholders, kind);
        var matcher = compiler.compile(tree);
        var missing = Sets.difference(placeholders.renamed().keySet(),
                                      originalsOf(compiler.surfaced(), placeholders.originals()));
        if (!missing.isEmpty()) {
            throw new PatternCompileException("Metavariables must stand for identifier references, these do not: "
                                              + new TreeSet<>(missing));
        }
        if (placeholders.renamed().containsValue(topIdentifier(tree).orElse(null))) {
            matcher = AllOf.of(NodeMatcher.of(kindClass(kind)), matcher);
        }
        return new SyntaxPattern(source, kind, new Rebind(matcher, BindConflict.MERGE, BindMerge.KEEP_LAST));
    }

    /**
     * The matcher for exactly this tree, up to comments, formatting and parentheses.
     */
    public static Matcher exactly(Node tree) {
        return TreeCompiler.withPlaceholders(Map.of()).compile(tree);
    }

    public String source() {
        return source;
    }

    public FragmentKind kind() {
        return kind;
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        return compiled.match(context, candidate);
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return compiled.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return compiled.bindVariables();
    }

    @Override
    public String toString() {
        return "SyntaxPattern[" + kind + " " + source + "]";
    }

    private static Node parseRenamed(String source, Placeholders placeholders, FragmentKind kind) {
        try {
            return JavaGrammar.parse(placeholders.renamedText(), Placeholders.PATTERN_PATH, kind).root();
        } catch (ParseException e) {
            throw new PatternCompileException("Failed to parse pattern as " + kind, placeholders.renamedText(),
                                              e.diagnostic());
        }
    }

    private static Set<String> originalsOf(Set<String> fresh, Map<String, String> originals) {
        var names = ImmutableSet.<String>builder();
        for (var name : fresh) {
            names.add(originals.get(name));
        }
        return names.build();
    }

    // A pattern that is a lone metavariable still only matches fragments of its own kind.
    private static Optional<String> topIdentifier(Node tree) {
        return Trees.identifierOf(Trees.unparenthesized(tree));
    }

    private static Class<? extends Node> kindClass(FragmentKind kind) {
        return switch (kind) {
            case EXPRESSION -> Expression.class;
            case STATEMENT -> Statement.class;
            case MEMBER -> BodyDeclaration.class;
            case UNIT -> CompilationUnit.class;
        };
    }
}
