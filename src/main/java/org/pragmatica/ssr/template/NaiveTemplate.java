package org.pragmatica.ssr.template;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.error.PatternCompileException;
import org.pragmatica.ssr.error.RewriteException;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Textual template: {@code $name} and {@code ${name}} insert the source text bound to {@code name},
 * {@code $$} inserts a single {@code $}. Nothing is parenthesized or checked.
 */
public final class NaiveTemplate implements Template {
    private static final Pattern PLACEHOLDER = Pattern.compile(
        "\\$(?:(?<escaped>\\$)|(?<named>[a-zA-Z_]\\w*)|\\{(?<braced>[a-zA-Z_]\\w*)}|(?<invalid>))");

    private sealed interface Part {}

    private record Literal(String text) implements Part {}

    private record Variable(String name) implements Part {}

    private final String source;
    private final ImmutableList<Part> parts;
    private final ImmutableSet<String> variables;

    private NaiveTemplate(String source, ImmutableList<Part> parts) {
        this.source = source;
        this.parts = parts;
        this.variables = parts.stream()
                              .filter(Variable.class::isInstance)
                              .map(part -> ((Variable) part).name())
                              .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * @throws PatternCompileException on a {@code $} that is neither an escape nor a placeholder
     */
    public static NaiveTemplate of(String source) {
        var parts = ImmutableList.<Part>builder();
        var scan = PLACEHOLDER.matcher(source);
        int last = 0;
        while (scan.find()) {
            if (scan.group("invalid") != null) {
                throw new PatternCompileException("Invalid placeholder at offset " + scan.start() + " in template: "
                                                  + source);
            }
            if (scan.start() > last) {
                parts.add(new Literal(source.substring(last, scan.start())));
            }
            if (scan.group("escaped") != null) {
                parts.add(new Literal("$"));
            } else {
                var name = scan.group("named") != null ? scan.group("named") : scan.group("braced");
                parts.add(new Variable(name));
            }
            last = scan.end();
        }
        if (last < source.length()) {
            parts.add(new Literal(source.substring(last)));
        }
        return new NaiveTemplate(source, parts.build());
    }

    @Override
    public String substitute(ParsedUnit unit, Fragment match, Map<String, Fragment> bindings) {
        var result = new StringBuilder();
        for (var part : parts) {
            if (part instanceof Literal literal) {
                result.append(literal.text());
            } else if (part instanceof Variable variable) {
                result.append(textOf(variable.name(), bindings));
            }
        }
        return result.toString();
    }

    @Override
    public Set<String> variables() {
        return variables;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "NaiveTemplate[" + source + "]";
    }

    private static String textOf(String name, Map<String, Fragment> bindings) {
        var fragment = bindings.get(name);
        if (fragment == null || fragment.text().isEmpty()) {
            throw new RewriteException("No source text bound to $" + name);
        }
        return fragment.text().get();
    }
}
