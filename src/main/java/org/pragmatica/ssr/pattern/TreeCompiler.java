package org.pragmatica.ssr.pattern;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.matcher.Equals;
import org.pragmatica.ssr.matcher.ItemsAre;
import org.pragmatica.ssr.matcher.Matcher;
import org.pragmatica.ssr.matcher.NodeMatcher;
import org.pragmatica.ssr.tree.Trees;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a syntax tree into the matcher for exactly that tree, with identifier references named by
 * a placeholder replaced by the placeholder's matcher.
 */
final class TreeCompiler {
    private final Map<String, Matcher> placeholders;
    private final Set<String> surfaced = new HashSet<>();

    private TreeCompiler(Map<String, Matcher> placeholders) {
        this.placeholders = placeholders;
    }

    static TreeCompiler withPlaceholders(Map<String, Matcher> placeholders) {
        return new TreeCompiler(placeholders);
    }

    /**
     * Identifiers of the placeholders compiled so far.
     */
    Set<String> surfaced() {
        return surfaced;
    }

    Matcher compile(Object element) {
        if (element instanceof EnclosedExpr enclosed) {
            return compile(enclosed.getInner());
        }
        if (element instanceof NodeList<?> list) {
            var items = ImmutableList.<Matcher>builder();
            for (var item : list) {
                items.add(compile(item));
            }
            return new ItemsAre(items.build());
        }
        if (!(element instanceof Node node)) {
            return new Equals(element);
        }
        var identifier = Trees.identifierOf(node);
        if (identifier.isPresent() && placeholders.containsKey(identifier.get())) {
            surfaced.add(identifier.get());
            return placeholders.get(identifier.get());
        }
        var fields = new LinkedHashMap<String, Matcher>();
        for (var field : Trees.fields(node)) {
            fields.put(field.name(), compile(field.value()));
        }
        return NodeMatcher.of(node.getClass(), fields);
    }
}
