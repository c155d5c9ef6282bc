package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.metamodel.PropertyMetaModel;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.tree.Trees;

import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Matches nodes of one kind whose named fields match the given submatchers. Fields left unspecified
 * accept anything.
 *
 * <p>Parentheses around an expression candidate are looked through, unless the kind itself is
 * {@link EnclosedExpr}; the match is then the inner expression.
 */
public final class NodeMatcher implements Matcher {
    private final Class<? extends Node> kind;
    private final ImmutableMap<String, Matcher> fields;
    private final ImmutableMap<String, PropertyMetaModel> properties;

    private NodeMatcher(Class<? extends Node> kind, ImmutableMap<String, Matcher> fields) {
        var known = new LinkedHashMap<String, PropertyMetaModel>();
        for (var property : Trees.properties(kind)) {
            known.put(property.getName(), property);
        }
        for (var name : fields.keySet()) {
            Preconditions.checkArgument(known.containsKey(name), "%s has no field '%s', known fields are %s",
                                        kind.getSimpleName(), name, known.keySet());
        }
        this.kind = kind;
        this.fields = fields;
        this.properties = ImmutableMap.copyOf(known);
    }

    public static NodeMatcher of(Class<? extends Node> kind) {
        return new NodeMatcher(kind, ImmutableMap.of());
    }

    public static NodeMatcher of(Class<? extends Node> kind, Map<String, Matcher> fields) {
        return new NodeMatcher(kind, ImmutableMap.copyOf(fields));
    }

    /**
     * A copy that additionally requires {@code field} to match {@code matcher}.
     */
    public NodeMatcher with(String field, Matcher matcher) {
        return new NodeMatcher(kind, ImmutableMap.<String, Matcher>builder()
                                                 .putAll(fields)
                                                 .put(field, matcher)
                                                 .buildKeepingLast());
    }

    public Class<? extends Node> kind() {
        return kind;
    }

    public Map<String, Matcher> fields() {
        return fields;
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        var target = kind == EnclosedExpr.class ? candidate : Trees.unparenthesized(candidate);
        if (!kind.isInstance(target)) {
            return Optional.empty();
        }
        var node = (Node) target;
        var result = MatchResult.of(Fragment.of(context.unit(), node));
        for (var entry : fields.entrySet()) {
            var value = properties.get(entry.getKey()).getValue(node);
            var fieldResult = entry.getValue().match(context, value);
            if (fieldResult.isEmpty()) {
                return Optional.empty();
            }
            var merged = result.mergedWith(fieldResult.get());
            if (merged.isEmpty()) {
                return Optional.empty();
            }
            result = merged.get();
        }
        return Optional.of(result);
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        if (Modifier.isAbstract(kind.getModifiers())) {
            return Optional.empty();
        }
        if (Expression.class.isAssignableFrom(kind) && kind != EnclosedExpr.class) {
            return Optional.of(Set.of(kind, EnclosedExpr.class));
        }
        return Optional.of(Set.of(kind));
    }

    @Override
    public Set<String> bindVariables() {
        return Matcher.bindVariablesOf(fields.values());
    }

    @Override
    public String toString() {
        return kind.getSimpleName() + fields;
    }
}
