package org.pragmatica.ssr.tree;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.metamodel.JavaParserMetaModel;
import com.github.javaparser.metamodel.PropertyMetaModel;
import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural queries over syntax nodes, driven by JavaParser's generated metamodel.
 *
 * <p>Comments are not part of the structure. Parenthesized expressions are transparent for
 * {@link #equivalent(Object, Object)}.
 */
public final class Trees {
    private static final String COMMENT_PROPERTY = "comment";

    private Trees() {}

    /**
     * A named field of a node. The value is a node, a node list, an attribute value or {@code null}.
     */
    public record Field(String name, Object value) {}

    public static List<PropertyMetaModel> properties(Class<? extends Node> kind) {
        return JavaParserMetaModel.getNodeMetaModel(kind)
                                  .map(meta -> meta.getAllPropertyMetaModels()
                                                   .stream()
                                                   .filter(Trees::isStructural)
                                                   .toList())
                                  .orElse(List.of());
    }

    public static List<Field> fields(Node node) {
        var builder = ImmutableList.<Field>builder();
        for (var property : node.getMetaModel().getAllPropertyMetaModels()) {
            if (isStructural(property)) {
                builder.add(new Field(property.getName(), property.getValue(node)));
            }
        }
        return builder.build();
    }

    /**
     * Child nodes and non-empty node lists of a node, or the items of a list, in source order.
     */
    public static List<Object> children(Object element) {
        if (element instanceof NodeList<?> list) {
            return List.copyOf(list);
        }
        if (!(element instanceof Node node)) {
            return List.of();
        }
        return fields(node).stream()
                           .map(Field::value)
                           .filter(value -> value instanceof Node
                                            || (value instanceof NodeList<?> list && list.isNonEmpty()))
                           .sorted(Comparator.comparingLong(Trees::sourceOrder))
                           .toList();
    }

    public static Object unparenthesized(Object candidate) {
        var current = candidate;
        while (current instanceof EnclosedExpr enclosed) {
            current = enclosed.getInner();
        }
        return current;
    }

    /**
     * The identifier of a bare identifier reference: a name expression, simple name, unqualified
     * name, or unscoped class type without type arguments or annotations.
     */
    public static Optional<String> identifierOf(Object candidate) {
        if (candidate instanceof NameExpr nameExpr) {
            return Optional.of(nameExpr.getNameAsString());
        }
        if (candidate instanceof SimpleName simpleName) {
            return Optional.of(simpleName.getIdentifier());
        }
        if (candidate instanceof Name name && name.getQualifier().isEmpty()) {
            return Optional.of(name.getIdentifier());
        }
        if (candidate instanceof ClassOrInterfaceType type
            && type.getScope().isEmpty()
            && type.getTypeArguments().isEmpty()
            && type.getAnnotations().isEmpty()) {
            return Optional.of(type.getNameAsString());
        }
        return Optional.empty();
    }

    /**
     * Structural equality ignoring comments and parentheses. Identifier references of different
     * kinds are equivalent when their identifiers are equal.
     */
    public static boolean equivalent(Object left, Object right) {
        var a = unparenthesized(left);
        var b = unparenthesized(right);
        if (a == b) {
            return true;
        }
        var leftIdentifier = identifierOf(a);
        var rightIdentifier = identifierOf(b);
        if (leftIdentifier.isPresent() && rightIdentifier.isPresent()) {
            return leftIdentifier.equals(rightIdentifier);
        }
        if (a instanceof Node leftNode && b instanceof Node rightNode) {
            if (leftNode.getClass() != rightNode.getClass()) {
                return false;
            }
            var leftFields = fields(leftNode);
            var rightFields = fields(rightNode);
            for (int i = 0; i < leftFields.size(); i++) {
                if (!equivalent(leftFields.get(i).value(), rightFields.get(i).value())) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List<?> leftList && b instanceof List<?> rightList) {
            if (leftList.size() != rightList.size()) {
                return false;
            }
            for (int i = 0; i < leftList.size(); i++) {
                if (!equivalent(leftList.get(i), rightList.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    public static String describe(Object candidate) {
        if (candidate instanceof Node node) {
            return node.getClass().getSimpleName() + "(" + node + ")";
        }
        return String.valueOf(candidate);
    }

    private static boolean isStructural(PropertyMetaModel property) {
        return !COMMENT_PROPERTY.equals(property.getName());
    }

    private static long sourceOrder(Object child) {
        if (child instanceof NodeList<?> list) {
            return list.isEmpty() ? Long.MAX_VALUE : sourceOrder(list.get(0));
        }
        if (child instanceof Node node) {
            return node.getRange()
                       .map(range -> ((long) range.begin.line << 32) | range.begin.column)
                       .orElse(Long.MAX_VALUE);
        }
        return Long.MAX_VALUE;
    }
}
