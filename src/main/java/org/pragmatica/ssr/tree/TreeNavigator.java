package org.pragmatica.ssr.tree;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

import java.util.ArrayDeque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parent and sibling queries over a syntax tree, derived once by walking the tree.
 *
 * <p>Node lists are tree elements of their own: an item's parent is its list, and the list's parent
 * is the owning node. Objects the navigator has never seen have no parent.
 */
public final class TreeNavigator {

    public enum FieldKind {
        /** Held in a named field of the parent node. */
        ATTRIBUTE,
        /** Held at an index of the parent list. */
        ITEM
    }

    /**
     * Where an element sits in its parent: a property name for attributes, an index for items.
     */
    public record Link(Object parent, FieldKind kind, Object key) {}

    /**
     * The smallest ancestor that can be reparsed on its own, with the kind to reparse it as.
     */
    public record SimpleUnit(Node node, FragmentKind kind) {}

    private final Map<Object, Link> links;

    private TreeNavigator(Map<Object, Link> links) {
        this.links = links;
    }

    public static TreeNavigator of(Node root) {
        var links = new IdentityHashMap<Object, Link>();
        var pending = new ArrayDeque<Node>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            for (var field : Trees.fields(node)) {
                if (field.value() instanceof Node child) {
                    links.put(child, new Link(node, FieldKind.ATTRIBUTE, field.name()));
                    pending.push(child);
                } else if (field.value() instanceof NodeList<?> list) {
                    links.put(list, new Link(node, FieldKind.ATTRIBUTE, field.name()));
                    for (int i = 0; i < list.size(); i++) {
                        links.put(list.get(i), new Link(list, FieldKind.ITEM, i));
                        pending.push(list.get(i));
                    }
                }
            }
        }
        return new TreeNavigator(links);
    }

    public Optional<Link> link(Object element) {
        return Optional.ofNullable(links.get(element));
    }

    public Optional<Object> parent(Object element) {
        return link(element).map(Link::parent);
    }

    public Optional<Object> prevSibling(Object element) {
        return sibling(element, -1);
    }

    public Optional<Object> nextSibling(Object element) {
        return sibling(element, 1);
    }

    /**
     * Walk up from an element to the largest ancestor that is still inside the innermost block,
     * type body or compound statement header, as long as it can be reparsed on its own.
     */
    public Optional<SimpleUnit> enclosingSimpleUnit(Object element) {
        Object current = element;
        Node last = element instanceof Node node ? node : null;
        while (true) {
            var parent = parent(current);
            if (parent.isEmpty() || isUnitBoundary(parent.get())) {
                break;
            }
            if (parent.get() instanceof Node node) {
                last = node;
            }
            current = parent.get();
        }
        if (last == null) {
            return Optional.empty();
        }
        var unit = last;
        return FragmentKind.of(unit)
                           .filter(kind -> kind != FragmentKind.UNIT)
                           .map(kind -> new SimpleUnit(unit, kind));
    }

    private Optional<Object> sibling(Object element, int direction) {
        var link = links.get(element);
        if (link == null || link.kind() != FieldKind.ITEM) {
            return Optional.empty();
        }
        var list = (NodeList<?>) link.parent();
        int index = (Integer) link.key() + direction;
        if (index < 0 || index >= list.size()) {
            return Optional.empty();
        }
        return Optional.of(list.get(index));
    }

    private static boolean isUnitBoundary(Object element) {
        return element instanceof BlockStmt
               || element instanceof SwitchEntry
               || element instanceof TypeDeclaration<?>
               || element instanceof CompilationUnit
               || isCompoundStatement(element);
    }

    public static boolean isCompoundStatement(Object element) {
        return element instanceof IfStmt
               || element instanceof WhileStmt
               || element instanceof DoStmt
               || element instanceof ForStmt
               || element instanceof ForEachStmt
               || element instanceof TryStmt
               || element instanceof SwitchStmt
               || element instanceof SynchronizedStmt
               || element instanceof LabeledStmt;
    }
}
