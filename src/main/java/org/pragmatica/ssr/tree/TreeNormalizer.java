package org.pragmatica.ssr.tree;

import com.github.javaparser.ast.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;

/**
 * Gives every tree position its own node instance: a node reachable twice is replaced by a clone
 * at its second occurrence, so identity-keyed navigation is well defined.
 */
final class TreeNormalizer {
    private static final Logger logger = LogManager.getLogger(TreeNormalizer.class);

    private TreeNormalizer() {}

    static <N extends Node> N normalize(N root) {
        var seen = Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>());
        var pending = new ArrayDeque<Node>();
        seen.add(root);
        pending.push(root);

        while (!pending.isEmpty()) {
            var node = pending.pop();
            for (var child : List.copyOf(node.getChildNodes())) {
                if (seen.add(child)) {
                    pending.push(child);
                    continue;
                }
                var copy = child.clone();
                if (node.replace(child, copy)) {
                    logger.debug("Cloned aliased {} under {}", child.getClass().getSimpleName(),
                                 node.getClass().getSimpleName());
                    seen.add(copy);
                    pending.push(copy);
                }
            }
        }
        return root;
    }
}
