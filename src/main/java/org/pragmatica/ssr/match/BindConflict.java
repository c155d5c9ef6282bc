package org.pragmatica.ssr.match;

import org.pragmatica.ssr.error.MatchException;
import org.pragmatica.ssr.tree.Trees;

/**
 * What to do when a metavariable is bound a second time within one match.
 */
public enum BindConflict {
    /** Always merge, letting the merge policy pick the value. */
    MERGE,
    /** Never merge: the combined match fails. */
    SKIP,
    /** A second binding is a matcher error. */
    ERROR,
    /** Merge if both bindings matched the same thing, else fail. */
    MERGE_IDENTICAL,
    /** Merge if both bindings matched the same thing, else error. */
    MERGE_IDENTICAL_OR_ERROR,
    /** Merge if both bindings are structurally equivalent syntax, else fail. */
    MERGE_EQUIVALENT_AST,
    /** Merge if both bindings are structurally equivalent syntax, else error. */
    MERGE_EQUIVALENT_AST_OR_ERROR;

    /**
     * Decide whether two bindings of {@code name} merge.
     *
     * @throws MatchException when an error policy rejects the pair
     */
    public boolean merges(String name, BoundValue first, BoundValue second) {
        return switch (this) {
            case MERGE -> true;
            case SKIP -> false;
            case ERROR -> throw conflict(name, first, second);
            case MERGE_IDENTICAL -> Fragment.identical(first.value(), second.value());
            case MERGE_IDENTICAL_OR_ERROR -> orError(Fragment.identical(first.value(), second.value()),
                                                     name, first, second);
            case MERGE_EQUIVALENT_AST -> equivalent(first, second);
            case MERGE_EQUIVALENT_AST_OR_ERROR -> orError(equivalent(first, second), name, first, second);
        };
    }

    private static boolean equivalent(BoundValue first, BoundValue second) {
        var left = first.value().matched();
        var right = second.value().matched();
        if (left.isEmpty() || right.isEmpty()) {
            return Fragment.identical(first.value(), second.value());
        }
        return Trees.equivalent(left.get(), right.get());
    }

    private static boolean orError(boolean merges, String name, BoundValue first, BoundValue second) {
        if (!merges) {
            throw conflict(name, first, second);
        }
        return true;
    }

    private static MatchException conflict(String name, BoundValue first, BoundValue second) {
        return new MatchException("Metavariable '" + name + "' bound twice: " + first.value()
                                  + " and " + second.value());
    }
}
