package org.pragmatica.ssr.match;

/**
 * Which of two mergeable bindings of the same metavariable survives.
 */
public enum BindMerge {
    KEEP_FIRST,
    KEEP_LAST;

    public BoundValue choose(BoundValue first, BoundValue last) {
        return this == KEEP_FIRST ? first : last;
    }
}
