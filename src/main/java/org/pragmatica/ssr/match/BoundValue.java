package org.pragmatica.ssr.match;

/**
 * A fragment bound to a metavariable, with the policies deciding how it combines with a second
 * binding of the same name. Two bound values combine only if both policies are identical.
 */
public record BoundValue(Fragment value, BindConflict onConflict, BindMerge onMerge) {

    public static BoundValue of(Fragment value) {
        return new BoundValue(value, BindConflict.MERGE, BindMerge.KEEP_LAST);
    }

    public static BoundValue of(Fragment value, BindConflict onConflict, BindMerge onMerge) {
        return new BoundValue(value, onConflict, onMerge);
    }

    public BoundValue rebind(BindConflict conflict, BindMerge merge) {
        return new BoundValue(value, conflict, merge);
    }

    boolean samePolicies(BoundValue other) {
        return onConflict == other.onConflict && onMerge == other.onMerge;
    }

    String policies() {
        return onConflict + "/" + onMerge;
    }
}
