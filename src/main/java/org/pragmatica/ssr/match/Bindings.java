package org.pragmatica.ssr.match;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.ssr.error.PolicyMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Combination of metavariable bindings from sibling matchers.
 */
public final class Bindings {
    private Bindings() {}

    /**
     * Merge two binding maps.
     *
     * <p>Every shared name must carry identical policies on both sides, and every shared name is
     * checked even after another one has failed to merge. The conflict policy decides whether a pair
     * merges and the merge policy which value survives.
     *
     * @return the merged bindings, or empty if some shared name does not merge
     * @throws PolicyMismatchException if a shared name has different policies on each side
     */
    public static Optional<ImmutableMap<String, BoundValue>> merge(Map<String, BoundValue> left,
                                                                  Map<String, BoundValue> right) {
        var merged = new LinkedHashMap<>(left);
        boolean ok = true;
        for (var entry : right.entrySet()) {
            var name = entry.getKey();
            var second = entry.getValue();
            var first = left.get(name);
            if (first == null) {
                merged.put(name, second);
                continue;
            }
            if (!first.samePolicies(second)) {
                throw new PolicyMismatchException(name, first.policies(), second.policies());
            }
            if (first.onConflict().merges(name, first, second)) {
                merged.put(name, first.onMerge().choose(first, second));
            } else {
                ok = false;
            }
        }
        return ok ? Optional.of(ImmutableMap.copyOf(merged)) : Optional.empty();
    }
}
