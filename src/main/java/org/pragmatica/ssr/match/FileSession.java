package org.pragmatica.ssr.match;

import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * State shared by all match attempts over one parsed unit: the keys under which run-once matchers
 * have succeeded, and per-unit memoized facts.
 */
public final class FileSession {
    private final ParsedUnit unit;
    private final Set<Object> succeeded = new HashSet<>();
    private final Map<List<Object>, Object> memo = new HashMap<>();

    private FileSession(ParsedUnit unit) {
        this.unit = unit;
    }

    public static FileSession of(ParsedUnit unit) {
        return new FileSession(unit);
    }

    public ParsedUnit unit() {
        return unit;
    }

    /**
     * Context for one top-level match attempt. Nothing it records is visible to other attempts until
     * {@link MatchContext#commit()}.
     */
    public MatchContext fork() {
        return new MatchContext(this);
    }

    boolean hasSucceeded(Object key) {
        return succeeded.contains(key);
    }

    void commit(Set<Object> keys) {
        succeeded.addAll(keys);
    }

    <T> T memoize(Class<T> type, Object id, Supplier<T> supplier) {
        List<Object> key = List.of(type, id);
        if (!memo.containsKey(key)) {
            memo.put(key, supplier.get());
        }
        return type.cast(memo.get(key));
    }
}
