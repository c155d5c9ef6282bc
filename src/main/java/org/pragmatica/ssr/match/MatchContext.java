package org.pragmatica.ssr.match;

import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Mutable state of one top-level match attempt, threaded through every matcher call.
 */
public final class MatchContext {
    private final FileSession session;
    private final Set<Object> tentative = new HashSet<>();

    MatchContext(FileSession session) {
        this.session = session;
    }

    /**
     * A context with a fresh session, for matching outside a search over a whole unit.
     */
    public static MatchContext of(ParsedUnit unit) {
        return FileSession.of(unit).fork();
    }

    public ParsedUnit unit() {
        return session.unit();
    }

    // === Run-once State ===

    public boolean hasSucceeded(Object key) {
        return tentative.contains(key) || session.hasSucceeded(key);
    }

    public void markSucceeded(Object key) {
        tentative.add(key);
    }

    /**
     * Publish what this attempt recorded to the session. Called only when the attempt matched.
     */
    public void commit() {
        session.commit(tentative);
        tentative.clear();
    }

    // === Per-unit Memo ===

    /**
     * The value computed once per unit for a type, or for a type and an identifying value.
     */
    public <T> T memoize(Class<T> type, Supplier<T> supplier) {
        return session.memoize(type, type, supplier);
    }

    public <T> T memoize(Class<T> type, Object id, Supplier<T> supplier) {
        return session.memoize(type, id, supplier);
    }
}
