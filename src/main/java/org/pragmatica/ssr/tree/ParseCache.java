package org.pragmatica.ssr.tree;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Shared cache of parsed units keyed by text identity, path and fragment kind.
 *
 * <p>Texts are held weakly and compared by identity, so the cache never keeps a file's contents
 * alive on its own. Safe for concurrent readers: parsing identical text twice yields equal units.
 */
public final class ParseCache {
    private final Cache<String, ConcurrentMap<Key, ParsedUnit>> units;

    private ParseCache(long maximumSize) {
        this.units = CacheBuilder.newBuilder()
                                 .weakKeys()
                                 .maximumSize(maximumSize)
                                 .build();
    }

    public static ParseCache create(long maximumSize) {
        return new ParseCache(maximumSize);
    }

    public ParsedUnit parse(String text, String path, FragmentKind kind) {
        return units.asMap()
                    .computeIfAbsent(text, unused -> new ConcurrentHashMap<>())
                    .computeIfAbsent(new Key(path, kind), key -> JavaGrammar.parse(text, path, kind));
    }

    public long size() {
        return units.size();
    }

    public void clear() {
        units.invalidateAll();
    }

    private record Key(String path, FragmentKind kind) {}
}
