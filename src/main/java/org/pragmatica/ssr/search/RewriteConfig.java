package org.pragmatica.ssr.search;

import com.google.common.base.Preconditions;

/**
 * Settings of a rewrite run.
 *
 * @param maxIterations how often substitutions sharing a key span are re-applied and searched again;
 *                      values of 1 or less mean a single pass
 * @param mergedUrl     URL given to a composed substitution whose parts point to different URLs
 * @param cacheSize     maximum number of distinct texts kept parsed, 0 to parse every time
 */
public record RewriteConfig(int maxIterations, String mergedUrl, long cacheSize) {
    public static final String MERGED_URL = "urn:java-ssr:merged-findings";

    public static final RewriteConfig DEFAULT = new RewriteConfig(0, MERGED_URL, 0);

    public RewriteConfig {
        Preconditions.checkNotNull(mergedUrl, "mergedUrl");
        Preconditions.checkArgument(cacheSize >= 0, "cacheSize must not be negative: %s", cacheSize);
    }

    public RewriteConfig withMaxIterations(int iterations) {
        return new RewriteConfig(iterations, mergedUrl, cacheSize);
    }

    public RewriteConfig withMergedUrl(String url) {
        return new RewriteConfig(maxIterations, url, cacheSize);
    }

    public RewriteConfig withCacheSize(long size) {
        return new RewriteConfig(maxIterations, mergedUrl, size);
    }
}
