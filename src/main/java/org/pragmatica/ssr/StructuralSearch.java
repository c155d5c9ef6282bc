package org.pragmatica.ssr;

import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.matcher.Matcher;
import org.pragmatica.ssr.pattern.SyntaxPattern;
import org.pragmatica.ssr.search.MatchFinder;
import org.pragmatica.ssr.search.MatcherSearcher;
import org.pragmatica.ssr.search.PragmaSuppressedSearcher;
import org.pragmatica.ssr.search.RewriteConfig;
import org.pragmatica.ssr.search.RewriteDriver;
import org.pragmatica.ssr.search.Searcher;
import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.template.SafeTemplate;
import org.pragmatica.ssr.template.Template;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.ParseCache;
import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for structural search and replace over Java source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var pattern = StructuralSearch.compilePattern("$list.size() == 0", FragmentKind.EXPRESSION);
 * var rewritten = StructuralSearch.rewriteString(pattern,
 *                                                Map.of(MatcherSearcher.ROOT_LABEL,
 *                                                       SafeTemplate.expression("$list.isEmpty()")),
 *                                                source);
 * }</pre>
 */
public final class StructuralSearch {
    private StructuralSearch() {}

    /**
     * Compile a pattern with {@code $name} metavariables.
     *
     * @throws org.pragmatica.ssr.error.PatternCompileException if the pattern is malformed
     */
    public static Matcher compilePattern(String pattern, FragmentKind kind) {
        return SyntaxPattern.compile(pattern, kind);
    }

    /**
     * Compile a pattern whose metavariables must also satisfy the given matchers.
     *
     * @throws org.pragmatica.ssr.error.PatternCompileException if the pattern is malformed or a
     *                                                         restriction names an unknown metavariable
     */
    public static Matcher compilePattern(String pattern, FragmentKind kind, Map<String, ? extends Matcher> restrictions) {
        return SyntaxPattern.compile(pattern, kind, restrictions);
    }

    /**
     * Every match in preorder. The children of a match are not searched.
     */
    public static List<MatchResult> findMatches(Matcher matcher, ParsedUnit unit) {
        return MatchFinder.findMatches(matcher, unit);
    }

    /**
     * Every match in a compilation unit.
     *
     * @throws org.pragmatica.ssr.error.ParseException if the source does not parse
     */
    public static List<MatchResult> findMatches(Matcher matcher, String source) {
        return findMatches(matcher, JavaGrammar.parse(source, FragmentKind.UNIT));
    }

    /**
     * Substitutions for a compilation unit, rewritten up to {@code maxIterations} times where
     * rewrites enable further matches.
     *
     * @param templates replacement per label; {@link MatcherSearcher#ROOT_LABEL} replaces the whole match
     */
    public static List<Substitution> findSubstitutions(Matcher matcher,
                                                       Map<String, ? extends Template> templates,
                                                       String source,
                                                       String path,
                                                       int maxIterations) {
        return driver(matcher, templates, RewriteConfig.DEFAULT.withMaxIterations(maxIterations))
            .findAll(source, path);
    }

    /**
     * The source with every non-overlapping substitution applied.
     *
     * @throws org.pragmatica.ssr.error.ParseException if the source does not parse
     */
    public static String rewrite(Matcher matcher,
                                 Map<String, ? extends Template> templates,
                                 String source,
                                 String path,
                                 int maxIterations) {
        return driver(matcher, templates, RewriteConfig.DEFAULT.withMaxIterations(maxIterations))
            .rewrite(source, path);
    }

    /**
     * Single pass rewrite of an unnamed compilation unit.
     */
    public static String rewriteString(Matcher matcher, Map<String, ? extends Template> templates, String source) {
        return rewrite(matcher, templates, source, JavaGrammar.DEFAULT_PATH, 1);
    }

    /**
     * Builder for a driver that replaces every match of one pattern.
     */
    public static Builder builder(String pattern, FragmentKind kind) {
        return new Builder(pattern, kind);
    }

    private static RewriteDriver driver(Matcher matcher, Map<String, ? extends Template> templates,
                                        RewriteConfig config) {
        return RewriteDriver.of(PragmaSuppressedSearcher.of(MatcherSearcher.of(matcher, templates)), config);
    }

    public static final class Builder {
        private final String pattern;
        private final FragmentKind kind;
        private final Map<String, Matcher> restrictions = new LinkedHashMap<>();
        private final Map<String, Template> templates = new LinkedHashMap<>();
        private RewriteConfig config = RewriteConfig.DEFAULT;
        private MatcherSearcher.Finding finding = MatcherSearcher.Finding.NONE;
        private boolean pragmas = true;

        private Builder(String pattern, FragmentKind kind) {
            this.pattern = pattern;
            this.kind = kind;
        }

        public Builder restrict(String name, Matcher matcher) {
            restrictions.put(name, matcher);
            return this;
        }

        /**
         * Replace the whole match with a template of the pattern's kind.
         */
        public Builder replaceWith(String template) {
            return template(MatcherSearcher.ROOT_LABEL, SafeTemplate.of(template, kind));
        }

        public Builder template(String label, Template template) {
            templates.put(label, template);
            return this;
        }

        public Builder maxIterations(int iterations) {
            config = config.withMaxIterations(iterations);
            return this;
        }

        public Builder mergedUrl(String url) {
            config = config.withMergedUrl(url);
            return this;
        }

        public Builder cacheSize(long size) {
            config = config.withCacheSize(size);
            return this;
        }

        public Builder finding(String message, String url, String category, boolean significant) {
            finding = new MatcherSearcher.Finding(message, url, category, significant);
            return this;
        }

        /**
         * Whether {@code // ssr: disable=<category>} comments suppress substitutions. On by default.
         */
        public Builder pragmas(boolean honor) {
            this.pragmas = honor;
            return this;
        }

        /**
         * @throws org.pragmatica.ssr.error.PatternCompileException if the pattern or a template is malformed
         */
        public RewriteDriver build() {
            var matcher = compilePattern(pattern, kind, restrictions);
            var cache = config.cacheSize() > 0 ? ParseCache.create(config.cacheSize()) : null;
            Searcher searcher = MatcherSearcher.of(matcher, templates, FragmentKind.UNIT, cache).withFinding(finding);
            if (pragmas) {
                searcher = PragmaSuppressedSearcher.of(searcher);
            }
            return RewriteDriver.of(searcher, config);
        }
    }
}
