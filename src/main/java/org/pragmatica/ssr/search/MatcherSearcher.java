package org.pragmatica.ssr.search;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.stmt.Statement;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.ssr.error.MatchException;
import org.pragmatica.ssr.error.PatternCompileException;
import org.pragmatica.ssr.error.RewriteException;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.match.MatchResult;
import org.pragmatica.ssr.matcher.Bind;
import org.pragmatica.ssr.matcher.Matcher;
import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.template.Template;
import org.pragmatica.ssr.template.TemplateRewriter;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.JavaGrammar;
import org.pragmatica.ssr.tree.ParseCache;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.Span;
import org.pragmatica.ssr.tree.TreeNavigator;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Searcher driven by a matcher, with templates rendering replacements for its labels.
 *
 * <p>The whole match is bound to {@link #ROOT_LABEL}, the primary label of every substitution.
 * Matches inside a statement, member or the header of a compound statement are grouped under the
 * span of that enclosing unit for iterative rewriting.
 */
public final class MatcherSearcher implements Searcher {
    private static final Logger logger = LogManager.getLogger(MatcherSearcher.class);

    /**
     * Label of the whole match.
     */
    public static final String ROOT_LABEL = "__root";

    private static final String REMOVED_STATEMENT = "{}";

    private final Matcher matcher;
    private final ImmutableMap<String, Template> templates;
    private final FragmentKind unitKind;
    private final ParseCache cache;
    private final Finding finding;

    /**
     * What every substitution of a searcher reports.
     *
     * @param category dotted category, used for suppression
     */
    public record Finding(String message, String url, String category, boolean significant) {
        public static final Finding NONE = new Finding(null, null, null, true);
    }

    private MatcherSearcher(Matcher matcher, ImmutableMap<String, Template> templates, FragmentKind unitKind,
                            ParseCache cache, Finding finding) {
        this.matcher = matcher;
        this.templates = templates;
        this.unitKind = unitKind;
        this.cache = cache;
        this.finding = finding;
    }

    /**
     * @throws PatternCompileException if a template refers to a label the matcher never binds
     */
    public static MatcherSearcher of(Matcher matcher, Map<String, ? extends Template> templates) {
        return of(matcher, templates, FragmentKind.UNIT, null);
    }

    /**
     * @param unitKind what each searched text is parsed as
     * @param cache    shared parse cache, or {@code null} to parse every time
     * @throws PatternCompileException if a template refers to a label the matcher never binds
     */
    public static MatcherSearcher of(Matcher matcher, Map<String, ? extends Template> templates, FragmentKind unitKind,
                                     ParseCache cache) {
        var rooted = Bind.system(ROOT_LABEL, matcher);
        var missing = Sets.difference(TemplateRewriter.templateVariables(templates), rooted.bindVariables());
        if (!missing.isEmpty()) {
            throw new PatternCompileException("The templates refer to variables the matcher does not bind: "
                                              + new TreeSet<>(missing));
        }
        return new MatcherSearcher(rooted, ImmutableMap.copyOf(templates), unitKind, cache, Finding.NONE);
    }

    public MatcherSearcher withFinding(Finding newFinding) {
        return new MatcherSearcher(matcher, templates, unitKind, cache, newFinding);
    }

    public Matcher matcher() {
        return matcher;
    }

    @Override
    public ParsedUnit parse(String text, String path) {
        if (cache != null) {
            return cache.parse(text, path, unitKind);
        }
        return JavaGrammar.parse(text, path, unitKind);
    }

    @Override
    public List<Substitution> findSubstitutions(ParsedUnit unit) {
        var substitutions = ImmutableList.<Substitution>builder();
        var removals = new Removals();
        for (var result : MatchFinder.findMatches(matcher, unit)) {
            try {
                var substitution = toSubstitution(unit, result);
                if (substitution.isPresent()) {
                    substitutions.add(removals.sanitize(unit, result, substitution.get()));
                }
            } catch (MatchException | RewriteException e) {
                logger.warn("Skipped rewrite in {}: {}", unit.path(), e.getMessage());
            }
        }
        return substitutions.build();
    }

    @Override
    public Optional<FragmentKind> fragmentKindAt(ParsedUnit unit, Span keySpan) {
        for (var node : unit.root().findAll(Node.class)) {
            if (unit.spanOf(node).filter(keySpan::equals).isPresent()) {
                var kind = FragmentKind.of(node).filter(found -> found != FragmentKind.UNIT);
                if (kind.isPresent()) {
                    return kind;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Substitution> toSubstitution(ParsedUnit unit, MatchResult result) {
        var unknown = Sets.filter(Sets.difference(result.replacements().keySet(), matcher.bindVariables()),
                                  label -> !Bind.isSystemLabel(label));
        if (!unknown.isEmpty()) {
            throw new MatchException("Matcher produced replacements for unknown labels: " + new TreeSet<>(unknown));
        }
        var fragments = ImmutableMap.copyOf(Maps.transformValues(result.bindings(), bound -> bound.value()));
        var root = fragments.get(ROOT_LABEL);
        if (root == null || root.span().isEmpty()) {
            logger.warn("Skipped match without source text in {}: {}", unit.path(), result.match());
            return Optional.empty();
        }
        var spans = new LinkedHashMap<String, Span>();
        fragments.forEach((label, fragment) -> fragment.span().ifPresent(span -> spans.put(label, span)));

        var allTemplates = new LinkedHashMap<String, Template>(templates);
        allTemplates.putAll(result.replacements());
        var rendered = new LinkedHashMap<>(TemplateRewriter.rewriteTemplates(unit, fragments, allTemplates));
        rendered.keySet().retainAll(spans.keySet());

        return Optional.of(Substitution.builder()
                                       .matchedSpans(spans)
                                       .primaryLabel(ROOT_LABEL)
                                       .replacements(rendered)
                                       .keySpan(keySpanFor(unit, root).orElse(null))
                                       .message(finding.message())
                                       .url(finding.url())
                                       .category(finding.category())
                                       .significant(finding.significant())
                                       .build());
    }

    private static Optional<Span> keySpanFor(ParsedUnit unit, Fragment root) {
        if (!(root instanceof Fragment.Syntax syntax)) {
            return Optional.empty();
        }
        return unit.navigator()
                   .enclosingSimpleUnit(syntax.node())
                   .flatMap(simple -> unit.spanOf(simple.node()));
    }

    /**
     * Widens the spans of statements replaced by nothing so that no stray whitespace or empty
     * statement position is left behind.
     */
    private static final class Removals {
        private final Set<Object> removed = Collections.newSetFromMap(new IdentityHashMap<>());

        Substitution sanitize(ParsedUnit unit, MatchResult result, Substitution substitution) {
            var spans = new LinkedHashMap<>(substitution.matchedSpans());
            var replacements = new HashMap<>(substitution.replacements());
            boolean changed = false;
            for (var entry : substitution.replacements().entrySet()) {
                var fragment = result.bound(entry.getKey()).orElse(null);
                if (!entry.getValue().isEmpty() || !(fragment instanceof Fragment.Syntax syntax)
                    || !(syntax.node() instanceof Statement statement)) {
                    continue;
                }
                changed = true;
                var navigator = unit.navigator();
                if (!(navigator.parent(statement).orElse(null) instanceof NodeList<?>)) {
                    replacements.put(entry.getKey(), REMOVED_STATEMENT);
                    continue;
                }
                removed.add(statement);
                var span = spans.get(entry.getKey());
                var next = navigator.nextSibling(statement).flatMap(unit::spanOf);
                var previous = navigator.prevSibling(statement);
                if (next.isPresent()) {
                    spans.put(entry.getKey(), Span.of(span.start(), next.get().start()));
                } else if (previous.isPresent() && !removed.contains(previous.get())) {
                    unit.spanOf(previous.get())
                        .ifPresent(before -> spans.put(entry.getKey(), Span.of(before.end(), span.end())));
                }
            }
            if (!changed) {
                return substitution;
            }
            return substitution.toBuilder()
                               .matchedSpans(spans)
                               .replacements(replacements)
                               .keySpan(null)
                               .build();
        }
    }
}
