package org.pragmatica.ssr.search;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.substitution.Substitutions;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs several searchers over one parse. Where their substitutions overlap, the smaller one wins.
 *
 * <p>The first searcher parses; all of them must accept what it produces.
 */
public final class CombinedSearcher implements Searcher {
    private final ImmutableList<Searcher> searchers;

    private CombinedSearcher(ImmutableList<Searcher> searchers) {
        this.searchers = searchers;
    }

    public static CombinedSearcher of(Searcher... searchers) {
        return of(List.of(searchers));
    }

    public static CombinedSearcher of(List<? extends Searcher> searchers) {
        Preconditions.checkArgument(!searchers.isEmpty(), "At least one searcher is required");
        return new CombinedSearcher(ImmutableList.copyOf(searchers));
    }

    @Override
    public ParsedUnit parse(String text, String path) {
        return searchers.get(0).parse(text, path);
    }

    @Override
    public List<Substitution> findSubstitutions(ParsedUnit unit) {
        var all = new ArrayList<Substitution>();
        for (var searcher : searchers) {
            all.addAll(searcher.findSubstitutions(unit));
        }
        return Substitutions.disjoint(all);
    }

    @Override
    public Optional<FragmentKind> fragmentKindAt(ParsedUnit unit, Span keySpan) {
        for (var searcher : searchers) {
            var kind = searcher.fragmentKindAt(unit, keySpan);
            if (kind.isPresent()) {
                return kind;
            }
        }
        return Optional.empty();
    }
}
