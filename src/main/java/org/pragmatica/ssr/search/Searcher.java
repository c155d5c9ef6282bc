package org.pragmatica.ssr.search;

import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.tree.FragmentKind;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.Span;

import java.util.List;
import java.util.Optional;

/**
 * Finds substitutions in parsed source.
 */
public interface Searcher {

    /**
     * @throws org.pragmatica.ssr.error.ParseException if the text does not parse
     */
    ParsedUnit parse(String text, String path);

    /**
     * Every substitution found in the unit, in source order. Substitutions that should be rewritten
     * iteratively carry a key span.
     */
    List<Substitution> findSubstitutions(ParsedUnit unit);

    /**
     * The kind to reparse the text under a key span as, if it can be reparsed on its own.
     */
    default Optional<FragmentKind> fragmentKindAt(ParsedUnit unit, Span keySpan) {
        return Optional.empty();
    }
}
