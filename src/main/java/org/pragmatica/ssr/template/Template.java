package org.pragmatica.ssr.template;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.Map;
import java.util.Set;

/**
 * Renders replacement text for one labeled span of a match.
 */
public interface Template {

    /**
     * @param unit     the unit the match was found in
     * @param match    the fragment being replaced
     * @param bindings every labeled fragment of the match
     * @return the replacement text
     * @throws org.pragmatica.ssr.error.RewriteException if the template cannot be rendered for this match
     */
    String substitute(ParsedUnit unit, Fragment match, Map<String, Fragment> bindings);

    /**
     * Metavariables the template refers to.
     */
    Set<String> variables();

    String source();
}
