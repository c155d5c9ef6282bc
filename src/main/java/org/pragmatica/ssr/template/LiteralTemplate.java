package org.pragmatica.ssr.template;

import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.Map;
import java.util.Set;

/**
 * Fixed replacement text.
 */
public record LiteralTemplate(String source) implements Template {

    @Override
    public String substitute(ParsedUnit unit, Fragment match, Map<String, Fragment> bindings) {
        return source;
    }

    @Override
    public Set<String> variables() {
        return Set.of();
    }
}
