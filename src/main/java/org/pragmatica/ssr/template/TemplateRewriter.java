package org.pragmatica.ssr.template;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.matcher.Bind;
import org.pragmatica.ssr.tree.ParsedUnit;

import java.util.Map;
import java.util.Set;

/**
 * Renders the templates of a match.
 */
public final class TemplateRewriter {
    private TemplateRewriter() {}

    /**
     * Render each template for the fragment bound to its label.
     *
     * <p>A label bound to a fragment without a span is skipped, since there is nothing to replace. A
     * reserved ({@code __}) label that is not bound renders as an insertion from an empty fragment;
     * other unbound labels are skipped.
     *
     * @return rendered text per label, in template order
     * @throws org.pragmatica.ssr.error.RewriteException if a template cannot be rendered
     */
    public static ImmutableMap<String, String> rewriteTemplates(ParsedUnit unit,
                                                                Map<String, Fragment> bindings,
                                                                Map<String, ? extends Template> templates) {
        var rendered = ImmutableMap.<String, String>builder();
        for (var entry : templates.entrySet()) {
            var label = entry.getKey();
            var fragment = bindings.get(label);
            if (fragment != null) {
                if (fragment.span().isEmpty()) {
                    continue;
                }
            } else if (Bind.isSystemLabel(label)) {
                fragment = Fragment.EMPTY;
            } else {
                continue;
            }
            rendered.put(label, entry.getValue().substitute(unit, fragment, bindings));
        }
        return rendered.build();
    }

    /**
     * Every label the templates are attached to, plus every variable they refer to.
     */
    public static Set<String> templateVariables(Map<String, ? extends Template> templates) {
        var labels = ImmutableSet.<String>builder();
        for (var entry : templates.entrySet()) {
            labels.add(entry.getKey());
            labels.addAll(entry.getValue().variables());
        }
        return labels.build();
    }
}
