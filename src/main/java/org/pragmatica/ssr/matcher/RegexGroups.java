package org.pragmatica.ssr.matcher;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.BoundValue;
import org.pragmatica.ssr.match.Fragment;
import org.pragmatica.ssr.tree.Span;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Named capture groups of a regex, bound as text spans.
 */
final class RegexGroups {
    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private RegexGroups() {}

    static Set<String> names(Pattern pattern) {
        var names = new LinkedHashSet<String>();
        var scan = GROUP_NAME.matcher(pattern.pattern());
        while (scan.find()) {
            if (!isEscaped(pattern.pattern(), scan.start())) {
                names.add(scan.group(1));
            }
        }
        return ImmutableSet.copyOf(names);
    }

    /**
     * Bindings for the groups that took part in the match; groups that did not are left unbound.
     */
    static ImmutableMap<String, BoundValue> bindings(Set<String> names, java.util.regex.Matcher match, String text) {
        var bindings = ImmutableMap.<String, BoundValue>builder();
        for (var name : names) {
            int start = match.start(name);
            if (start >= 0) {
                bindings.put(name, BoundValue.of(Fragment.spanned(text, Span.of(start, match.end(name)))));
            }
        }
        return bindings.build();
    }

    private static boolean isEscaped(String source, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && source.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}
