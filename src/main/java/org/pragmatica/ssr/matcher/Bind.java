package org.pragmatica.ssr.matcher;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.BindConflict;
import org.pragmatica.ssr.match.BindMerge;
import org.pragmatica.ssr.match.Bindings;
import org.pragmatica.ssr.match.BoundValue;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Binds what {@code submatcher} matched to a metavariable.
 *
 * <p>User metavariable names are identifiers that do not start with {@code __}; that prefix is
 * reserved for labels the engine binds itself (see {@link #system(String, Matcher)}).
 */
public final class Bind implements Matcher {
    public static final String RESERVED_PREFIX = "__";

    private static final Pattern NAME = Pattern.compile("\\A(?!__)[a-zA-Z_]\\w*\\z");
    private static final Pattern SYSTEM_NAME = Pattern.compile("\\A__\\w+\\z");

    private final String name;
    private final Matcher submatcher;
    private final BindConflict onConflict;
    private final BindMerge onMerge;

    private Bind(String name, Matcher submatcher, BindConflict onConflict, BindMerge onMerge) {
        this.name = name;
        this.submatcher = submatcher;
        this.onConflict = onConflict;
        this.onMerge = onMerge;
    }

    public static Bind of(String name) {
        return of(name, Anything.INSTANCE);
    }

    public static Bind of(String name, Matcher submatcher) {
        return of(name, submatcher, BindConflict.MERGE, BindMerge.KEEP_LAST);
    }

    public static Bind of(String name, Matcher submatcher, BindConflict onConflict, BindMerge onMerge) {
        Preconditions.checkArgument(isValidName(name), "invalid bind name: '%s' doesn't match %s", name, NAME);
        return new Bind(name, submatcher, onConflict, onMerge);
    }

    /**
     * A binding under a reserved {@code __} label.
     */
    public static Bind system(String name, Matcher submatcher) {
        Preconditions.checkArgument(SYSTEM_NAME.matcher(name).matches(),
                                    "invalid system bind name: '%s' doesn't match %s", name, SYSTEM_NAME);
        return new Bind(name, submatcher, BindConflict.MERGE, BindMerge.KEEP_LAST);
    }

    public static boolean isValidName(String name) {
        return NAME.matcher(name).matches();
    }

    public static boolean isSystemLabel(String label) {
        return label.startsWith(RESERVED_PREFIX);
    }

    public String name() {
        return name;
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        var result = submatcher.match(context, candidate);
        if (result.isEmpty()) {
            return Optional.empty();
        }
        var bound = BoundValue.of(result.get().match(), onConflict, onMerge);
        return Bindings.merge(result.get().bindings(), Map.of(name, bound))
                       .map(bindings -> result.get().withBindings(bindings));
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return submatcher.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return ImmutableSet.<String>builder().add(name).addAll(submatcher.bindVariables()).build();
    }

    @Override
    public String toString() {
        return "Bind[" + name + ", " + submatcher + ", " + onConflict + "/" + onMerge + "]";
    }
}
