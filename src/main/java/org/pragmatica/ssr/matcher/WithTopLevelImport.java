package org.pragmatica.ssr.matcher;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.match.MatchContext;
import org.pragmatica.ssr.match.MatchResult;

import java.util.Optional;
import java.util.Set;

/**
 * Runs {@code submatcher} only in compilation units that import {@code qualifiedName} so that it is
 * visible as {@code simpleName}.
 *
 * <p>Both single-type and on-demand ({@code .*}) imports count, static or not. Fragments that are
 * not whole compilation units have no imports and never match.
 */
public final class WithTopLevelImport implements Matcher {
    private final Matcher submatcher;
    private final String qualifiedName;
    private final String simpleName;

    public WithTopLevelImport(Matcher submatcher, String qualifiedName, String simpleName) {
        this.submatcher = submatcher;
        this.qualifiedName = qualifiedName;
        this.simpleName = simpleName;
    }

    public WithTopLevelImport(Matcher submatcher, String qualifiedName) {
        this(submatcher, qualifiedName, lastSegment(qualifiedName));
    }

    @Override
    public Optional<MatchResult> match(MatchContext context, Object candidate) {
        Imports imports = context.memoize(Imports.class, () -> Imports.of(context.unit().root()));
        if (!imports.visibleAs(qualifiedName, simpleName)) {
            return Optional.empty();
        }
        return submatcher.match(context, candidate);
    }

    @Override
    public Optional<Set<Class<?>>> typeFilter() {
        return submatcher.typeFilter();
    }

    @Override
    public Set<String> bindVariables() {
        return submatcher.bindVariables();
    }

    private static String lastSegment(String qualifiedName) {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    private record Imports(ImmutableMap<String, String> single, ImmutableSet<String> onDemand) {
        static Imports of(Object root) {
            var single = ImmutableMap.<String, String>builder();
            var onDemand = ImmutableSet.<String>builder();
            if (root instanceof CompilationUnit unit) {
                for (ImportDeclaration declaration : unit.getImports()) {
                    var name = declaration.getNameAsString();
                    if (declaration.isAsterisk()) {
                        onDemand.add(name);
                    } else {
                        single.put(name, lastSegment(name));
                    }
                }
            }
            return new Imports(single.buildKeepingLast(), onDemand.build());
        }

        boolean visibleAs(String qualifiedName, String simpleName) {
            if (simpleName.equals(single.get(qualifiedName))) {
                return true;
            }
            int dot = qualifiedName.lastIndexOf('.');
            return dot > 0
                   && onDemand.contains(qualifiedName.substring(0, dot))
                   && simpleName.equals(qualifiedName.substring(dot + 1));
        }
    }
}
