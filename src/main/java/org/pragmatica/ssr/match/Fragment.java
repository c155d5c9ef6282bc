package org.pragmatica.ssr.match;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import org.pragmatica.ssr.tree.ParsedUnit;
import org.pragmatica.ssr.tree.Span;

import java.util.Optional;

/**
 * What a matcher matched: nothing in particular, a string, a span of the file, an arbitrary
 * object, or a syntax node together with its span.
 */
public sealed interface Fragment {

    Fragment EMPTY = new Empty();

    default Optional<Span> span() {
        return Optional.empty();
    }

    default Optional<String> text() {
        return Optional.empty();
    }

    default Optional<Object> matched() {
        return Optional.empty();
    }

    /**
     * Fragment for a candidate of a parsed unit: syntax nodes keep their span and source text, a
     * non-empty node list spans its items.
     */
    static Fragment of(ParsedUnit unit, Object candidate) {
        if (candidate instanceof Node node) {
            var span = unit.spanOf(node);
            if (span.isPresent()) {
                return new Syntax(node, span.get(), unit.textOf(span.get()));
            }
        }
        if (candidate instanceof NodeList<?> list && list.isNonEmpty()) {
            var first = unit.spanOf(list.get(0));
            var last = unit.spanOf(list.get(list.size() - 1));
            if (first.isPresent() && last.isPresent()) {
                var span = Span.of(first.get().start(), last.get().end());
                return new Spanned(span, unit.textOf(span));
            }
        }
        if (candidate instanceof String string) {
            return new Text(string);
        }
        return new Opaque(candidate);
    }

    static Fragment spanned(String text, Span span) {
        return new Spanned(span, span.extract(text));
    }

    /**
     * Same match: the same node instance, or equal for every other kind of fragment.
     */
    static boolean identical(Fragment left, Fragment right) {
        if (left instanceof Syntax a && right instanceof Syntax b) {
            return a.node() == b.node() && a.range().equals(b.range());
        }
        return left.equals(right);
    }

    record Empty() implements Fragment {}

    record Text(String content) implements Fragment {
        @Override
        public Optional<String> text() {
            return Optional.of(content);
        }

        @Override
        public Optional<Object> matched() {
            return Optional.of(content);
        }
    }

    record Spanned(Span range, String content) implements Fragment {
        @Override
        public Optional<Span> span() {
            return Optional.of(range);
        }

        @Override
        public Optional<String> text() {
            return Optional.of(content);
        }

        @Override
        public Optional<Object> matched() {
            return Optional.of(content);
        }
    }

    record Opaque(Object object) implements Fragment {
        @Override
        public Optional<Object> matched() {
            return Optional.ofNullable(object);
        }
    }

    record Syntax(Node node, Span range, String content) implements Fragment {
        @Override
        public Optional<Span> span() {
            return Optional.of(range);
        }

        @Override
        public Optional<String> text() {
            return Optional.of(content);
        }

        @Override
        public Optional<Object> matched() {
            return Optional.of(node);
        }

        @Override
        public String toString() {
            return "Syntax[" + node.getClass().getSimpleName() + " " + range + " '" + content + "']";
        }
    }
}
