package org.pragmatica.ssr.substitution;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.ssr.tree.Span;

import java.util.Set;

/**
 * A piece of the diff a substitution describes.
 */
public sealed interface DiffPart {

    Span span();

    /**
     * Original text under one set of labels. A new piece starts wherever a label starts or ends.
     */
    record LabeledSpan(Span span, Set<String> labels) implements DiffPart {
        public LabeledSpan {
            labels = ImmutableSet.copyOf(labels);
        }
    }

    /**
     * Text replaced for one label. Other labels may start or end inside it.
     */
    record DiffSpan(Span span, String label, String after) implements DiffPart {}
}
