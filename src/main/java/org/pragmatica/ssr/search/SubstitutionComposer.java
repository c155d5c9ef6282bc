package org.pragmatica.ssr.search;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.pragmatica.ssr.substitution.Substitution;
import org.pragmatica.ssr.tree.Span;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds the substitutions of a fixed-point rewrite into one that replaces the whole key span with
 * its final text.
 */
public final class SubstitutionComposer {
    public static final String LABEL = "fixedpoint";
    public static final String HEADER = "There are a few findings here:\n\n";
    public static final String SIGNIFICANT_CATEGORY = "ssr.merged.significant";
    public static final String NOT_SIGNIFICANT_CATEGORY = "ssr.merged.not-significant";

    private static final Joiner PARAGRAPHS = Joiner.on("\n\n");

    private final String mergedUrl;

    private SubstitutionComposer(String mergedUrl) {
        this.mergedUrl = mergedUrl;
    }

    public static SubstitutionComposer of(RewriteConfig config) {
        return new SubstitutionComposer(config.mergedUrl());
    }

    /**
     * The composed substitution, or empty if there is nothing to compose.
     *
     * <p>Only significant parts contribute messages, unless none is significant. When all of them
     * point to one URL their messages are kept as they are, otherwise each message is followed by
     * its own URL and the composed one points to the merged URL.
     */
    public Optional<Substitution> compose(List<Substitution> parts, Span span, String replacement) {
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        var reported = ImmutableList.copyOf(parts.stream().filter(Substitution::significant).iterator());
        boolean significant = !reported.isEmpty();
        if (!significant) {
            reported = ImmutableList.copyOf(parts);
        }

        var urls = new LinkedHashSet<String>();
        reported.forEach(part -> urls.add(part.url().orElse(null)));
        var messages = new LinkedHashSet<String>();
        String url;
        if (urls.size() == 1) {
            url = urls.iterator().next();
            reported.forEach(part -> part.message().filter(message -> !message.isEmpty()).ifPresent(messages::add));
        } else {
            url = mergedUrl;
            reported.forEach(part -> messages.add(part.message().filter(message -> !message.isEmpty())
                                                      .orElse("(no message)")
                                                  + "\n(" + Objects.toString(part.url().orElse(null)) + ")"));
        }

        String message = null;
        if (messages.size() == 1) {
            message = messages.iterator().next();
        } else if (messages.size() > 1) {
            message = HEADER + PARAGRAPHS.join(messages);
        }
        return Optional.of(Substitution.builder()
                                       .span(LABEL, span)
                                       .primaryLabel(LABEL)
                                       .replacement(LABEL, replacement)
                                       .message(message)
                                       .url(url)
                                       .significant(significant)
                                       .category(significant ? SIGNIFICANT_CATEGORY : NOT_SIGNIFICANT_CATEGORY)
                                       .build());
    }
}
