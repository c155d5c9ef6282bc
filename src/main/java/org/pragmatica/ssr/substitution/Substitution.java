package org.pragmatica.ssr.substitution;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.ssr.tree.Span;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A search result: labeled spans of the source text, optional replacement text for some of them,
 * and metadata describing the finding.
 *
 * <p>Spans are character offsets into the text the substitution was found in. Instances are
 * validated on construction and immutable; use {@link #toBuilder()} to derive a modified copy.
 */
public final class Substitution {
    private static final Pattern CATEGORY = Pattern.compile("\\A[^-.\\s][^.\\s]*([.][^.\\s]+)*\\z");

    private final ImmutableMap<String, Span> matchedSpans;
    private final String primaryLabel;
    private final ImmutableMap<String, String> replacements;
    private final String message;
    private final String url;
    private final boolean significant;
    private final String category;
    private final Span keySpan;

    private Substitution(Builder builder) {
        this.matchedSpans = ImmutableMap.copyOf(builder.matchedSpans);
        this.primaryLabel = builder.primaryLabel;
        this.replacements = ImmutableMap.copyOf(builder.replacements);
        this.message = builder.message;
        this.url = builder.url;
        this.significant = builder.significant;
        this.category = builder.category;
        this.keySpan = builder.keySpan;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().matchedSpans(matchedSpans)
                            .primaryLabel(primaryLabel)
                            .replacements(replacements)
                            .message(message)
                            .url(url)
                            .significant(significant)
                            .category(category)
                            .keySpan(keySpan);
    }

    private void validate() {
        Preconditions.checkArgument(primaryLabel != null, "primary label is not set");
        Preconditions.checkArgument(category == null || CATEGORY.matcher(category).matches(),
                                    "Invalid category name: must be dot separated categories with no leading dash,"
                                    + " got '%s'", category);
        Preconditions.checkArgument(matchedSpans.containsKey(primaryLabel),
                                    "primary label (%s) not in matched spans (%s)", primaryLabel, matchedSpans);
        Preconditions.checkArgument(matchedSpans.keySet().containsAll(replacements.keySet()),
                                    "replacement labels (%s) are not a subset of matched span labels (%s)",
                                    replacements.keySet(), matchedSpans.keySet());
    }

    // === Accessors ===

    public Map<String, Span> matchedSpans() {
        return matchedSpans;
    }

    public String primaryLabel() {
        return primaryLabel;
    }

    public Span primarySpan() {
        return matchedSpans.get(primaryLabel);
    }

    /**
     * Replacement text per label. Labels without an entry are kept as they are.
     */
    public Map<String, String> replacements() {
        return replacements;
    }

    public boolean hasReplacements() {
        return !replacements.isEmpty();
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    public Optional<String> url() {
        return Optional.ofNullable(url);
    }

    public boolean significant() {
        return significant;
    }

    public Optional<String> category() {
        return Optional.ofNullable(category);
    }

    /**
     * The span that groups substitutions for iterative rewriting, if any.
     */
    public Optional<Span> keySpan() {
        return Optional.ofNullable(keySpan);
    }

    // === Derived ===

    /**
     * The same substitution for the substring {@code [start, end)} of the text, or empty if some
     * span does not fit within it. The key span is dropped.
     */
    public Optional<Substitution> relativeTo(int start, int end) {
        var spans = new LinkedHashMap<String, Span>();
        var window = Span.of(start, end);
        for (var entry : matchedSpans.entrySet()) {
            if (!window.encloses(entry.getValue())) {
                return Optional.empty();
            }
            spans.put(entry.getKey(), entry.getValue().shift(-start));
        }
        return Optional.of(toBuilder().matchedSpans(spans).keySpan(null).build());
    }

    /**
     * Every category this substitution belongs to: {@code a.b.c} is in {@code a}, {@code a.b} and
     * {@code a.b.c}.
     */
    public List<String> allCategories() {
        if (category == null) {
            return List.of();
        }
        var categories = ImmutableList.<String>builder();
        int dot = category.indexOf('.');
        while (dot >= 0) {
            categories.add(category.substring(0, dot));
            dot = category.indexOf('.', dot + 1);
        }
        return categories.add(category).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Substitution other)) {
            return false;
        }
        return significant == other.significant
               && matchedSpans.equals(other.matchedSpans)
               && primaryLabel.equals(other.primaryLabel)
               && replacements.equals(other.replacements)
               && Objects.equals(message, other.message)
               && Objects.equals(url, other.url)
               && Objects.equals(category, other.category)
               && Objects.equals(keySpan, other.keySpan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matchedSpans, primaryLabel, replacements, message, url, significant, category, keySpan);
    }

    @Override
    public String toString() {
        return "Substitution[" + primaryLabel + "=" + primarySpan() + ", spans=" + matchedSpans
               + ", replacements=" + replacements + ", category=" + category + "]";
    }

    /**
     * Builder for substitutions. Significant by default.
     */
    public static final class Builder {
        private Map<String, Span> matchedSpans = new LinkedHashMap<>();
        private String primaryLabel;
        private Map<String, String> replacements = new LinkedHashMap<>();
        private String message;
        private String url;
        private boolean significant = true;
        private String category;
        private Span keySpan;

        private Builder() {}

        public Builder matchedSpans(Map<String, Span> spans) {
            this.matchedSpans = new LinkedHashMap<>(spans);
            return this;
        }

        public Builder span(String label, Span span) {
            this.matchedSpans.put(label, span);
            return this;
        }

        public Builder primaryLabel(String label) {
            this.primaryLabel = label;
            return this;
        }

        public Builder replacements(Map<String, String> replacements) {
            this.replacements = new LinkedHashMap<>(replacements);
            return this;
        }

        public Builder replacement(String label, String text) {
            this.replacements.put(label, text);
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder significant(boolean significant) {
            this.significant = significant;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder keySpan(Span keySpan) {
            this.keySpan = keySpan;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the substitution is inconsistent
         */
        public Substitution build() {
            return new Substitution(this);
        }
    }
}
