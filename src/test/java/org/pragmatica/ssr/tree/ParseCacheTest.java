package org.pragmatica.ssr.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ParseCacheTest {

    @Test
    void parse_sameTextAndPath_reusesUnit() {
        var cache = ParseCache.create(10);
        var text = "class A {}";

        var first = cache.parse(text, "A.java", FragmentKind.UNIT);
        var second = cache.parse(text, "A.java", FragmentKind.UNIT);

        assertThat(second).isSameAs(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void parse_differentPath_parsesAgain() {
        var cache = ParseCache.create(10);
        var text = "class A {}";

        var first = cache.parse(text, "A.java", FragmentKind.UNIT);
        var second = cache.parse(text, "B.java", FragmentKind.UNIT);

        assertThat(second).isNotSameAs(first);
        assertThat(second.path()).isEqualTo("B.java");
    }

    @Test
    void clear_dropsEntries() {
        var cache = ParseCache.create(10);
        cache.parse("class A {}", "A.java", FragmentKind.UNIT);

        cache.clear();

        assertThat(cache.size()).isZero();
    }
}
