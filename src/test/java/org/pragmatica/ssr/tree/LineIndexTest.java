package org.pragmatica.ssr.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineIndexTest {

    @Test
    void location_mixedLineTerminators_countsEachOnce() {
        var index = LineIndex.of("a\r\nb\rc\nd");

        assertThat(index.lineCount()).isEqualTo(4);
        assertThat(index.location(3)).isEqualTo(SourceLocation.at(2, 1, 3));
        assertThat(index.location(7)).isEqualTo(SourceLocation.at(4, 1, 7));
    }

    @Test
    void offset_lineAndColumn_roundTripsThroughLocation() {
        var index = LineIndex.of("first\nsecond\n");

        int offset = index.offset(2, 3);

        assertThat(offset).isEqualTo(8);
        assertThat(index.lineStart(offset)).isEqualTo(6);
        assertThat(index.lineOf(offset)).isEqualTo(2);
    }

    @Test
    void offset_beyondText_isClamped() {
        var index = LineIndex.of("ab");

        assertThat(index.offset(5, 1)).isEqualTo(2);
        assertThat(index.offset(1, 10)).isEqualTo(2);
        assertThat(index.offset(0, 1)).isZero();
    }
}
