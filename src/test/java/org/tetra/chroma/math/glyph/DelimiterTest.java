package org.tetra.chroma.math.glyph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DelimiterTest {

    @Test
    void singleRow_usesPlainParentheses() {
        assertThat(Delimiter.left(0, 1)).isEqualTo("(");
        assertThat(Delimiter.right(0, 1)).isEqualTo(")");
    }

    @Test
    void tall_buildsFromPieces() {
        assertThat(Delimiter.left(0, 3)).isEqualTo("⎛");
        assertThat(Delimiter.left(1, 3)).isEqualTo("⎜");
        assertThat(Delimiter.left(2, 3)).isEqualTo("⎝");
        assertThat(Delimiter.right(0, 3)).isEqualTo("⎞");
        assertThat(Delimiter.right(1, 3)).isEqualTo("⎟");
        assertThat(Delimiter.right(2, 3)).isEqualTo("⎠");
    }

    @Test
    void twoRows_topAndBottomOnly() {
        assertThat(Delimiter.left(0, 2)).isEqualTo("⎛");
        assertThat(Delimiter.left(1, 2)).isEqualTo("⎝");
        assertThat(Delimiter.right(1, 2)).isEqualTo("⎠");
    }
}
