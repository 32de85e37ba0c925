package org.tetra.chroma.math.layout;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoxTest {

    @Test
    void text_isSingleRowOnBaseline() {
        var box = Box.text("abc");
        assertThat(box.width()).isEqualTo(3);
        assertThat(box.height()).isEqualTo(1);
        assertThat(box.baseline()).isZero();
    }

    @Test
    void empty_hasZeroWidthAndOneRow() {
        var box = Box.empty();
        assertThat(box.width()).isZero();
        assertThat(box.height()).isEqualTo(1);
        assertThat(box.render(true)).isEmpty();
    }

    @Test
    void of_padsRowsToWidest() {
        var box = Box.of(List.of("a", "abc"), 1);
        assertThat(box.width()).isEqualTo(3);
        assertThat(box.lines()).containsExactly("a  ", "abc");
    }

    @Test
    void beside_alignsBaselines() {
        var tall = Box.of(List.of("1", "━", "2"), 1);
        var flat = Box.text("+x");

        var joined = Box.beside(tall, flat);

        assertThat(joined.height()).isEqualTo(3);
        assertThat(joined.baseline()).isEqualTo(1);
        assertThat(joined.width()).isEqualTo(3);
        assertThat(joined.lines()).containsExactly("1  ", "━+x", "2  ");
    }

    @Test
    void beside_differentDepthsBelowBaseline() {
        var high = Box.of(List.of("a", "b"), 1);
        var low = Box.of(List.of("c", "d"), 0);

        var joined = Box.beside(high, low);

        assertThat(joined.lines()).containsExactly("a ", "bc", " d");
        assertThat(joined.baseline()).isEqualTo(1);
    }

    @Test
    void beside_nothing_isEmpty() {
        assertThat(Box.beside(List.of())).isEqualTo(Box.empty());
    }

    @Test
    void render_trimsTrailingSpacesOnlyWhenAsked() {
        var box = Box.of(List.of("a", "abc"), 0);
        assertThat(box.render(true)).isEqualTo("a\nabc");
        assertThat(box.render(false)).isEqualTo("a  \nabc");
    }

    @Test
    void lineOrBlank_outsideBox_isBlankOfWidth() {
        var box = Box.text("ab");
        assertThat(box.lineOrBlank(-1)).isEqualTo("  ");
        assertThat(box.lineOrBlank(1)).isEqualTo("  ");
        assertThat(box.lineOrBlank(0)).isEqualTo("ab");
    }

    @Test
    void constructor_rejectsInconsistentShape() {
        assertThatThrownBy(() -> new Box(1, 2, 0, List.of("a")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Box(1, 1, 1, List.of("a")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Box(0, 0, 0, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
