package org.tetra.chroma.math.glyph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlyphsTest {

    @Test
    void superscript_digitTwo_prefersBoldForm() {
        assertThat(Glyphs.superscript('2')).contains("𝟐");
    }

    @Test
    void superscript_digitOne_fallsBackToPlainSuperscript() {
        assertThat(Glyphs.superscript('1')).contains("¹");
    }

    @Test
    void superscript_letterOutsideTable_isEmpty() {
        assertThat(Glyphs.superscript('a')).contains("ᵃ");
        assertThat(Glyphs.superscript('q')).isEmpty();
        assertThat(Glyphs.superscript('X')).isEmpty();
    }

    @Test
    void subscript_allCharactersMappable_mapsWholeString() {
        assertThat(Glyphs.subscript("i+1")).contains("ᵢ₊₁");
        assertThat(Glyphs.subscript("n")).contains("ₙ");
    }

    @Test
    void subscript_anyCharacterUnmappable_isEmpty() {
        assertThat(Glyphs.subscript("iy")).isEmpty();
        assertThat(Glyphs.subscript("α")).isEmpty();
    }

    @Test
    void named_greekLetters_resolve() {
        assertThat(Glyphs.named("alpha")).contains("α");
        assertThat(Glyphs.named("Omega")).contains("Ω");
    }

    @Test
    void named_symbols_resolve() {
        assertThat(Glyphs.named("infty")).contains("∞");
        assertThat(Glyphs.named("leq")).contains("≤");
    }

    @Test
    void named_bigOperatorsWithoutSymbolEntry_areEmpty() {
        assertThat(Glyphs.named("bigoplus")).isEmpty();
        assertThat(Glyphs.named("bigotimes")).isEmpty();
    }

    @Test
    void named_unknownName_isEmpty() {
        assertThat(Glyphs.named("zzz")).isEmpty();
        assertThat(Glyphs.named("")).isEmpty();
    }
}
