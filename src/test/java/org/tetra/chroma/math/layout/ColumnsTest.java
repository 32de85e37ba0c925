package org.tetra.chroma.math.layout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ColumnsTest {

    @Test
    void width_countsCodePoints() {
        assertEquals(3, Columns.width("abc"));
        assertEquals(1, Columns.width("𝟐"));
        assertEquals(2, Columns.width("╲╱"));
        assertEquals(0, Columns.width(""));
    }

    @Test
    void spaces_negativeCount_isEmpty() {
        assertEquals("", Columns.spaces(-2));
        assertEquals("   ", Columns.spaces(3));
    }

    @Test
    void center_extraColumnGoesRight() {
        assertEquals(" a  ", Columns.center("a", 4));
        assertEquals(" a ", Columns.center("a", 3));
        assertEquals("abc", Columns.center("abc", 2));
    }

    @Test
    void padRight_measuresInCodePoints() {
        assertEquals("𝟐  ", Columns.padRight("𝟐", 3));
    }

    @Test
    void indent_padsToWidth() {
        assertEquals("  n  ", Columns.indent("n", 2, 5));
    }
}
