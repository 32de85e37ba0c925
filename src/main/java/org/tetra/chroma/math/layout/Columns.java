package org.tetra.chroma.math.layout;

/**
 * Column arithmetic on terminal text. One code point is one column, which holds for every
 * glyph the renderer emits, including the supplementary bold digits.
 */
public final class Columns {
    private Columns() {}

    public static int width(String text) {
        return text.codePointCount(0, text.length());
    }

    public static String spaces(int count) {
        return count > 0 ? " ".repeat(count) : "";
    }

    public static String repeat(String glyph, int count) {
        return count > 0 ? glyph.repeat(count) : "";
    }

    /**
     * Left-align {@code text} in a field of {@code width} columns. Longer text is kept whole.
     */
    public static String padRight(String text, int width) {
        return text + spaces(width - width(text));
    }

    /**
     * Center {@code text} in {@code width} columns, extra column to the right.
     */
    public static String center(String text, int width) {
        int free = width - width(text);
        int left = free / 2;
        return spaces(left) + text + spaces(free - left);
    }

    /**
     * Place {@code text} after {@code indent} columns, padded to {@code width}.
     */
    public static String indent(String text, int indent, int width) {
        return padRight(spaces(indent) + text, width);
    }
}
