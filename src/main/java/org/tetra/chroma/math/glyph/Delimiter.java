package org.tetra.chroma.math.glyph;

/**
 * Parenthesis pieces drawn around {@code \left ... \right} groups and bare parentheses.
 *
 * <p>A one-row group uses the plain characters; taller groups are built from the
 * Unicode bracket pieces, one per row. Every group is drawn round, whatever literal
 * followed {@code \left}.
 */
public final class Delimiter {
    private Delimiter() {}

    public static final String OPEN = "(";
    public static final String CLOSE = ")";

    public static String left(int row, int height) {
        return height == 1 ? OPEN : piece(row, height, "⎛", "⎜", "⎝");
    }

    public static String right(int row, int height) {
        return height == 1 ? CLOSE : piece(row, height, "⎞", "⎟", "⎠");
    }

    private static String piece(int row, int height, String top, String middle, String bottom) {
        if (row == 0) {
            return top;
        }
        return row == height - 1 ? bottom : middle;
    }
}
