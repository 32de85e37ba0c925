package org.tetra.chroma.math.glyph;

import java.util.List;
import java.util.Optional;

/**
 * Operators drawn as a multi-row glyph with optional limits above and below.
 *
 * <p>Each operator carries the rows of its display glyph, top to bottom. Two rows
 * for most operators, three for the integral so the curve has room.
 */
public enum BigOperator {
    SUM("sum", "╲▔", "▁╱"),
    PROD("prod", "┬─┬", "│ │"),
    INT("int", " ╭", "│ ", "╯ "),
    BIGCUP("bigcup", "╭─╮", "╰─╯"),
    BIGCAP("bigcap", "╰─╯", "╭─╮"),
    LIM("lim", "   ", "lim");

    private static final int MIN_GLYPH_WIDTH = 2;

    private final String command;
    private final List<String> rows;

    BigOperator(String command, String... rows) {
        this.command = command;
        this.rows = List.of(rows);
    }

    public String command() {
        return command;
    }

    public List<String> rows() {
        return rows;
    }

    /**
     * Glyph width in columns, never narrower than two.
     */
    public int glyphWidth() {
        int width = MIN_GLYPH_WIDTH;
        for (var row : rows) {
            width = Math.max(width, row.codePointCount(0, row.length()));
        }
        return width;
    }

    /**
     * Upper limit is drawn to the right of the glyph instead of centered above it.
     */
    public boolean shiftsUpperLimit() {
        return this == INT;
    }

    public static Optional<BigOperator> forCommand(String command) {
        for (var op : values()) {
            if (op.command.equals(command)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
