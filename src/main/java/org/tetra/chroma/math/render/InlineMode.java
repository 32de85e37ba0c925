package org.tetra.chroma.math.render;

/**
 * How an inline {@code $...$} span that renders taller than one row is placed in its line.
 */
public enum InlineMode {
    /**
     * Keep only the top row of the rendered box; the rest is discarded.
     */
    FIRST_ROW,

    /**
     * Lay out the whole line on a shared baseline and emit every row.
     */
    REFLOW
}
