package org.tetra.chroma.math.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangle of terminal text produced for one expression node.
 *
 * @param width    columns; every line is exactly this wide
 * @param height   rows, at least one
 * @param baseline row other boxes align to when placed side by side
 * @param lines    the rows, top to bottom
 */
public record Box(int width, int height, int baseline, List<String> lines) {

    public Box {
        if (height < 1 || lines.size() != height) {
            throw new IllegalArgumentException("Box needs " + height + " >= 1 lines, got " + lines.size());
        }
        if (baseline < 0 || baseline >= height) {
            throw new IllegalArgumentException("Baseline " + baseline + " outside 0.." + (height - 1));
        }
        lines = List.copyOf(lines);
    }

    private static final Box EMPTY = new Box(0, 1, 0, List.of(""));

    public static Box empty() {
        return EMPTY;
    }

    /**
     * Single-row box holding {@code text}.
     */
    public static Box text(String text) {
        return new Box(Columns.width(text), 1, 0, List.of(text));
    }

    /**
     * Build a box from rows, padding each to the widest.
     */
    public static Box of(List<String> rows, int baseline) {
        int width = 0;
        for (var row : rows) {
            width = Math.max(width, Columns.width(row));
        }
        return of(rows, width, baseline);
    }

    /**
     * Build a box from rows, padding each to {@code width}.
     */
    public static Box of(List<String> rows, int width, int baseline) {
        var padded = new ArrayList<String>(rows.size());
        for (var row : rows) {
            padded.add(Columns.padRight(row, width));
        }
        return new Box(width, rows.size(), baseline, padded);
    }

    /**
     * Place boxes left to right with their baselines on one row.
     */
    public static Box beside(List<Box> boxes) {
        if (boxes.isEmpty()) {
            return EMPTY;
        }
        int above = 0;
        int below = 0;
        int width = 0;
        for (var box : boxes) {
            above = Math.max(above, box.baseline);
            below = Math.max(below, box.height - box.baseline - 1);
            width += box.width;
        }
        int height = above + 1 + below;
        var rows = new ArrayList<String>(height);
        for (int row = 0; row < height; row++) {
            var sb = new StringBuilder();
            for (var box : boxes) {
                sb.append(box.lineOrBlank(row - (above - box.baseline)));
            }
            rows.add(sb.toString());
        }
        return new Box(width, height, above, rows);
    }

    public static Box beside(Box... boxes) {
        return beside(List.of(boxes));
    }

    public String line(int row) {
        return lines.get(row);
    }

    /**
     * Row {@code row}, or blanks of the box width when the row lies outside the box.
     */
    public String lineOrBlank(int row) {
        return row >= 0 && row < height ? lines.get(row) : Columns.spaces(width);
    }

    /**
     * Rows joined with newlines, optionally with trailing spaces removed.
     */
    public String render(boolean trimTrailingSpace) {
        var sb = new StringBuilder();
        for (int row = 0; row < height; row++) {
            if (row > 0) {
                sb.append('\n');
            }
            sb.append(trimTrailingSpace ? lines.get(row).stripTrailing() : lines.get(row));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render(false);
    }
}
