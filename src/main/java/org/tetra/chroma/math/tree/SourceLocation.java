package org.tetra.chroma.math.tree;

/**
 * Position in an expression. Line and column are 1-based and count code points; the offset
 * is the 0-based {@code char} index into the expression string.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location just past {@code codePoint}, read at this location.
     */
    public SourceLocation after(int codePoint) {
        if (codePoint == '\n') {
            return new SourceLocation(line + 1, 1, offset + 1);
        }
        return new SourceLocation(line, column + 1, offset + Character.charCount(codePoint));
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
