package org.tetra.chroma.math.tree;

/**
 * Region of an expression, start inclusive and end exclusive. A span with no length marks a
 * point, such as the end of input.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public SourceSpan {
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span ends at " + end + " before it starts at " + start);
        }
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public boolean isEmpty() {
        return start.offset() == end.offset();
    }

    @Override
    public String toString() {
        return isEmpty() ? start.toString() : start + "-" + end;
    }
}
