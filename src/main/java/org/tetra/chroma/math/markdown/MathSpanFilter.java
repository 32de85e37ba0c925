package org.tetra.chroma.math.markdown;

import org.tetra.chroma.math.layout.Box;
import org.tetra.chroma.math.render.InlineMode;
import org.tetra.chroma.math.render.MathRenderer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Finds math spans in a text document and replaces them with rendered output.
 *
 * <p>Display math starts on a line beginning with {@code $$} and runs to the next {@code $$},
 * possibly lines later; the enclosed lines are joined with spaces and every rendered row
 * is emitted. Inline math is {@code $...$} within a line. Spans are rendered one at a
 * time, in document order.
 */
public final class MathSpanFilter {
    private static final String DISPLAY_FENCE = "$$";
    private static final char INLINE_FENCE = '$';

    private final MathRenderer renderer;
    private final InlineMode inlineMode;

    private MathSpanFilter(MathRenderer renderer, InlineMode inlineMode) {
        this.renderer = renderer;
        this.inlineMode = inlineMode;
    }

    public static MathSpanFilter create(MathRenderer renderer) {
        return create(renderer, renderer.config().inlineMode());
    }

    public static MathSpanFilter create(MathRenderer renderer, InlineMode inlineMode) {
        return new MathSpanFilter(renderer, inlineMode);
    }

    public String filter(String document) {
        return String.join("\n", filterLines(Arrays.asList(document.split("\n", -1))));
    }

    public List<String> filterLines(List<String> lines) {
        var out = new ArrayList<String>(lines.size());
        StringBuilder display = null;

        for (var line : lines) {
            if (display != null) {
                int close = line.indexOf(DISPLAY_FENCE);
                if (close >= 0) {
                    display.append(' ').append(line, 0, close);
                    emitDisplay(display.toString(), out);
                    display = null;
                } else {
                    display.append(' ').append(line);
                }
                continue;
            }

            var trimmed = line.stripLeading();
            if (trimmed.startsWith(DISPLAY_FENCE)) {
                var rest = trimmed.substring(DISPLAY_FENCE.length());
                int close = rest.indexOf(DISPLAY_FENCE);
                if (close >= 0) {
                    emitDisplay(rest.substring(0, close), out);
                } else {
                    display = new StringBuilder(rest);
                }
                continue;
            }

            out.addAll(filterInline(line));
        }

        // Unterminated display math is still shown
        if (display != null) {
            emitDisplay(display.toString(), out);
        }
        return out;
    }

    /**
     * Render the inline spans of one line. Returns one row in {@link InlineMode#FIRST_ROW}
     * mode, as many rows as the tallest span needs in {@link InlineMode#REFLOW} mode.
     */
    public List<String> filterInline(String line) {
        var segments = split(line);
        if (segments.size() == 1) {
            return List.of(line);
        }
        if (inlineMode == InlineMode.FIRST_ROW) {
            var sb = new StringBuilder();
            for (var segment : segments) {
                sb.append(segment.math() ? firstRow(renderer.render(segment.text())) : segment.text());
            }
            return List.of(sb.toString());
        }

        var boxes = new ArrayList<Box>(segments.size());
        for (var segment : segments) {
            boxes.add(segment.math() ? renderer.layout(segment.text()) : Box.text(segment.text()));
        }
        var rendered = Box.beside(boxes).render(renderer.config().trimTrailingSpace());
        return List.of(rendered.split("\n", -1));
    }

    private void emitDisplay(String expression, List<String> out) {
        out.addAll(List.of(renderer.render(expression).split("\n", -1)));
    }

    /**
     * Alternating plain and math segments; always ends with the (possibly empty) plain tail.
     * A {@code $} without a closing partner, or directly followed by another, ends the scan.
     */
    private static List<Segment> split(String line) {
        var segments = new ArrayList<Segment>();
        int from = 0;
        while (true) {
            int open = line.indexOf(INLINE_FENCE, from);
            if (open < 0) {
                break;
            }
            int close = line.indexOf(INLINE_FENCE, open + 1);
            if (close < 0 || close == open + 1) {
                break;
            }
            segments.add(new Segment(line.substring(from, open), false));
            segments.add(new Segment(line.substring(open + 1, close), true));
            from = close + 1;
        }
        segments.add(new Segment(line.substring(from), false));
        return segments;
    }

    private static String firstRow(String rendered) {
        int newline = rendered.indexOf('\n');
        return newline < 0 ? rendered : rendered.substring(0, newline);
    }

    private record Segment(String text, boolean math) {}
}
