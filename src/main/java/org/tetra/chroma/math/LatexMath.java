package org.tetra.chroma.math;

import org.tetra.chroma.math.markdown.MathSpanFilter;
import org.tetra.chroma.math.render.BoxMathRenderer;
import org.tetra.chroma.math.render.InlineMode;
import org.tetra.chroma.math.render.MathRenderer;
import org.tetra.chroma.math.render.RenderConfig;
import org.tetra.chroma.math.render.RenderResult;

/**
 * Entry point for rendering LaTeX math to terminal text.
 *
 * <p>Example usage:
 * <pre>{@code
 * System.out.println(LatexMath.render("\\frac{-b+\\sqrt{b^2-4ac}}{2a}"));
 *
 * var renderer = LatexMath.builder()
 *                         .maxDepth(32)
 *                         .inlineMode(InlineMode.FIRST_ROW)
 *                         .build();
 * }</pre>
 */
public final class LatexMath {
    private LatexMath() {}

    private static final MathRenderer DEFAULT_RENDERER = BoxMathRenderer.create(RenderConfig.DEFAULT);

    /**
     * Render an expression (delimiters already removed) with the default configuration.
     */
    public static String render(String expression) {
        return DEFAULT_RENDERER.render(expression);
    }

    /**
     * Render an expression and collect diagnostics about anything that was not taken literally.
     */
    public static RenderResult renderWithDiagnostics(String expression) {
        return DEFAULT_RENDERER.renderWithDiagnostics(expression);
    }

    /**
     * Replace the {@code $$...$$} and {@code $...$} spans of a document with rendered math.
     */
    public static String filter(String document) {
        return filter(DEFAULT_RENDERER, document);
    }

    public static String filter(MathRenderer renderer, String document) {
        return MathSpanFilter.create(renderer).filter(document);
    }

    public static MathRenderer renderer() {
        return DEFAULT_RENDERER;
    }

    public static MathRenderer renderer(RenderConfig config) {
        return BoxMathRenderer.create(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = RenderConfig.DEFAULT_MAX_DEPTH;
        private InlineMode inlineMode = RenderConfig.DEFAULT.inlineMode();
        private boolean trimTrailingSpace = RenderConfig.DEFAULT.trimTrailingSpace();

        private Builder() {}

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Builder inlineMode(InlineMode mode) {
            this.inlineMode = mode;
            return this;
        }

        public Builder trimTrailingSpace(boolean trim) {
            this.trimTrailingSpace = trim;
            return this;
        }

        public RenderConfig config() {
            return new RenderConfig(maxDepth, inlineMode, trimTrailingSpace);
        }

        public MathRenderer build() {
            return BoxMathRenderer.create(config());
        }
    }
}
