package org.tetra.chroma.math.render;

/**
 * Renderer configuration options.
 *
 * @param maxDepth          deepest nesting the parser descends into before skipping a group
 * @param inlineMode        placement of multi-row inline results
 * @param trimTrailingSpace strip trailing spaces from every output row; off by default, so
 *                          each row is exactly as wide as the rendered box
 */
public record RenderConfig(
    int maxDepth,
    InlineMode inlineMode,
    boolean trimTrailingSpace
) {
    public static final int DEFAULT_MAX_DEPTH = 128;

    public static final RenderConfig DEFAULT = new RenderConfig(
        DEFAULT_MAX_DEPTH,
        InlineMode.REFLOW,
        false
    );

    public RenderConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        if (inlineMode == null) {
            throw new IllegalArgumentException("inlineMode is required");
        }
    }
}
