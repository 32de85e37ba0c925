package org.tetra.chroma.math.render;

import org.tetra.chroma.math.layout.Box;

/**
 * Renders LaTeX math expressions to multi-line Unicode text. Implementations hold no
 * per-call state and may be shared between threads.
 */
public interface MathRenderer {

    /**
     * Render to newline-joined rows. Never fails; malformed input gives odd but printable output.
     */
    String render(String expression);

    /**
     * Lay out the expression without flattening it to text.
     */
    Box layout(String expression);

    /**
     * Render and also return what was dropped, guessed or skipped along the way.
     */
    RenderResult renderWithDiagnostics(String expression);

    RenderConfig config();
}
