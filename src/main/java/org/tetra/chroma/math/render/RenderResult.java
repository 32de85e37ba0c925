package org.tetra.chroma.math.render;

import org.tetra.chroma.math.error.Diagnostic;
import org.tetra.chroma.math.layout.Box;

import java.util.List;

/**
 * Rendered expression together with the diagnostics collected while producing it.
 *
 * <p>The text is always present: lenient rendering substitutes for every problem it meets.
 * {@code diagnostics} is empty when the input was rendered exactly as written.
 *
 * @param text        The rendered rows joined with newlines
 * @param box         The laid-out root box
 * @param diagnostics Problems found, in the order they were met
 * @param source      The expression (for formatting diagnostics)
 */
public record RenderResult(
    String text,
    Box box,
    List<Diagnostic> diagnostics,
    String source
) {
    public RenderResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param filename Optional name for display
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int errorCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
                                .count();
    }

    public int warningCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                                .count();
    }
}
