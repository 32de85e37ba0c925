package org.tetra.chroma.math.error;

import org.tetra.chroma.math.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic message with Rust-style formatting against the rendered expression.
 *
 * <p>Example output:
 * <pre>
 * error[M003]: Expected '}' but found end of input at 1:11
 *   --> input:1:11
 *   |
 * 1 | \frac{1}{2
 *   |           ^
 *   |
 * </pre>
 *
 * @param severity Severity level
 * @param code     Error code such as {@code M003}, may be null
 * @param message  Primary message
 * @param span     Region of the expression the message is about
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of());
    }

    public static Diagnostic warning(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, code, message, span, List.of());
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format in Rust style.
     *
     * @param source   The expression text the span refers to
     * @param filename Optional name shown after the arrow
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var start = span.start();

        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(start.line()).append(":").append(start.column()).append("\n");

        int lastLine = Math.min(span.end().line(), lines.length);
        int gutterWidth = String.valueOf(Math.max(lastLine, 1)).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        for (int lineNum = start.line(); lineNum <= lastLine; lineNum++) {
            var content = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(content)
              .append("\n");
            sb.append(gutter).append("| ").append(underline(lineNum, content)).append("\n");
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form for logs.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("%s:%d:%d: %s: %s", "input", loc.line(), loc.column(), severity.display(), message);
    }

    private String underline(int lineNum, String content) {
        int startCol = span.start().line() == lineNum ? span.start().column() : 1;
        int endCol = span.end().line() == lineNum ? span.end().column() : content.length() + 1;
        int length = Math.max(1, endCol - startCol);
        return " ".repeat(startCol - 1) + "^".repeat(length);
    }
}
