package org.tetra.chroma.math.cli;

import org.tetra.chroma.math.LatexMath;
import org.tetra.chroma.math.render.InlineMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Copies a document from standard input to standard output with its math spans rendered.
 *
 * <p>{@code --first-row} keeps inline math on its line, showing only the top row of each span.
 */
public final class MarkdownMathCli {
    static final String FIRST_ROW_FLAG = "--first-row";

    public static void main(String[] args) {
        var out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.exit(run(args, System.in, out));
    }

    static int run(String[] args, InputStream in, PrintStream out) {
        var builder = LatexMath.builder();
        for (var arg : args) {
            if (FIRST_ROW_FLAG.equals(arg)) {
                builder.inlineMode(InlineMode.FIRST_ROW);
            } else {
                System.err.println("Usage: MarkdownMathCli [" + FIRST_ROW_FLAG + "] < document");
                return 2;
            }
        }

        final String document;
        try {
            document = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read standard input: " + e.getMessage());
            return 1;
        }

        // Keep the document's final newline, if any, as the only one
        var body = document.endsWith("\n") ? document.substring(0, document.length() - 1) : document;
        var filtered = LatexMath.filter(builder.build(), body);
        out.print(filtered);
        if (!filtered.isEmpty() || document.endsWith("\n")) {
            out.println();
        }
        out.flush();
        return 0;
    }

    private MarkdownMathCli() {}
}
