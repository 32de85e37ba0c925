package org.tetra.chroma.math.cli;

import org.tetra.chroma.math.LatexMath;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Renders one expression to standard output.
 *
 * <p>The expression is the arguments joined with spaces; with no arguments, all of standard
 * input is read instead. A lone {@code --demo} prints a gallery of rendered examples and a lone
 * {@code --info} lists the supported constructs.
 */
public final class LatexCli {
    static final String DEMO_FLAG = "--demo";
    static final String INFO_FLAG = "--info";

    public static void main(String[] args) {
        var out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.exit(run(args, System.in, out));
    }

    static int run(String[] args, InputStream in, PrintStream out) {
        if (args.length == 1 && DEMO_FLAG.equals(args[0])) {
            Showcase.printDemo(LatexMath.renderer(), out);
            out.flush();
            return 0;
        }
        if (args.length == 1 && INFO_FLAG.equals(args[0])) {
            Showcase.printInfo(out);
            out.flush();
            return 0;
        }

        final String expression;
        if (args.length > 0) {
            expression = String.join(" ", args);
        } else {
            try {
                expression = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                System.err.println("Failed to read standard input: " + e.getMessage());
                return 1;
            }
        }
        out.println(LatexMath.render(expression));
        out.flush();
        return 0;
    }

    private LatexCli() {}
}
