package org.tetra.chroma.math.cli;

import org.tetra.chroma.math.render.MathRenderer;

import java.io.PrintStream;
import java.util.List;

/**
 * The {@code --demo} gallery and the {@code --info} summary printed by {@link LatexCli}.
 */
final class Showcase {
    private static final String RULE = "━".repeat(62);

    private static final String BANNER = """

        ╔══════════════════════════════════════════════════════════════════════╗
        ║                  LaTeX → UTF-8 Math Renderer                         ║
        ║                        chroma-math                                   ║
        ╚══════════════════════════════════════════════════════════════════════╝
        """;

    private static final String INFO = """
        Renders LaTeX math expressions to UTF-8 terminal output.

        Supported constructs:
          Variables       x, y, z, abc
          Numbers         123, 3.14
          Operators       + - * / = ^ _
          Fractions       \\frac{num}{den}
          Square roots    \\sqrt{x}, \\sqrt[n]{x}
          Superscripts    x^2, x^{2+n}
          Subscripts      x_i, x_{i+1}
          Greek letters   \\alpha, \\beta, \\gamma, ...
          Symbols         \\infty, \\pm, \\leq, \\geq, ...
          Big operators   \\sum, \\prod, \\int, \\bigcup, \\bigcap, \\lim with limits
          Parentheses     (, ), \\left( \\right)
          Text            \\text{...}

        Examples:
          LatexCli '\\frac{1}{2}'
          LatexCli '\\sum_{i=0}^{n} x_i'
          LatexCli 'e^{i\\pi} + 1 = 0'
          LatexCli --demo
        """;

    static final List<Example> EXAMPLES = List.of(
        new Example("Pythagorean Theorem", "x^2 + y^2 = z^2"),
        new Example("Quadratic Formula", "\\frac{-b + \\sqrt{b^2 - 4ac}}{2a}"),
        new Example("Summation", "\\sum_{i=1}^{n} x_i^2"),
        new Example("Gaussian Integral", "\\int_{-\\infty}^{\\infty} e^{-x^2} dx"),
        new Example("Continued Fraction (Golden Ratio)", "\\frac{1}{1 + \\frac{1}{1 + \\frac{1}{1 + x}}}"),
        new Example("Greek Letters", "\\alpha + \\beta + \\gamma = \\delta"),
        new Example("Euler's Identity", "e^{i\\pi} + 1 = 0"),
        new Example("Square Root", "\\sqrt{a^2 + b^2 + c^2}"));

    record Example(String title, String expression) {}

    private Showcase() {}

    /**
     * Banner, then every example under a ruled heading followed by its rendering.
     */
    static void printDemo(MathRenderer renderer, PrintStream out) {
        out.print(BANNER);
        out.println();
        for (var example : EXAMPLES) {
            out.println(RULE);
            out.println("  " + example.title());
            out.println(RULE);
            out.println();
            out.println(renderer.render(example.expression()));
            out.println();
            out.println();
        }
    }

    static void printInfo(PrintStream out) {
        out.print(INFO);
    }
}
