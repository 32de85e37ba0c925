package org.tetra.chroma.math.cli;

import org.junit.jupiter.api.Test;
import org.tetra.chroma.math.LatexMath;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LatexCliTest {

    private static final String NL = System.lineSeparator();

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private static InputStream stdin(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void arguments_joinedWithSpaces() {
        int code = LatexCli.run(new String[]{"\\frac{1}", "{2}"}, stdin(""), out);

        assertEquals(0, code);
        assertEquals("1\n━\n2" + NL, output());
    }

    @Test
    void noArguments_readsStandardInput() {
        int code = LatexCli.run(new String[0], stdin("x_i\n"), out);

        assertEquals(0, code);
        assertEquals("xᵢ" + NL, output());
    }

    @Test
    void malformedInput_stillSucceeds() {
        int code = LatexCli.run(new String[]{"\\frac{1}{2"}, stdin(""), out);

        assertEquals(0, code);
        assertEquals("1\n━\n2" + NL, output());
    }

    @Test
    void demoFlag_printsEveryExampleRendered() {
        int code = LatexCli.run(new String[]{LatexCli.DEMO_FLAG}, stdin(""), out);

        assertEquals(0, code);
        var printed = output();
        assertThat(printed).contains("LaTeX → UTF-8 Math Renderer");
        for (var example : Showcase.EXAMPLES) {
            assertThat(printed)
                .contains("  " + example.title() + NL)
                .contains(LatexMath.render(example.expression()) + NL);
        }
        assertThat(printed).contains(NL + "━".repeat(62) + NL + "  Square Root" + NL);
    }

    @Test
    void infoFlag_listsSupportedConstructs() {
        int code = LatexCli.run(new String[]{LatexCli.INFO_FLAG}, stdin(""), out);

        assertEquals(0, code);
        assertThat(output())
            .startsWith("Renders LaTeX math expressions to UTF-8 terminal output.\n")
            .contains("  Fractions       \\frac{num}{den}\n")
            .endsWith("  LatexCli --demo\n");
    }

    @Test
    void demoFlagAmongOtherArguments_isPartOfExpression() {
        int code = LatexCli.run(new String[]{"x", LatexCli.DEMO_FLAG}, stdin(""), out);

        assertEquals(0, code);
        assertThat(output()).doesNotContain("Pythagorean");
    }
}
