package org.tetra.chroma.math.error;

import org.junit.jupiter.api.Test;
import org.tetra.chroma.math.tree.SourceLocation;
import org.tetra.chroma.math.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    private static final SourceSpan SPAN = SourceSpan.of(SourceLocation.at(1, 7, 6),
                                                         SourceLocation.at(1, 10, 9));

    @Test
    void format_underlinesSpan() {
        var diagnostic = Diagnostic.error("M003", "Expected '}'", SPAN);

        var formatted = diagnostic.format("\\frac{abc", "input");

        assertThat(formatted).isEqualTo("""
            error[M003]: Expected '}'
              --> input:1:7
              |
            1 | \\frac{abc
              |       ^^^
              |
            """);
    }

    @Test
    void format_withoutFilename() {
        var formatted = Diagnostic.warning("M001", "Dropped", SPAN).format("\\frac{abc", null);
        assertThat(formatted).startsWith("warning[M001]: Dropped\n  --> 1:7\n");
    }

    @Test
    void withHelp_appendsNote() {
        var diagnostic = Diagnostic.error("M002", "Unknown", SPAN)
                                   .withNote("rendered literally")
                                   .withHelp("check the spelling");

        assertThat(diagnostic.notes()).containsExactly("rendered literally", "help: check the spelling");
        assertThat(diagnostic.format("\\frac{abc", "input"))
            .contains("  = help: check the spelling\n");
    }

    @Test
    void formatSimple_singleLine() {
        assertThat(Diagnostic.error("M004", "Unexpected '}'", SPAN).formatSimple())
            .isEqualTo("input:1:7: error: Unexpected '}'");
    }

    @Test
    void renderError_severityFollowsKind() {
        var dropped = new RenderError.DroppedCharacter(SPAN, '#');
        var tooDeep = new RenderError.TooDeep(SPAN, 4);

        assertThat(dropped.toDiagnostic().severity()).isEqualTo(Diagnostic.Severity.WARNING);
        assertThat(dropped.message()).isEqualTo("Dropped character '#' at 1:7");
        assertThat(tooDeep.toDiagnostic().severity()).isEqualTo(Diagnostic.Severity.ERROR);
        assertThat(tooDeep.toDiagnostic().code()).isEqualTo("M005");
    }

    @Test
    void unknownCommand_diagnosticCarriesHelp() {
        var diagnostic = new RenderError.UnknownCommand(SPAN, "foo").toDiagnostic();

        assertThat(diagnostic.notes()).containsExactly("help: rendered literally as '\\foo'");
        assertThat(diagnostic.format("\\frac{abc", "input"))
            .endsWith("  |\n  = help: rendered literally as '\\foo'\n");
    }

    @Test
    void trailingInputAndTooDeep_diagnosticsCarryNotes() {
        assertThat(new RenderError.TrailingInput(SPAN, "'}'").toDiagnostic().notes())
            .containsExactly("only the first complete expression is rendered");
        assertThat(new RenderError.TooDeep(SPAN, 4).toDiagnostic().notes())
            .containsExactly("help: raise maxDepth to render deeper nesting");
        assertThat(new RenderError.MissingDelimiter(SPAN, "'}'", "end of input").toDiagnostic().notes())
            .isEmpty();
    }
}
