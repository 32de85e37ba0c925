package org.tetra.chroma.math.render;

import org.junit.jupiter.api.Test;
import org.tetra.chroma.math.error.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoxMathRendererTest {

    private final MathRenderer renderer = BoxMathRenderer.create(RenderConfig.DEFAULT);

    @Test
    void renderWithDiagnostics_cleanInput_noDiagnostics() {
        var result = renderer.renderWithDiagnostics("\\frac{1}{2}");

        assertThat(result.text()).isEqualTo("1\n━\n2");
        assertThat(result.isClean()).isTrue();
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.formatDiagnostics()).isEmpty();
        assertThat(result.box().height()).isEqualTo(3);
    }

    @Test
    void renderWithDiagnostics_unknownCommand_isWarning() {
        var result = renderer.renderWithDiagnostics("\\zzz + 1");

        assertThat(result.text()).isEqualTo("\\zzz + 1");
        assertThat(result.warningCount()).isEqualTo(1);
        assertThat(result.errorCount()).isZero();
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.diagnostics().get(0).code()).isEqualTo("M002");
        assertThat(result.formatDiagnostics()).contains("= help: rendered literally as '\\zzz'");
    }

    @Test
    void renderWithDiagnostics_problemsInSourceOrder() {
        var result = renderer.renderWithDiagnostics("a # \\frac{1}{2");

        assertThat(result.diagnostics())
            .extracting(Diagnostic::code)
            .containsExactly("M001", "M003");
        assertThat(result.diagnostics().get(0).severity()).isEqualTo(Diagnostic.Severity.WARNING);
        assertThat(result.diagnostics().get(1).severity()).isEqualTo(Diagnostic.Severity.ERROR);
        assertThat(result.hasErrors()).isTrue();
    }

    @Test
    void renderWithDiagnostics_textMatchesRender() {
        var source = "\\sum_{i=1}^{n} \\frac{x_i}{2}";
        assertThat(renderer.renderWithDiagnostics(source).text()).isEqualTo(renderer.render(source));
    }

    @Test
    void formatDiagnostics_pointsAtProblem() {
        var formatted = renderer.renderWithDiagnostics("\\frac{1}{2").formatDiagnostics("eq");

        assertThat(formatted)
            .contains("error[M003]: Expected '}' but found end of input at 1:11")
            .contains("--> eq:1:11")
            .contains("1 | \\frac{1}{2");
    }

    @Test
    void render_byDefault_keepsPaddedRows() {
        assertThat(renderer.render("x^2")).isEqualTo(" 𝟐\nx ");
        assertThat(renderer.render("\\sqrt{4}")).isEqualTo("  ▁ \n╲╱ 4");
    }

    @Test
    void trimEnabled_stripsPaddedRows() {
        var trimmed = BoxMathRenderer.create(new RenderConfig(128, InlineMode.REFLOW, true));
        assertThat(trimmed.render("x^2")).isEqualTo(" 𝟐\nx");
        assertThat(trimmed.render("\\sqrt{4}")).isEqualTo("  ▁\n╲╱ 4");
        assertThat(trimmed.renderWithDiagnostics("\\frac{1}{22}").text()).isEqualTo("1\n━━\n22");
    }

    @Test
    void render_nullExpression_rejected() {
        assertThatThrownBy(() -> renderer.render(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> BoxMathRenderer.create(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void render_sharedAcrossThreads_sameOutput() {
        var source = "\\frac{-b+\\sqrt{b^2-4ac}}{2a}";
        var expected = renderer.render(source);

        List<String> results = IntStream.range(0, 64)
                                        .parallel()
                                        .mapToObj(i -> renderer.render(source))
                                        .collect(Collectors.toList());

        assertThat(results).allMatch(expected::equals);
    }
}
