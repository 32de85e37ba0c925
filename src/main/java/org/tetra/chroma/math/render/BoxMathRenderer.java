package org.tetra.chroma.math.render;

import org.tetra.chroma.math.error.Diagnostic;
import org.tetra.chroma.math.error.RenderError;
import org.tetra.chroma.math.layout.Box;
import org.tetra.chroma.math.layout.BoxLayout;
import org.tetra.chroma.math.syntax.MathParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Tokenize, parse and lay out each expression in a fresh {@link RenderContext}.
 */
public final class BoxMathRenderer implements MathRenderer {
    private static final Logger logger = LoggerFactory.getLogger(BoxMathRenderer.class);

    private final RenderConfig config;

    private BoxMathRenderer(RenderConfig config) {
        this.config = config;
    }

    public static BoxMathRenderer create(RenderConfig config) {
        return new BoxMathRenderer(Objects.requireNonNull(config, "config"));
    }

    @Override
    public String render(String expression) {
        return layout(expression).render(config.trimTrailingSpace());
    }

    @Override
    public Box layout(String expression) {
        return run(expression).box();
    }

    @Override
    public RenderResult renderWithDiagnostics(String expression) {
        return run(expression);
    }

    @Override
    public RenderConfig config() {
        return config;
    }

    private RenderResult run(String expression) {
        Objects.requireNonNull(expression, "expression");
        var context = RenderContext.create(expression, config);
        var root = MathParser.parse(context);
        var box = BoxLayout.layout(context, root);

        var diagnostics = context.errors()
                                 .stream()
                                 .map(RenderError::toDiagnostic)
                                 .collect(Collectors.toList());

        logger.debug("Rendered {} nodes into {}x{} box", context.nodeCount(), box.width(), box.height());
        if (!diagnostics.isEmpty()) {
            logger.debug("Render of '{}' recovered from: {}", expression,
                         diagnostics.stream().map(Diagnostic::formatSimple).collect(Collectors.joining("; ")));
        }

        return new RenderResult(box.render(config.trimTrailingSpace()), box, diagnostics, expression);
    }
}
