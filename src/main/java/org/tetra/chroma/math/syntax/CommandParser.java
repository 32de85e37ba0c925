package org.tetra.chroma.math.syntax;

import org.tetra.chroma.math.error.RenderError;
import org.tetra.chroma.math.glyph.BigOperator;
import org.tetra.chroma.math.glyph.Glyphs;
import org.tetra.chroma.math.render.RenderContext;

import java.util.Optional;
import java.util.Set;

/**
 * Parses the arguments of backslash commands into their node shapes, calling back into
 * {@link MathParser} for sub-expressions.
 */
final class CommandParser {
    static final String RIGHT = "right";

    private static final Set<String> TEXT_COMMANDS = Set.of("text", "mathrm", "textit", "mathbf");

    private final RenderContext context;
    private final MathParser parser;

    CommandParser(RenderContext context, MathParser parser) {
        this.context = context;
        this.parser = parser;
    }

    /**
     * Parse the command whose name token has just been consumed.
     */
    MathNode parse(MathToken.Command command) {
        var name = command.text();

        if ("frac".equals(name)) {
            return parseFraction();
        }
        if ("sqrt".equals(name)) {
            return parseRoot();
        }
        if ("left".equals(name)) {
            return parseLeftRight();
        }

        var bigOperator = BigOperator.forCommand(name);
        if (bigOperator.isPresent()) {
            return parseBigOperator(bigOperator.get());
        }

        if (TEXT_COMMANDS.contains(name)) {
            return parseText();
        }

        var glyph = Glyphs.named(name);
        if (glyph.isPresent()) {
            return context.node(id -> new MathNode.Symbol(id, glyph.get()));
        }

        context.report(new RenderError.UnknownCommand(command.span(), name));
        return context.node(id -> new MathNode.Text(id, "\\" + name));
    }

    // \frac{num}{den}
    private MathNode parseFraction() {
        var numerator = parseRequiredGroup();
        var denominator = parseRequiredGroup();
        return context.node(id -> new MathNode.Fraction(id, numerator, denominator));
    }

    // \sqrt{x} or \sqrt[n]{x}
    private MathNode parseRoot() {
        Optional<MathNode> index = Optional.empty();
        if (context.consume(MathToken.LBrack.class)) {
            index = Optional.of(parser.parseExpression());
            context.expect(MathToken.RBrack.class, "']'");
        }
        var radicand = parseRequiredGroup();
        var rootIndex = index;
        return context.node(id -> new MathNode.Root(id, radicand, rootIndex));
    }

    // Limits may come in either order: \sum_{i=1}^{n} or \sum^{n}_{i=1}
    private MathNode parseBigOperator(BigOperator operator) {
        Optional<MathNode> lower = Optional.empty();
        Optional<MathNode> upper = Optional.empty();

        if (context.consume(MathToken.Underscore.class)) {
            lower = Optional.of(parser.parseBase());
        }
        if (context.consume(MathToken.Caret.class)) {
            upper = Optional.of(parser.parseBase());
        }
        if (lower.isEmpty() && context.consume(MathToken.Underscore.class)) {
            lower = Optional.of(parser.parseBase());
        }

        var lowerLimit = lower;
        var upperLimit = upper;
        return context.node(id -> new MathNode.BigOp(id, operator, lowerLimit, upperLimit));
    }

    /**
     * {@code \left X ... \right Y}. X is recorded but the group is always drawn round;
     * Y is discarded unchecked.
     */
    private MathNode parseLeftRight() {
        var opening = context.advance().text();
        var inner = parseLeftInterior();

        if (context.peek() instanceof MathToken.Command command && RIGHT.equals(command.text())) {
            context.advance();
            context.advance();
        } else {
            var found = context.peek();
            context.report(new RenderError.MissingDelimiter(found.span(), "'\\right'", found.describe()));
        }
        return context.node(id -> new MathNode.Delimited(id, inner, opening));
    }

    private MathNode parseLeftInterior() {
        context.openLeftGroup();
        try {
            return parser.parseExpression();
        } finally {
            context.closeLeftGroup();
        }
    }

    /**
     * Text commands join the token values up to the first closing brace. Whitespace is gone by
     * then and a command contributes its bare name: {@code \text{a b}} is {@code ab},
     * {@code \text{\alpha}} is {@code alpha}.
     */
    private MathNode parseText() {
        context.expect(MathToken.LBrace.class, "'{'");

        var sb = new StringBuilder();
        while (!context.check(MathToken.RBrace.class) && !context.isAtEnd()) {
            sb.append(context.advance().text());
        }
        context.expect(MathToken.RBrace.class, "'}'");
        var text = sb.toString();
        return context.node(id -> new MathNode.Text(id, text));
    }

    private MathNode parseRequiredGroup() {
        context.expect(MathToken.LBrace.class, "'{'");
        var group = parser.parseExpression();
        context.expect(MathToken.RBrace.class, "'}'");
        return group;
    }
}
