package org.tetra.chroma.math.syntax;

import org.tetra.chroma.math.error.RenderError;
import org.tetra.chroma.math.glyph.Delimiter;
import org.tetra.chroma.math.render.RenderContext;

/**
 * Recursive descent parser for math expressions.
 *
 * <pre>
 *   expr   &lt;- term (('+' / '-' / '=') term)*
 *   term   &lt;- factor (('*' / '/' / implicit) factor)*
 *   factor &lt;- base (('^' / '_') base)*
 *   base   &lt;- NUM / VAR / command / '(' expr ')' / '{' expr '}' / '-' factor
 * </pre>
 *
 * <p>Parsing never fails. Missing closing delimiters are recorded and skipped over, and a
 * position where no operand can start yields an {@link MathNode.Empty} node.
 */
public final class MathParser {

    private final RenderContext context;
    private final CommandParser commands;

    private MathParser(RenderContext context) {
        this.context = context;
        this.commands = new CommandParser(context, this);
    }

    /**
     * Parse the tokens of {@code context} into its arena and return the root node.
     * Tokens after the top-level expression are reported and left unparsed.
     */
    public static MathNode parse(RenderContext context) {
        var root = new MathParser(context).parseExpression();
        if (!context.isAtEnd()) {
            var found = context.peek();
            context.report(new RenderError.TrailingInput(found.span(), found.describe()));
        }
        return root;
    }

    MathNode parseExpression() {
        var left = parseTerm();

        while (true) {
            MathNode.Operator operator;
            if (context.consume(MathToken.Plus.class)) {
                operator = MathNode.Operator.ADD;
            } else if (context.consume(MathToken.Minus.class)) {
                operator = MathNode.Operator.SUB;
            } else if (context.consume(MathToken.Equals.class)) {
                operator = MathNode.Operator.EQ;
            } else {
                break;
            }
            left = binary(operator, left, parseTerm());
        }
        return left;
    }

    private MathNode parseTerm() {
        var left = parseFactor();

        while (true) {
            if (context.consume(MathToken.Star.class)) {
                left = binary(MathNode.Operator.MUL, left, parseFactor());
            } else if (context.consume(MathToken.Slash.class)) {
                left = binary(MathNode.Operator.DIV, left, parseFactor());
            } else if (canStartFactor()) {
                // Implicit multiplication: 2x, ab, \alpha\beta
                left = binary(MathNode.Operator.MUL, left, parseFactor());
            } else {
                break;
            }
        }
        return left;
    }

    private MathNode parseFactor() {
        var base = parseBase();

        while (true) {
            if (context.consume(MathToken.Caret.class)) {
                var exponent = parseBase();
                var target = base;
                base = context.node(id -> new MathNode.Power(id, target, exponent));
            } else if (context.consume(MathToken.Underscore.class)) {
                var subscript = parseBase();
                var target = base;
                base = context.node(id -> new MathNode.Subscript(id, target, subscript));
            } else {
                break;
            }
        }
        return base;
    }

    MathNode parseBase() {
        if (!context.enter()) {
            skipGroup();
            return context.node(MathNode.Empty::new);
        }
        try {
            return parsePrimary();
        } finally {
            context.exit();
        }
    }

    private MathNode parsePrimary() {
        var token = context.peek();

        if (token instanceof MathToken.Num num) {
            context.advance();
            return context.node(id -> new MathNode.Num(id, num.text()));
        }

        if (token instanceof MathToken.Var variable) {
            context.advance();
            return context.node(id -> new MathNode.Var(id, variable.text()));
        }

        if (token instanceof MathToken.Command command && !closesLeftGroup(command)) {
            context.advance();
            return commands.parse(command);
        }

        if (token instanceof MathToken.LParen) {
            context.advance();
            var inner = parseExpression();
            context.expect(MathToken.RParen.class, "')'");
            return context.node(id -> new MathNode.Delimited(id, inner, Delimiter.OPEN));
        }

        // Braces group without leaving a trace in the tree
        if (token instanceof MathToken.LBrace) {
            context.advance();
            var inner = parseExpression();
            context.expect(MathToken.RBrace.class, "'}'");
            return inner;
        }

        if (token instanceof MathToken.Minus) {
            context.advance();
            var operand = parseFactor();
            return context.node(id -> new MathNode.Neg(id, operand));
        }

        return context.node(MathNode.Empty::new);
    }

    /**
     * Whether the current token can begin a factor, which makes two adjacent factors a product.
     * Inside a {@code \left} group, {@code \right} never starts an operand, so the group ends
     * there; anywhere else it is an ordinary unknown command.
     */
    private boolean canStartFactor() {
        var token = context.peek();
        if (token instanceof MathToken.Command command) {
            return !closesLeftGroup(command);
        }
        return token instanceof MathToken.Num
            || token instanceof MathToken.Var
            || token instanceof MathToken.LParen
            || token instanceof MathToken.LBrace;
    }

    /**
     * Skip one token, or a whole bracketed group when it starts with an opening delimiter.
     */
    private void skipGroup() {
        int open = 0;
        do {
            var token = context.peek();
            if (token instanceof MathToken.Eof) {
                return;
            }
            if (isOpening(token)) {
                open++;
            } else if (isClosing(token) && open > 0) {
                open--;
            }
            context.advance();
        } while (open > 0);
    }

    private MathNode binary(MathNode.Operator operator, MathNode left, MathNode right) {
        return context.node(id -> new MathNode.Binary(id, operator, left, right));
    }

    private boolean closesLeftGroup(MathToken.Command command) {
        return context.insideLeftGroup() && CommandParser.RIGHT.equals(command.text());
    }

    private static boolean isOpening(MathToken token) {
        return token instanceof MathToken.LBrace
            || token instanceof MathToken.LParen
            || token instanceof MathToken.LBrack;
    }

    private static boolean isClosing(MathToken token) {
        return token instanceof MathToken.RBrace
            || token instanceof MathToken.RParen
            || token instanceof MathToken.RBrack;
    }
}
