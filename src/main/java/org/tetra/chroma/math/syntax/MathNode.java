package org.tetra.chroma.math.syntax;

import org.tetra.chroma.math.glyph.BigOperator;

import java.util.Optional;

/**
 * Parsed math expression. Nodes are immutable and live in the arena of one render;
 * {@link #id()} is their index there. Children always have smaller ids than their parent.
 */
public sealed interface MathNode {
    int id();

    /**
     * Numeric literal, digits and dots as written.
     */
    record Num(int id, String text) implements MathNode {}

    /**
     * Run of letters.
     */
    record Var(int id, String name) implements MathNode {}

    /**
     * Literal text: joined {@code \text} content, or an unknown command kept as written.
     */
    record Text(int id, String text) implements MathNode {}

    /**
     * Single glyph from the Greek or symbol tables.
     */
    record Symbol(int id, String glyph) implements MathNode {}

    /**
     * Absent operand.
     */
    record Empty(int id) implements MathNode {}

    record Binary(int id, Operator operator, MathNode left, MathNode right) implements MathNode {}

    record Neg(int id, MathNode operand) implements MathNode {}

    record Power(int id, MathNode base, MathNode exponent) implements MathNode {}

    record Subscript(int id, MathNode base, MathNode subscript) implements MathNode {}

    record Fraction(int id, MathNode numerator, MathNode denominator) implements MathNode {}

    /**
     * Square root. The index of {@code \sqrt[n]{..}} is kept but not drawn.
     */
    record Root(int id, MathNode radicand, Optional<MathNode> index) implements MathNode {}

    /**
     * Big operator with optional limits. The operand is not part of this node; it follows
     * as an ordinary factor.
     */
    record BigOp(int id, BigOperator operator, Optional<MathNode> lower, Optional<MathNode> upper)
        implements MathNode {}

    /**
     * Parenthesised group. {@code opening} is the literal written after {@code \left}, or
     * {@code (} for bare parentheses; it is kept for callers but never changes the drawing.
     */
    record Delimited(int id, MathNode inner, String opening) implements MathNode {}

    /**
     * Infix operators and the glyph drawn between operands.
     */
    enum Operator {
        ADD("+"),
        SUB("−"),
        EQ("="),
        MUL(" "),
        DIV("÷");

        private final String glyph;

        Operator(String glyph) {
            this.glyph = glyph;
        }

        public String glyph() {
            return glyph;
        }
    }
}
