package org.tetra.chroma.math.layout;

import org.tetra.chroma.math.glyph.BigOperator;
import org.tetra.chroma.math.glyph.Delimiter;
import org.tetra.chroma.math.glyph.Glyphs;
import org.tetra.chroma.math.render.RenderContext;
import org.tetra.chroma.math.syntax.MathNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Two-dimensional layout of parsed expressions.
 *
 * <p>Boxes are computed bottom-up by walking the arena in id order: every child was created
 * before its parent, so its box is already in the cache when the parent is laid out. Each
 * node is laid out exactly once and no recursion is involved.
 */
public final class BoxLayout {
    private static final String FRACTION_BAR = "━";
    private static final String ROOT_BAR = "▁";
    private static final String ROOT_SIGN = "╲╱ ";
    private static final String MINUS = "−";

    private final RenderContext context;

    private BoxLayout(RenderContext context) {
        this.context = context;
    }

    /**
     * Lay out every node of the arena and return the box of {@code root}.
     */
    public static Box layout(RenderContext context, MathNode root) {
        var layout = new BoxLayout(context);
        for (var node : context.nodes()) {
            if (!context.hasBox(node)) {
                context.storeBox(node, layout.layoutNode(node));
            }
        }
        return context.box(root);
    }

    private Box layoutNode(MathNode node) {
        if (node instanceof MathNode.Num num) {
            return Box.text(num.text());
        }
        if (node instanceof MathNode.Var variable) {
            return Box.text(variable.name());
        }
        if (node instanceof MathNode.Text text) {
            return Box.text(text.text());
        }
        if (node instanceof MathNode.Symbol symbol) {
            return Box.text(symbol.glyph());
        }
        if (node instanceof MathNode.Empty) {
            return Box.empty();
        }
        if (node instanceof MathNode.Binary binary) {
            return layoutBinary(binary);
        }
        if (node instanceof MathNode.Neg neg) {
            return layoutNeg(box(neg.operand()));
        }
        if (node instanceof MathNode.Power power) {
            return layoutPower(box(power.base()), box(power.exponent()));
        }
        if (node instanceof MathNode.Subscript subscript) {
            return layoutSubscript(box(subscript.base()), box(subscript.subscript()));
        }
        if (node instanceof MathNode.Fraction fraction) {
            return layoutFraction(box(fraction.numerator()), box(fraction.denominator()));
        }
        if (node instanceof MathNode.Root root) {
            return layoutRoot(box(root.radicand()));
        }
        if (node instanceof MathNode.BigOp bigOp) {
            return layoutBigOperator(bigOp.operator(), limit(bigOp.lower()), limit(bigOp.upper()));
        }
        if (node instanceof MathNode.Delimited delimited) {
            return layoutDelimited(box(delimited.inner()));
        }
        throw new IllegalStateException("Unhandled node " + node);
    }

    private Box box(MathNode node) {
        return context.box(node);
    }

    private Optional<Box> limit(Optional<MathNode> node) {
        return node.map(this::box);
    }

    // Operands side by side on a shared baseline, operator glyph on that row.
    private Box layoutBinary(MathNode.Binary binary) {
        var operator = Box.text(" " + binary.operator().glyph() + " ");
        return Box.beside(box(binary.left()), operator, box(binary.right()));
    }

    private static Box layoutNeg(Box operand) {
        var rows = new ArrayList<String>(operand.height());
        for (int row = 0; row < operand.height(); row++) {
            rows.add((row == operand.baseline() ? MINUS : " ") + operand.line(row));
        }
        return new Box(operand.width() + 1, operand.height(), operand.baseline(), rows);
    }

    /**
     * A one-character exponent with a superscript glyph goes in an extra row above the base's
     * right edge; anything else is stacked whole above and to the right of the base.
     */
    private static Box layoutPower(Box base, Box exponent) {
        var glyph = inlineSuperscript(exponent);
        if (glyph.isPresent()) {
            var rows = new ArrayList<String>(base.height() + 1);
            rows.add(Columns.spaces(base.width()) + glyph.get());
            for (var line : base.lines()) {
                rows.add(line + " ");
            }
            return new Box(base.width() + 1, base.height() + 1, base.baseline() + 1, rows);
        }

        int width = base.width() + exponent.width();
        var rows = new ArrayList<String>(base.height() + exponent.height());
        for (var line : exponent.lines()) {
            rows.add(Columns.spaces(base.width()) + line);
        }
        for (var line : base.lines()) {
            rows.add(line + Columns.spaces(exponent.width()));
        }
        return new Box(width, rows.size(), exponent.height() + base.baseline(), rows);
    }

    private static Optional<String> inlineSuperscript(Box exponent) {
        if (exponent.height() != 1 || exponent.width() != 1) {
            return Optional.empty();
        }
        return Glyphs.superscript(exponent.line(0).codePointAt(0));
    }

    /**
     * Subscripts made only of mappable characters are appended to the base's bottom row;
     * others hang below-right, sharing one row with the base.
     */
    private static Box layoutSubscript(Box base, Box subscript) {
        var glyphs = subscript.height() == 1
                     ? Glyphs.subscript(subscript.line(0))
                     : Optional.<String>empty();
        if (glyphs.isPresent()) {
            var tail = glyphs.get();
            var rows = new ArrayList<String>(base.height());
            for (int row = 0; row < base.height(); row++) {
                var suffix = row == base.height() - 1 ? tail : Columns.spaces(Columns.width(tail));
                rows.add(base.line(row) + suffix);
            }
            return new Box(base.width() + Columns.width(tail), base.height(), base.baseline(), rows);
        }

        int height = base.height() + subscript.height() - 1;
        int width = base.width() + subscript.width();
        var rows = new ArrayList<String>(height);
        for (int row = 0; row < height; row++) {
            rows.add(base.lineOrBlank(row) + subscript.lineOrBlank(row - base.height() + 1));
        }
        return new Box(width, height, base.baseline(), rows);
    }

    private static Box layoutFraction(Box numerator, Box denominator) {
        int width = Math.max(numerator.width(), denominator.width());
        var rows = new ArrayList<String>(numerator.height() + 1 + denominator.height());
        for (var line : numerator.lines()) {
            rows.add(Columns.center(line, width));
        }
        rows.add(Columns.repeat(FRACTION_BAR, width));
        for (var line : denominator.lines()) {
            rows.add(Columns.center(line, width));
        }
        return new Box(width, rows.size(), numerator.height(), rows);
    }

    private static Box layoutRoot(Box radicand) {
        int width = radicand.width() + ROOT_SIGN.length();
        var rows = new ArrayList<String>(radicand.height() + 1);
        rows.add(Columns.padRight("  " + Columns.repeat(ROOT_BAR, radicand.width()), width));
        for (int row = 0; row < radicand.height(); row++) {
            var prefix = row == 0 ? ROOT_SIGN : Columns.spaces(ROOT_SIGN.length());
            rows.add(prefix + radicand.line(row));
        }
        return new Box(width, rows.size(), radicand.baseline() + 1, rows);
    }

    /**
     * Glyph rows with the upper limit above and the lower limit below, both centered; the
     * integral's upper limit sits to the right of the glyph instead.
     */
    private static Box layoutBigOperator(BigOperator operator, Optional<Box> lower, Optional<Box> upper) {
        int glyphWidth = operator.glyphWidth();
        int lowerWidth = lower.map(Box::width).orElse(0);
        int upperWidth = upper.map(Box::width).orElse(0);
        boolean shifted = operator.shiftsUpperLimit() && upper.isPresent();

        int width = shifted
                    ? Math.max(glyphWidth + upperWidth, lowerWidth)
                    : Math.max(glyphWidth, Math.max(lowerWidth, upperWidth));
        int upperHeight = upper.map(Box::height).orElse(0);

        var rows = new ArrayList<String>();
        upper.ifPresent(box -> {
            int pad = shifted ? glyphWidth : (width - box.width() + 1) / 2;
            for (var line : box.lines()) {
                rows.add(Columns.indent(line, pad, width));
            }
        });
        for (var glyphRow : operator.rows()) {
            rows.add(Columns.padRight(glyphRow, width));
        }
        lower.ifPresent(box -> {
            int pad = (width - box.width()) / 2;
            for (var line : box.lines()) {
                rows.add(Columns.indent(line, pad, width));
            }
        });
        return new Box(width, rows.size(), upperHeight + 1, rows);
    }

    private static Box layoutDelimited(Box inner) {
        int height = inner.height();
        var rows = new ArrayList<String>(height);
        for (int row = 0; row < height; row++) {
            rows.add(Delimiter.left(row, height) + inner.line(row) + Delimiter.right(row, height));
        }
        return new Box(inner.width() + 2, height, inner.baseline(), List.copyOf(rows));
    }
}
