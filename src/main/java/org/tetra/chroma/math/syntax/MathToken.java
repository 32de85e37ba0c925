package org.tetra.chroma.math.syntax;

import org.tetra.chroma.math.tree.SourceSpan;

/**
 * Token types for the math lexer.
 */
public sealed interface MathToken {
    SourceSpan span();

    /**
     * Literal text of the token; command names are given without the backslash.
     */
    String text();

    /**
     * Human readable form for diagnostics.
     */
    default String describe() {
        return "'" + text() + "'";
    }

    // Literals
    record Num(SourceSpan span, String text) implements MathToken {}

    record Var(SourceSpan span, String text) implements MathToken {}

    record Command(SourceSpan span, String text) implements MathToken {
        @Override
        public String describe() {
            return "command '\\" + text + "'";
        }
    }

    // Delimiters
    record LBrace(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "{";
        }
    }

    record RBrace(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "}";
        }
    }

    record LParen(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "(";
        }
    }

    record RParen(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return ")";
        }
    }

    record LBrack(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "[";
        }
    }

    record RBrack(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "]";
        }
    }

    // Operators
    record Caret(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "^";
        }
    }

    record Underscore(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "_";
        }
    }

    record Plus(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "+";
        }
    }

    record Minus(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "-";
        }
    }

    record Star(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "*";
        }
    }

    record Slash(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "/";
        }
    }

    record Equals(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "=";
        }
    }

    record Comma(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return ",";
        }
    }

    // Special
    record Eof(SourceSpan span) implements MathToken {
        @Override
        public String text() {
            return "";
        }

        @Override
        public String describe() {
            return "end of input";
        }
    }
}
