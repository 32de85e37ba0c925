package org.tetra.chroma.math.error;

import org.tetra.chroma.math.tree.SourceSpan;

/**
 * Irregularity noticed while rendering. None of these stop a render; they are recorded so
 * callers that care can report them.
 */
public sealed interface RenderError {
    SourceSpan span();

    String message();

    /**
     * Diagnostic code, stable across releases.
     */
    String code();

    /**
     * Whether the rendered output is still faithful to the input.
     */
    default boolean isWarning() {
        return false;
    }

    default Diagnostic toDiagnostic() {
        return isWarning()
               ? Diagnostic.warning(code(), message(), span())
               : Diagnostic.error(code(), message(), span());
    }

    /**
     * Character the tokenizer does not recognise; it was skipped.
     */
    record DroppedCharacter(SourceSpan span, int codePoint) implements RenderError {
        @Override
        public String message() {
            return "Dropped character '" + Character.toString(codePoint) + "' at " + span.start();
        }

        @Override
        public String code() {
            return "M001";
        }

        @Override
        public boolean isWarning() {
            return true;
        }
    }

    /**
     * Command with no meaning of its own; rendered as its literal name.
     */
    record UnknownCommand(SourceSpan span, String name) implements RenderError {
        @Override
        public String message() {
            return "Unknown command '\\" + name + "' at " + span.start();
        }

        @Override
        public String code() {
            return "M002";
        }

        @Override
        public boolean isWarning() {
            return true;
        }

        @Override
        public Diagnostic toDiagnostic() {
            return RenderError.super.toDiagnostic()
                                    .withHelp("rendered literally as '\\" + name + "'");
        }
    }

    /**
     * Expected delimiter was absent; parsing went on as if it were there.
     */
    record MissingDelimiter(SourceSpan span, String expected, String found) implements RenderError {
        @Override
        public String message() {
            return "Expected " + expected + " but found " + found + " at " + span.start();
        }

        @Override
        public String code() {
            return "M003";
        }
    }

    /**
     * Tokens left after the top-level expression; they are not rendered.
     */
    record TrailingInput(SourceSpan span, String found) implements RenderError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + span.start() + ", rest of input ignored";
        }

        @Override
        public String code() {
            return "M004";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return RenderError.super.toDiagnostic()
                                    .withNote("only the first complete expression is rendered");
        }
    }

    /**
     * Nesting exceeded the configured depth; the offending group was skipped.
     */
    record TooDeep(SourceSpan span, int maxDepth) implements RenderError {
        @Override
        public String message() {
            return "Nesting deeper than " + maxDepth + " at " + span.start();
        }

        @Override
        public String code() {
            return "M005";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return RenderError.super.toDiagnostic()
                                    .withHelp("raise maxDepth to render deeper nesting");
        }
    }
}
