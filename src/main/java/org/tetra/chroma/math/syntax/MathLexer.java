package org.tetra.chroma.math.syntax;

import org.tetra.chroma.math.error.RenderError;
import org.tetra.chroma.math.tree.SourceLocation;
import org.tetra.chroma.math.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Lexer for LaTeX math expressions.
 *
 * <p>Never fails: characters outside the token alphabet are skipped and reported to the
 * supplied consumer. The token list always ends with one {@link MathToken.Eof}.
 */
public final class MathLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private final Consumer<RenderError> reporter;
    private SourceLocation location;

    private MathLexer(String input, Consumer<RenderError> reporter) {
        this.input = input;
        this.reporter = reporter;
        this.location = SourceLocation.START;
    }

    public static List<MathToken> tokenize(String input) {
        return tokenize(input, error -> {});
    }

    public static List<MathToken> tokenize(String input, Consumer<RenderError> reporter) {
        return new MathLexer(input, reporter).tokenizeAll();
    }

    private List<MathToken> tokenizeAll() {
        var tokens = new ArrayList<MathToken>();
        while (!isAtEnd()) {
            skipWhitespace();
            if (!isAtEnd()) {
                nextToken(tokens);
            }
        }
        tokens.add(new MathToken.Eof(currentSpan()));
        return tokens;
    }

    private void nextToken(List<MathToken> tokens) {
        var start = location;
        char c = peek();
        if (c == '\\') {
            advance();
            var name = scanWhile(MathLexer::isLetter);
            // A backslash not followed by letters (\, \{ \\) produces nothing.
            if (!name.isEmpty()) {
                tokens.add(new MathToken.Command(span(start), name));
            }
            return;
        }
        if (isDigit(c) || c == '.') {
            var digits = scanWhile(ch -> isDigit(ch) || ch == '.');
            tokens.add(new MathToken.Num(span(start), digits));
            return;
        }
        if (isLetter(c)) {
            var letters = scanWhile(MathLexer::isLetter);
            tokens.add(new MathToken.Var(span(start), letters));
            return;
        }
        var operator = scanOperator(start);
        if (operator != null) {
            tokens.add(operator);
        }
    }

    private MathToken scanOperator(SourceLocation start) {
        int cp = input.codePointAt(location.offset());
        location = location.after(cp);
        return switch (cp) {
            case '{' -> new MathToken.LBrace(span(start));
            case '}' -> new MathToken.RBrace(span(start));
            case '(' -> new MathToken.LParen(span(start));
            case ')' -> new MathToken.RParen(span(start));
            case '[' -> new MathToken.LBrack(span(start));
            case ']' -> new MathToken.RBrack(span(start));
            case '^' -> new MathToken.Caret(span(start));
            case '_' -> new MathToken.Underscore(span(start));
            case '+' -> new MathToken.Plus(span(start));
            case '-' -> new MathToken.Minus(span(start));
            case '*' -> new MathToken.Star(span(start));
            case '/' -> new MathToken.Slash(span(start));
            case '=' -> new MathToken.Equals(span(start));
            case ',' -> new MathToken.Comma(span(start));
            default -> {
                reporter.accept(new RenderError.DroppedCharacter(span(start), cp));
                yield null;
            }
        };
    }

    private String scanWhile(CharTest test) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && test.accepts(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return location.offset() >= input.length();
    }

    private char peek() {
        return input.charAt(location.offset());
    }

    // Only called on the ASCII characters of the token alphabet
    private char advance() {
        char c = peek();
        location = location.after(c);
        return c;
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(location);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location);
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    @FunctionalInterface
    private interface CharTest {
        boolean accepts(char c);
    }
}
