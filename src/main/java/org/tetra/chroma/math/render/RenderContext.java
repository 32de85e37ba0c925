package org.tetra.chroma.math.render;

import org.tetra.chroma.math.error.RenderError;
import org.tetra.chroma.math.layout.Box;
import org.tetra.chroma.math.syntax.MathLexer;
import org.tetra.chroma.math.syntax.MathNode;
import org.tetra.chroma.math.syntax.MathToken;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Mutable state of a single render: token stream and cursor, node arena, box cache,
 * nesting depth and collected errors. One context per call; never shared between threads.
 */
public final class RenderContext {

    private final RenderConfig config;
    private final List<MathToken> tokens;
    private final List<MathNode> nodes;
    private final List<Box> boxes;
    private final List<RenderError> errors;

    private int pos;
    private int depth;
    private boolean depthReported;
    private int openLeftGroups;

    private RenderContext(String source, RenderConfig config) {
        this.config = config;
        this.nodes = new ArrayList<>();
        this.boxes = new ArrayList<>();
        this.errors = new ArrayList<>();
        this.tokens = MathLexer.tokenize(source, errors::add);
        this.pos = 0;
        this.depth = 0;
        this.depthReported = false;
        this.openLeftGroups = 0;
    }

    /**
     * Tokenize {@code source} into a fresh context.
     */
    public static RenderContext create(String source, RenderConfig config) {
        return new RenderContext(source, config);
    }

    public RenderConfig config() {
        return config;
    }

    // === Token Stream ===

    public List<MathToken> tokens() {
        return List.copyOf(tokens);
    }

    public MathToken peek() {
        return tokens.get(pos);
    }

    public boolean isAtEnd() {
        return peek() instanceof MathToken.Eof;
    }

    /**
     * Return the current token and move past it. The cursor never moves beyond EOF.
     */
    public MathToken advance() {
        var token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    public boolean check(Class<? extends MathToken> type) {
        return type.isInstance(peek());
    }

    /**
     * Consume the current token if it has the given type.
     */
    public boolean consume(Class<? extends MathToken> type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consume a delimiter the grammar expects here; when absent, record it and carry on.
     */
    public void expect(Class<? extends MathToken> type, String expected) {
        if (!consume(type)) {
            var found = peek();
            report(new RenderError.MissingDelimiter(found.span(), expected, found.describe()));
        }
    }

    // === Node Arena ===

    /**
     * Allocate the next node id and append the node built for it.
     */
    public <T extends MathNode> T node(IntFunction<T> factory) {
        var node = factory.apply(nodes.size());
        nodes.add(node);
        return node;
    }

    public List<MathNode> nodes() {
        return List.copyOf(nodes);
    }

    public int nodeCount() {
        return nodes.size();
    }

    // === Box Cache ===

    public boolean hasBox(MathNode node) {
        return node.id() < boxes.size();
    }

    public Box box(MathNode node) {
        if (!hasBox(node)) {
            throw new IllegalStateException("Node " + node.id() + " laid out before its children");
        }
        return boxes.get(node.id());
    }

    /**
     * Store the box of the next node in arena order.
     */
    public void storeBox(MathNode node, Box box) {
        if (node.id() != boxes.size()) {
            throw new IllegalStateException("Box for node " + node.id() + " stored out of order");
        }
        boxes.add(box);
    }

    // === Depth Guard ===

    /**
     * Enter one nesting level. Returns false, recording {@link RenderError.TooDeep} once per
     * render, when the configured maximum is reached; the level is not entered then.
     */
    public boolean enter() {
        if (depth >= config.maxDepth()) {
            if (!depthReported) {
                depthReported = true;
                report(new RenderError.TooDeep(peek().span(), config.maxDepth()));
            }
            return false;
        }
        depth++;
        return true;
    }

    public void exit() {
        depth--;
    }

    public int depth() {
        return depth;
    }

    // === \left Groups ===

    public void openLeftGroup() {
        openLeftGroups++;
    }

    public void closeLeftGroup() {
        openLeftGroups--;
    }

    /**
     * Whether a {@code \left} is waiting for its {@code \right}.
     */
    public boolean insideLeftGroup() {
        return openLeftGroups > 0;
    }

    // === Errors ===

    public void report(RenderError error) {
        errors.add(error);
    }

    public List<RenderError> errors() {
        return List.copyOf(errors);
    }
}
