package org.pragmatica.syntax.tree;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import org.pragmatica.syntax.error.MalformedTreeException;
import org.pragmatica.syntax.error.TreeError;
import org.pragmatica.syntax.kind.KindRegistry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Interior node of a lossless syntax tree.
 *
 * <p>Grammar productions extend this class, keep their children in fields and describe those fields with a
 * {@link NodeSchema}. Children are attached through {@link #adopt} while the parser builds the tree bottom-up;
 * after the root is built the tree does not change. A node stores no span of its own: positions and text are
 * derived from the tokens underneath it and from the source held by the {@link SourceFileNode} root.
 */
public abstract non-sealed class Node implements SyntaxElement {
    private Node parent;
    // Benign race: every reader resolves the same root.
    private SourceFileNode root;

    protected Node() {}

    /**
     * Descriptor of this node's variant. Must return the same constant for every instance of a class.
     */
    public abstract NodeSchema<? extends Node> schema();

    @Override
    public int kind() {
        return schema().kind();
    }

    public Optional<String> kindName(KindRegistry nodeKinds) {
        return nodeKinds.nameOf(kind());
    }

    public String variantName() {
        return getClass().getSimpleName();
    }

    // === Construction ===

    /**
     * Attach a child to this node. Tokens and {@code null} pass through unchanged.
     *
     * @throws MalformedTreeException if the child node already has a parent
     */
    protected final <T extends SyntaxElement> T adopt(T child) {
        if (child instanceof Node node) {
            if (node.parent != null) {
                throw new MalformedTreeException(new TreeError.AlreadyAttached(node.variantName(),
                                                                               node.parent.variantName(),
                                                                               variantName()));
            }
            node.parent = this;
        }
        return child;
    }

    /**
     * Attach every entry of a list slot and return an immutable copy of it.
     */
    protected final <T extends SyntaxElement> List<T> adoptAll(List<T> children) {
        children.forEach(this::adopt);
        return ImmutableList.copyOf(children);
    }

    // === Navigation ===

    public Optional<Node> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * The source file this node belongs to.
     *
     * @throws MalformedTreeException if the topmost ancestor is not a {@link SourceFileNode}
     */
    public SourceFileNode root() {
        if (root == null) {
            Node top = this;
            while (top.parent != null) {
                top = top.parent;
            }
            if (!(top instanceof SourceFileNode file)) {
                throw new MalformedTreeException(new TreeError.DetachedNode(variantName()));
            }
            root = file;
        }
        return root;
    }

    /**
     * Nearest strict ancestor of the given variant.
     */
    public <N extends Node> Optional<N> ancestor(Class<N> variant) {
        for (var current = parent; current != null; current = current.parent) {
            if (variant.isInstance(current)) {
                return Optional.of(variant.cast(current));
            }
        }
        return Optional.empty();
    }

    public String source() {
        return root().source();
    }

    // === Children ===

    /**
     * Slot name to raw slot value, in declaration order. Values are {@code null}, a {@link SyntaxElement}
     * or a list of them.
     */
    public Map<String, Object> namedChildren() {
        var schema = schema();
        var result = new LinkedHashMap<String, Object>();
        for (int i = 0; i < schema.slotCount(); i++) {
            result.put(schema.slotName(i), schema.valueOf(i, this));
        }
        return Collections.unmodifiableMap(result);
    }

    public FluentIterable<SyntaxElement> childNodesAndTokens() {
        return TreeWalker.childNodesAndTokens(this);
    }

    public FluentIterable<Node> childNodes() {
        return TreeWalker.childNodes(this);
    }

    public FluentIterable<Token> childTokens() {
        return TreeWalker.childTokens(this);
    }

    public FluentIterable<SyntaxElement> descendantNodesAndTokens() {
        return TreeWalker.descendantNodesAndTokens(this);
    }

    public FluentIterable<SyntaxElement> descendantNodesAndTokens(Predicate<? super Node> shouldDescend) {
        return TreeWalker.descendantNodesAndTokens(this, shouldDescend);
    }

    public FluentIterable<Node> descendantNodes() {
        return TreeWalker.descendantNodes(this);
    }

    public FluentIterable<Node> descendantNodes(Predicate<? super Node> shouldDescend) {
        return TreeWalker.descendantNodes(this, shouldDescend);
    }

    public FluentIterable<Token> descendantTokens() {
        return TreeWalker.descendantTokens(this);
    }

    public FluentIterable<Token> descendantTokens(Predicate<? super Node> shouldDescend) {
        return TreeWalker.descendantTokens(this, shouldDescend);
    }

    // === Positions ===

    @Override
    public int fullStart() {
        return Positions.fullStart(this);
    }

    @Override
    public int start() {
        return Positions.start(this);
    }

    @Override
    public int width() {
        return Positions.width(this);
    }

    @Override
    public int fullWidth() {
        return Positions.fullWidth(this);
    }

    public int endPosition() {
        return Positions.endPosition(this);
    }

    /**
     * {@code [fullStart, endPosition)}: the region attributed to this node by point lookups.
     */
    public TextRange span() {
        return TextRange.of(fullStart(), endPosition());
    }

    public Optional<Node> descendantAt(int offset) {
        return NodeLocator.nodeAt(this, offset);
    }

    // === Text ===

    public String text() {
        return Texts.text(this);
    }

    public String fullText() {
        return Texts.fullText(this);
    }

    public String leadingTriviaText() {
        return Texts.leadingTriviaText(this);
    }

    @Override
    public String toString() {
        return text();
    }
}
