package org.pragmatica.syntax.tree;

import org.pragmatica.syntax.error.MalformedTreeException;
import org.pragmatica.syntax.error.TreeError;

/**
 * Derives node positions from the tokens below them. Interior nodes store no offsets.
 */
public final class Positions {
    private Positions() {}

    /**
     * First token of the node, reached through first children only.
     *
     * @throws MalformedTreeException if a node on the way has no children
     */
    public static Token firstToken(Node node) {
        SyntaxElement current = node;
        while (current instanceof Node interior) {
            current = new ChildCursor(interior).next();
            if (current == null) {
                throw new MalformedTreeException(new TreeError.EmptyNode(interior.variantName()));
            }
        }
        return (Token) current;
    }

    public static int fullStart(Node node) {
        return firstToken(node).fullStart();
    }

    public static int start(Node node) {
        return firstToken(node).start();
    }

    /**
     * Width without the leading trivia of the first child; trivia between later children counts.
     */
    public static int width(Node node) {
        int width = 0;
        boolean first = true;
        for (var child : TreeWalker.childNodesAndTokens(node)) {
            width += first ? child.width() : child.fullWidth();
            first = false;
        }
        return width;
    }

    public static int fullWidth(Node node) {
        int fullWidth = 0;
        for (var child : TreeWalker.childNodesAndTokens(node)) {
            fullWidth += child.fullWidth();
        }
        return fullWidth;
    }

    /**
     * End of the region a node owns: the full start of its next node sibling, or, for a last child, the end
     * of its parent's region. Children of the root end where the end-of-file token's trivia begins;
     * the root itself ends after the end-of-file token.
     *
     * @throws MalformedTreeException if the node is not part of a source file
     */
    public static int endPosition(Node node) {
        var current = node;
        while (true) {
            var parent = current.parent()
                                .orElse(null);
            if (parent == null) {
                if (current instanceof SourceFileNode file) {
                    return file.endOfFileToken()
                               .end();
                }
                throw new MalformedTreeException(new TreeError.DetachedNode(current.variantName()));
            }
            var next = nextNodeSibling(parent, current);
            if (next != null) {
                return next.fullStart();
            }
            if (parent.parent()
                      .isEmpty()) {
                return parent.root()
                             .endOfFileToken()
                             .fullStart();
            }
            current = parent;
        }
    }

    private static Node nextNodeSibling(Node parent, Node node) {
        var siblings = TreeWalker.childNodes(parent)
                                 .iterator();
        while (siblings.hasNext()) {
            if (siblings.next() == node) {
                return siblings.hasNext() ? siblings.next() : null;
            }
        }
        throw new MalformedTreeException(new TreeError.DetachedNode(node.variantName()));
    }
}
