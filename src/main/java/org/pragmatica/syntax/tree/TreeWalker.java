package org.pragmatica.syntax.tree;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Predicate;

/**
 * Lazy traversals over a syntax tree.
 *
 * <p>Every method returns an {@link Iterable} whose iterators are independent of each other, so the same
 * traversal can be restarted or run from several threads at once. Children are produced in slot order with
 * list slots flattened in place; absent children are skipped. Descendant traversals are depth-first pre-order:
 * a node comes before everything inside it.
 */
public final class TreeWalker {
    private static final Predicate<Node> ALWAYS = node -> true;

    private TreeWalker() {}

    public static FluentIterable<SyntaxElement> childNodesAndTokens(Node node) {
        return FluentIterable.<SyntaxElement>from(() -> new ChildIterator(node));
    }

    public static FluentIterable<Node> childNodes(Node node) {
        return childNodesAndTokens(node).filter(Node.class);
    }

    public static FluentIterable<Token> childTokens(Node node) {
        return childNodesAndTokens(node).filter(Token.class);
    }

    public static FluentIterable<SyntaxElement> descendantNodesAndTokens(Node node) {
        return descendantNodesAndTokens(node, ALWAYS);
    }

    /**
     * All descendants in document order.
     *
     * @param shouldDescend called once for every node reached; when it returns {@code false} nothing inside
     *                      that node is produced
     */
    public static FluentIterable<SyntaxElement> descendantNodesAndTokens(Node node, Predicate<? super Node> shouldDescend) {
        return FluentIterable.<SyntaxElement>from(() -> new DescendantIterator(node, shouldDescend));
    }

    public static FluentIterable<Node> descendantNodes(Node node) {
        return descendantNodes(node, ALWAYS);
    }

    public static FluentIterable<Node> descendantNodes(Node node, Predicate<? super Node> shouldDescend) {
        return descendantNodesAndTokens(node, shouldDescend).filter(Node.class);
    }

    public static FluentIterable<Token> descendantTokens(Node node) {
        return descendantTokens(node, ALWAYS);
    }

    public static FluentIterable<Token> descendantTokens(Node node, Predicate<? super Node> shouldDescend) {
        return descendantNodesAndTokens(node, shouldDescend).filter(Token.class);
    }

    private static final class ChildIterator extends AbstractIterator<SyntaxElement> {
        private final ChildCursor cursor;

        private ChildIterator(Node node) {
            this.cursor = new ChildCursor(node);
        }

        @Override
        protected SyntaxElement computeNext() {
            var next = cursor.next();
            return next != null ? next : endOfData();
        }
    }

    /**
     * Pre-order walk driven by an explicit stack of cursors, one per node being expanded.
     * The descent decision for a node is taken when the element after it is requested,
     * so a caller that stops early never triggers it.
     */
    private static final class DescendantIterator extends AbstractIterator<SyntaxElement> {
        private final Predicate<? super Node> shouldDescend;
        private final Deque<ChildCursor> stack = new ArrayDeque<>();
        private Node pending;

        private DescendantIterator(Node node, Predicate<? super Node> shouldDescend) {
            this.shouldDescend = shouldDescend;
            stack.push(new ChildCursor(node));
        }

        @Override
        protected SyntaxElement computeNext() {
            if (pending != null) {
                if (shouldDescend.test(pending)) {
                    stack.push(new ChildCursor(pending));
                }
                pending = null;
            }
            while (!stack.isEmpty()) {
                var next = stack.peek()
                                .next();
                if (next == null) {
                    stack.pop();
                    continue;
                }
                if (next instanceof Node child) {
                    pending = child;
                }
                return next;
            }
            return endOfData();
        }
    }
}
