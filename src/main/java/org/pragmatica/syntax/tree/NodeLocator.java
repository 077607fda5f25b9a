package org.pragmatica.syntax.tree;

import java.util.Optional;

/**
 * Point lookup: which node covers a given source offset.
 */
public final class NodeLocator {
    private NodeLocator() {}

    /**
     * Innermost node under {@code node} whose {@link Node#span() span} contains the offset.
     * Falls back to {@code node} itself when only its own span contains the offset,
     * as happens for trivia before the end-of-file token.
     *
     * <p>Descendants are listed in pre-order and scanned from the last one, so deeper and later nodes win.
     * Cost is linear in the number of nodes.
     */
    public static Optional<Node> nodeAt(Node node, int offset) {
        var descendants = TreeWalker.descendantNodes(node)
                                    .toList();
        for (int i = descendants.size() - 1; i >= 0; i--) {
            var candidate = descendants.get(i);
            if (candidate.span()
                         .contains(offset)) {
                return Optional.of(candidate);
            }
        }
        return node.span()
                   .contains(offset) ? Optional.of(node) : Optional.empty();
    }
}
