package org.pragmatica.syntax.tree;

/**
 * Rebuilds node text from the root's source.
 */
public final class Texts {
    private Texts() {}

    /**
     * Node text without the leading trivia of its first token.
     */
    public static String text(Node node) {
        var source = node.source();
        var sb = new StringBuilder();
        boolean first = true;
        for (var token : TreeWalker.descendantTokens(node)) {
            sb.append(source, first ? token.start() : token.fullStart(), token.end());
            first = false;
        }
        return sb.toString();
    }

    public static String fullText(Node node) {
        var source = node.source();
        var sb = new StringBuilder();
        for (var token : TreeWalker.descendantTokens(node)) {
            sb.append(source, token.fullStart(), token.end());
        }
        return sb.toString();
    }

    /**
     * Leading trivia of the node's first token, or an empty string for a node without tokens.
     */
    public static String leadingTriviaText(Node node) {
        var source = node.source();
        return TreeWalker.descendantTokens(node)
                         .first()
                         .transform(token -> token.leadingTrivia(source))
                         .or("");
    }
}
