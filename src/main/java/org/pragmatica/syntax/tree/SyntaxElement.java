package org.pragmatica.syntax.tree;

/**
 * Anything that can occupy a child slot: an interior {@link Node} or a leaf {@link Token}.
 */
public sealed interface SyntaxElement permits Node, Token {
    /**
     * Grammar-defined kind id, resolved to a name through a {@link org.pragmatica.syntax.kind.KindRegistry}.
     */
    int kind();

    /**
     * Offset of the first character, leading trivia included.
     */
    int fullStart();

    /**
     * Offset of the first significant character.
     */
    int start();

    /**
     * Length without the leading trivia of the first token.
     */
    int width();

    /**
     * Length including all trivia.
     */
    int fullWidth();
}
