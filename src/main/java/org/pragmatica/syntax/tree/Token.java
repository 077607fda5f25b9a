package org.pragmatica.syntax.tree;

/**
 * Leaf of the syntax tree. Holds offsets only; text is read from the source on request.
 *
 * <p>{@code [fullStart, start)} is leading trivia, {@code [start, fullStart + length)} is the token text.
 * Offsets are trusted: the lexer that produced them guarantees {@code fullStart <= start <= fullStart + length}.
 *
 * @param kind      token kind id
 * @param fullStart offset of the leading trivia
 * @param start     offset of the token text
 * @param length    length of trivia and text together
 */
public record Token(int kind, int fullStart, int start, int length) implements SyntaxElement {

    public static Token of(int kind, int fullStart, int start, int length) {
        return new Token(kind, fullStart, start, length);
    }

    public int end() {
        return fullStart + length;
    }

    public int triviaLength() {
        return start - fullStart;
    }

    @Override
    public int width() {
        return length - triviaLength();
    }

    @Override
    public int fullWidth() {
        return length;
    }

    public String leadingTrivia(String source) {
        return source.substring(fullStart, start);
    }

    public String text(String source) {
        return source.substring(start, end());
    }

    public String fullText(String source) {
        return source.substring(fullStart, end());
    }
}
