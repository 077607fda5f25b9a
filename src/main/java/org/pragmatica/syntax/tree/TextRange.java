package org.pragmatica.syntax.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record TextRange(int start, int end) {

    public static TextRange of(int start, int end) {
        return new TextRange(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
