package org.pragmatica.syntax.sample;

/**
 * Token kinds of the sample expression grammar.
 */
public final class SampleTokenKind {
    public static final int NAME = 1;
    public static final int NUMBER = 2;
    public static final int PLUS = 3;
    public static final int MINUS = 4;
    public static final int STAR = 5;
    public static final int EQUALS = 6;
    public static final int OPEN_PAREN = 7;
    public static final int CLOSE_PAREN = 8;
    public static final int SEMICOLON = 9;
    public static final int END_OF_FILE = 10;

    private SampleTokenKind() {}
}
