package org.pragmatica.syntax.tree;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Root of a syntax tree. Owns the source text every token offset refers to and the end-of-file token,
 * whose leading trivia holds whatever follows the last statement.
 *
 * <p>Grammars extend this class with their own top-level slots; the end-of-file token must be the last slot.
 */
public abstract class SourceFileNode extends Node {
    private final String source;

    protected SourceFileNode(String source) {
        this.source = checkNotNull(source, "source");
    }

    @Override
    public final String source() {
        return source;
    }

    @Override
    public final SourceFileNode root() {
        return this;
    }

    public abstract Token endOfFileToken();
}
