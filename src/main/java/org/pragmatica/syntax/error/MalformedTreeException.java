package org.pragmatica.syntax.error;

/**
 * Thrown when a tree breaks one of its structural invariants.
 * Signals an internal error in whatever produced the tree, never a problem in the parsed source.
 */
public final class MalformedTreeException extends IllegalStateException {
    private final TreeError error;

    public MalformedTreeException(TreeError error) {
        super(error.message());
        this.error = error;
    }

    public TreeError error() {
        return error;
    }
}
