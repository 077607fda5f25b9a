package org.pragmatica.syntax.tree;

import java.util.List;
import java.util.function.Function;

/**
 * Named child slot of a node variant.
 */
public sealed interface Slot<N extends Node> {
    String name();

    /**
     * Raw slot value: {@code null}, a {@link SyntaxElement}, or a list of them.
     */
    Object read(N node);

    /**
     * Slot holding at most one child.
     */
    record Single<N extends Node>(
    String name,
    Function<? super N, ? extends SyntaxElement> accessor) implements Slot<N> {
        @Override
        public Object read(N node) {
            return accessor.apply(node);
        }
    }

    /**
     * Slot holding an ordered list of children.
     */
    record Multiple<N extends Node>(
    String name,
    Function<? super N, ? extends List<? extends SyntaxElement>> accessor) implements Slot<N> {
        @Override
        public Object read(N node) {
            return accessor.apply(node);
        }
    }
}
