package org.pragmatica.syntax.serialize;

/**
 * How much of a token the serializer writes.
 */
public enum TokenFormat {
    /**
     * Kind plus {@code fullStart}, {@code start} and {@code length}.
     */
    FULL,

    /**
     * Kind plus {@code textLength} only. Stable across edits that shift offsets, which suits snapshot tests.
     */
    COMPACT
}
