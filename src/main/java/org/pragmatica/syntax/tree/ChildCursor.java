package org.pragmatica.syntax.tree;

import org.pragmatica.syntax.error.MalformedTreeException;
import org.pragmatica.syntax.error.TreeError;

import java.util.Iterator;
import java.util.List;

/**
 * Position within the direct children of one node: current slot, and within a list slot the current entry.
 */
final class ChildCursor {
    private final Node node;
    private final NodeSchema<? extends Node> schema;
    private int slotIndex;
    private String listSlot;
    private Iterator<?> listEntries;

    ChildCursor(Node node) {
        this.node = node;
        this.schema = node.schema();
    }

    /**
     * Next present child, or {@code null} once all slots are exhausted.
     */
    SyntaxElement next() {
        while (true) {
            if (listEntries != null) {
                while (listEntries.hasNext()) {
                    var entry = listEntries.next();
                    if (entry != null) {
                        return checked(listSlot, entry);
                    }
                }
                listEntries = null;
            }
            if (slotIndex >= schema.slotCount()) {
                return null;
            }
            var name = schema.slotName(slotIndex);
            var value = schema.valueOf(slotIndex++, node);
            if (value instanceof List<?> list) {
                listSlot = name;
                listEntries = list.iterator();
            } else if (value != null) {
                return checked(name, value);
            }
        }
    }

    private SyntaxElement checked(String slot, Object value) {
        if (value instanceof SyntaxElement element) {
            return element;
        }
        throw new MalformedTreeException(new TreeError.UnexpectedChild(slot, node.variantName(), value.getClass()));
    }
}
