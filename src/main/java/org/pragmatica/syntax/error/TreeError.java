package org.pragmatica.syntax.error;

/**
 * Structural defect found while reading a syntax tree.
 * Each variant describes a tree that was built in violation of the construction contract.
 */
public sealed interface TreeError {
    String message();

    /**
     * A child slot holds a value that is neither a node nor a token.
     */
    record UnexpectedChild(
    String slot,
    String variant,
    Class<?> foundType) implements TreeError {
        @Override
        public String message() {
            return "Unknown type in tree: slot '" + slot + "' of " + variant + " holds " + foundType.getName();
        }
    }

    /**
     * A node has no parent and is not the root of a source file.
     */
    record DetachedNode(String variant) implements TreeError {
        @Override
        public String message() {
            return "Node " + variant + " is not attached to a source file";
        }
    }

    /**
     * A node without any descendant token was asked for a position.
     */
    record EmptyNode(String variant) implements TreeError {
        @Override
        public String message() {
            return "Node " + variant + " has no tokens";
        }
    }

    /**
     * A node was adopted by a second parent.
     */
    record AlreadyAttached(
    String variant,
    String currentParent,
    String newParent) implements TreeError {
        @Override
        public String message() {
            return "Node " + variant + " already belongs to " + currentParent + ", cannot attach to " + newParent;
        }
    }
}
