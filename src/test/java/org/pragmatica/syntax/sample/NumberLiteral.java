package org.pragmatica.syntax.sample;

import org.pragmatica.syntax.tree.Node;
import org.pragmatica.syntax.tree.NodeSchema;
import org.pragmatica.syntax.tree.Token;

public final class NumberLiteral extends Node {
    static final NodeSchema<NumberLiteral> SCHEMA = NodeSchema.builder(NumberLiteral.class, SampleNodeKind.NUMBER_LITERAL)
                                                              .child("literal", NumberLiteral::literal)
                                                              .build();

    private final Token literal;

    public NumberLiteral(Token literal) {
        this.literal = literal;
    }

    public Token literal() {
        return literal;
    }

    @Override
    public NodeSchema<NumberLiteral> schema() {
        return SCHEMA;
    }
}
