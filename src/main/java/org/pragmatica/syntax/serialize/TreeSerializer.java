package org.pragmatica.syntax.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.syntax.error.MalformedTreeException;
import org.pragmatica.syntax.error.TreeError;
import org.pragmatica.syntax.kind.KindRegistry;
import org.pragmatica.syntax.tree.Node;
import org.pragmatica.syntax.tree.SyntaxElement;
import org.pragmatica.syntax.tree.Token;

import java.util.List;

/**
 * Renders syntax trees as JSON records.
 *
 * <p>Nodes become {@code {"<NodeKind>": {"<slot>": value, ...}}} with list slots as arrays and absent slots as
 * {@code null}. Tokens become {@code {"kind", "fullStart", "start", "length"}} or, with
 * {@link TokenFormat#COMPACT}, {@code {"kind", "textLength"}}. The source text is never read.
 */
public final class TreeSerializer {
    static final String UNKNOWN_NODE_KIND = "Unknown Node Kind";

    private final KindRegistry nodeKinds;
    private final KindRegistry tokenKinds;
    private final SerializerConfig config;
    private final JsonNodeFactory factory = JsonNodeFactory.instance;
    private final ObjectMapper mapper = new ObjectMapper();

    private TreeSerializer(KindRegistry nodeKinds, KindRegistry tokenKinds, SerializerConfig config) {
        this.nodeKinds = nodeKinds;
        this.tokenKinds = tokenKinds;
        this.config = config;
    }

    public static TreeSerializer create(KindRegistry nodeKinds, KindRegistry tokenKinds) {
        return create(nodeKinds, tokenKinds, SerializerConfig.DEFAULT);
    }

    public static TreeSerializer create(KindRegistry nodeKinds, KindRegistry tokenKinds, SerializerConfig config) {
        return new TreeSerializer(nodeKinds, tokenKinds, config);
    }

    public JsonNode serialize(SyntaxElement element) {
        if (element instanceof Node node) {
            return serializeNode(node);
        }
        return serializeToken((Token) element);
    }

    public ObjectNode serializeNode(Node node) {
        var slots = factory.objectNode();
        node.namedChildren()
            .forEach((name, value) -> slots.set(name, serializeSlot(node, name, value)));
        var result = factory.objectNode();
        result.set(nodeKinds.nameOf(node.kind())
                            .orElse(UNKNOWN_NODE_KIND), slots);
        return result;
    }

    public ObjectNode serializeToken(Token token) {
        var result = factory.objectNode();
        var name = tokenKinds.nameOf(token.kind());
        if (name.isPresent()) {
            result.put("kind", name.get());
        } else {
            result.put("kind", token.kind());
        }
        switch (config.tokenFormat()) {
            case FULL -> {
                result.put("fullStart", token.fullStart());
                result.put("start", token.start());
                result.put("length", token.length());
            }
            case COMPACT -> result.put("textLength", token.width());
        }
        return result;
    }

    /**
     * Serialize to JSON text, pretty-printed if so configured.
     */
    public String toJson(SyntaxElement element) {
        var writer = config.prettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        try {
            return writer.writeValueAsString(serialize(element));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to write syntax tree as JSON", e);
        }
    }

    private JsonNode serializeSlot(Node owner, String slot, Object value) {
        if (value == null) {
            return factory.nullNode();
        }
        if (value instanceof List<?> list) {
            ArrayNode array = factory.arrayNode(list.size());
            for (var entry : list) {
                array.add(serializeSlot(owner, slot, entry));
            }
            return array;
        }
        if (value instanceof SyntaxElement element) {
            return serialize(element);
        }
        throw new MalformedTreeException(new TreeError.UnexpectedChild(slot, owner.variantName(), value.getClass()));
    }
}
