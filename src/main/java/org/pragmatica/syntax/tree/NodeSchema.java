package org.pragmatica.syntax.tree;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Static descriptor of a node variant: its kind and its child slots in source order.
 *
 * <p>Each variant builds its schema once, as a constant, and returns it from {@link Node#schema()}:
 * <pre>{@code
 * static final NodeSchema<Assignment> SCHEMA = NodeSchema.builder(Assignment.class, NodeKind.ASSIGNMENT)
 *     .child("target", Assignment::target)
 *     .child("operator", Assignment::operator)
 *     .child("value", Assignment::value)
 *     .build();
 * }</pre>
 * The declaration order must match the order in which children appear in the source,
 * since positions and text are derived by walking slots in this order.
 */
public final class NodeSchema<N extends Node> {
    private static final Logger LOG = LoggerFactory.getLogger(NodeSchema.class);

    private final Class<N> variant;
    private final int kind;
    private final ImmutableList<Slot<N>> slots;
    private final ImmutableList<String> slotNames;

    private NodeSchema(Class<N> variant, int kind, ImmutableList<Slot<N>> slots) {
        this.variant = variant;
        this.kind = kind;
        this.slots = slots;
        this.slotNames = slots.stream()
                              .map(Slot::name)
                              .collect(ImmutableList.toImmutableList());
    }

    public static <N extends Node> Builder<N> builder(Class<N> variant, int kind) {
        return new Builder<>(variant, kind);
    }

    public Class<N> variant() {
        return variant;
    }

    public int kind() {
        return kind;
    }

    public List<Slot<N>> slots() {
        return slots;
    }

    /**
     * Slot names in declaration order.
     */
    public List<String> slotNames() {
        return slotNames;
    }

    int slotCount() {
        return slots.size();
    }

    String slotName(int index) {
        return slotNames.get(index);
    }

    Object valueOf(int index, Node node) {
        return slots.get(index)
                    .read(variant.cast(node));
    }

    @Override
    public String toString() {
        return variant.getSimpleName() + slotNames;
    }

    public static final class Builder<N extends Node> {
        private final Class<N> variant;
        private final int kind;
        private final ImmutableList.Builder<Slot<N>> slots = ImmutableList.builder();
        private final HashSet<String> names = new HashSet<>();

        private Builder(Class<N> variant, int kind) {
            this.variant = variant;
            this.kind = kind;
        }

        public Builder<N> child(String name, Function<? super N, ? extends SyntaxElement> accessor) {
            return add(new Slot.Single<>(name, accessor));
        }

        public Builder<N> children(String name, Function<? super N, ? extends List<? extends SyntaxElement>> accessor) {
            return add(new Slot.Multiple<>(name, accessor));
        }

        private Builder<N> add(Slot<N> slot) {
            checkArgument(!"parent".equals(slot.name()), "'parent' is reserved and cannot name a slot of %s", variant);
            checkArgument(names.add(slot.name()), "Duplicate slot '%s' in %s", slot.name(), variant);
            slots.add(slot);
            return this;
        }

        public NodeSchema<N> build() {
            var schema = new NodeSchema<>(variant, kind, slots.build());
            LOG.debug("Built schema {} for kind {}", schema, kind);
            return schema;
        }
    }
}
