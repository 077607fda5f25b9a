package org.pragmatica.syntax.kind;

import com.google.common.collect.ImmutableBiMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable two-way table between kind ids and kind names.
 *
 * <p>One registry describes token kinds, another node kinds. Both are populated once, typically
 * from a grammar's constants class, and are read-only afterwards:
 * <pre>{@code
 * var tokenKinds = KindRegistry.fromConstants(TokenKind.class);
 * tokenKinds.nameOf(TokenKind.NAME);   // Optional["NAME"]
 * }</pre>
 */
public final class KindRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(KindRegistry.class);

    private final ImmutableBiMap<Integer, String> names;

    private KindRegistry(ImmutableBiMap<Integer, String> names) {
        this.names = names;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a registry from every {@code public static final int} field declared by the class.
     * The field name becomes the kind name.
     */
    public static KindRegistry fromConstants(Class<?> constants) {
        var builder = builder();
        for (Field field : constants.getDeclaredFields()) {
            int modifiers = field.getModifiers();
            if (Modifier.isPublic(modifiers) && Modifier.isStatic(modifiers) && Modifier.isFinal(modifiers)
                && field.getType() == int.class) {
                builder.register(readConstant(field), field.getName());
            }
        }
        var registry = builder.build();
        LOG.debug("Loaded {} kinds from {}", registry.size(), constants.getName());
        return registry;
    }

    private static int readConstant(Field field) {
        try {
            return field.getInt(null);
        } catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot read kind constant " + field, e);
        }
    }

    public Optional<String> nameOf(int kind) {
        return Optional.ofNullable(names.get(kind));
    }

    public Optional<Integer> idOf(String name) {
        return Optional.ofNullable(names.inverse().get(name));
    }

    public boolean contains(int kind) {
        return names.containsKey(kind);
    }

    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        return "KindRegistry" + names;
    }

    public static final class Builder {
        private final ImmutableBiMap.Builder<Integer, String> names = ImmutableBiMap.builder();
        private final java.util.Set<Integer> seenIds = new java.util.HashSet<>();
        private final java.util.Set<String> seenNames = new java.util.HashSet<>();

        private Builder() {}

        /**
         * Add one kind. Ids and names must both be unique.
         */
        public Builder register(int kind, String name) {
            checkNotNull(name, "kind name");
            checkArgument(seenIds.add(kind), "Duplicate kind id %s for '%s'", kind, name);
            checkArgument(seenNames.add(name), "Duplicate kind name '%s'", name);
            names.put(kind, name);
            return this;
        }

        public KindRegistry build() {
            return new KindRegistry(names.buildOrThrow());
        }
    }
}
