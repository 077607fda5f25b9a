package org.pragmatica.syntax.serialize;

/**
 * Serializer configuration options.
 */
public record SerializerConfig(
    TokenFormat tokenFormat,
    boolean prettyPrint
) {
    public static final SerializerConfig DEFAULT = new SerializerConfig(
        TokenFormat.FULL,
        false
    );

    public SerializerConfig withTokenFormat(TokenFormat format) {
        return new SerializerConfig(format, prettyPrint);
    }

    public SerializerConfig withPrettyPrint(boolean pretty) {
        return new SerializerConfig(tokenFormat, pretty);
    }
}
