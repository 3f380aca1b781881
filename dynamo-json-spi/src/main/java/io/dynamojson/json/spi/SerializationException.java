package io.dynamojson.json.spi;

/**
 * Thrown when a Java value cannot be represented as a JSON tree,
 * for example an unsupported type or a cyclic reference.
 */
public class SerializationException extends JsonException {
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
