package io.dynamojson.json.spi;

/**
 * Thrown when a JSON tree does not fit the requested target type:
 * a missing required field, a type mismatch or an unexpected node kind.
 */
public class DeserializationException extends JsonException {
    public DeserializationException(String message) {
        super(message);
    }

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
