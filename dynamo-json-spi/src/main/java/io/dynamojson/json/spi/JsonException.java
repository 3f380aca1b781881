package io.dynamojson.json.spi;

/**
 * Base exception for failures of a {@link JsonCodec}.
 *
 * @see SerializationException
 * @see DeserializationException
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
