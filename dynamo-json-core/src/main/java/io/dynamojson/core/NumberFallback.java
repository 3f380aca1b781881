package io.dynamojson.core;

/**
 * What the decoder emits for number text that does not parse as a 64-bit integer or a
 * finite double, such as {@code "123abc"} or {@code "999999999999999999999"}.
 */
public enum NumberFallback {
    /**
     * Emit the original text as a JSON string. Keeps the content, loses the number tag:
     * re-encoding the result yields an {@code S} value, not an {@code N}.
     */
    LENIENT,
    /**
     * Emit JSON null, discarding the text.
     */
    STRICT
}
