package io.dynamojson.json.spi;

/**
 * Kinds of value in the generic JSON data model.
 *
 * <p>There is no set kind: sets only exist on the store side.
 */
public enum JsonNodeType {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT
}
