package io.dynamojson.json.spi;

import java.util.Iterator;
import java.util.Map;

/**
 * Abstraction for a JSON tree node: object, array, string, number, boolean or null.
 *
 * <p>Implementations wrap a specific JSON library and expose node content and structure
 * without leaking that library's types. Equality is structural and delegated to the
 * underlying library, so two numbers are equal only when they also share a representation
 * (an int node is not equal to a long node holding the same value).
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    /**
     * Returns true if this is an object node.
     */
    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    /**
     * Returns true if this is an array node.
     */
    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    /**
     * Returns true if this is a text node.
     */
    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    /**
     * Returns true if this is a numeric node.
     */
    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    /**
     * Returns true if this is a boolean node.
     */
    default boolean isBoolean() {
        return getNodeType() == JsonNodeType.BOOLEAN;
    }

    /**
     * Returns true if this is a null node.
     */
    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Gets an element by index from an array node.
     * Returns null if this is not an array or index is out of bounds.
     */
    JsonNode get(int index);

    /**
     * Returns the size of this node.
     * For objects: number of fields
     * For arrays: number of elements
     * For others: 0
     */
    int size();

    /**
     * Returns the text value of this node.
     *
     * <p>For text nodes this is the string value. For numeric nodes it is the canonical
     * decimal rendering of the number, which parses back to an equal value; the store
     * encoding relies on it and must not format numbers any other way.
     */
    String asText();

    /**
     * Returns the long value of this node, or 0 if it is not numeric.
     */
    long asLong();

    /**
     * Returns the double value of this node, or 0.0 if it is not numeric.
     */
    double asDouble();

    /**
     * Returns the boolean value of this node, or false if it is not boolean.
     */
    boolean asBoolean();

    /**
     * Returns an iterator over the field entries (for object nodes).
     */
    Iterator<Map.Entry<String, JsonNode>> fields();

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();
}
