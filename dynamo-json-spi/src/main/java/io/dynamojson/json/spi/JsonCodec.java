package io.dynamojson.json.spi;

/**
 * JSON codec bridging typed Java values and the generic {@link JsonNode} tree.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Besides conversion, a codec is the factory for the nodes of its own tree model;
 * trees handed to {@link #treeToValue} should be built by the same codec.
 */
public interface JsonCodec {

    // ===== Tree conversion =====

    /**
     * Converts a Java value to a JSON tree.
     * @param value the value to convert, may be null
     * @return the tree
     * @throws SerializationException if the value cannot be represented
     */
    JsonNode valueToTree(Object value) throws SerializationException;

    /**
     * Converts a JSON tree to a value of the given type.
     * @param node the tree
     * @param type target class
     * @return the converted value
     * @throws DeserializationException if the tree does not fit the type
     */
    <T> T treeToValue(JsonNode node, Class<T> type) throws DeserializationException;

    // ===== Text =====

    /**
     * Parses JSON text into a tree.
     * @param json JSON string
     * @return the tree
     * @throws DeserializationException if the text is not valid JSON
     */
    JsonNode readTree(String json) throws DeserializationException;

    /**
     * Serializes a value (or a {@link JsonNode}) to JSON text.
     * @param value the value to write
     * @return JSON string
     * @throws SerializationException if serialization fails
     */
    String writeString(Object value) throws SerializationException;

    // ===== Node factory =====

    JsonNode nullNode();

    JsonNode booleanNode(boolean value);

    JsonNode textNode(String value);

    /**
     * Creates an integral number node, using the narrowest representation
     * the codec's own parser would pick for the same literal.
     */
    JsonNode numberNode(long value);

    JsonNode numberNode(double value);

    ObjectNode createObjectNode();

    ArrayNode createArrayNode();
}
