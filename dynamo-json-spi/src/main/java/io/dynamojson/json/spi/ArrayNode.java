package io.dynamojson.json.spi;

/**
 * Mutable JSON array node builder.
 * Elements keep the order in which they were added.
 */
public interface ArrayNode extends JsonNode {

    /**
     * Appends a node.
     */
    ArrayNode add(JsonNode value);

    /**
     * Appends a string value.
     */
    ArrayNode add(String value);
}
