package io.dynamojson.json.spi;

/**
 * Mutable JSON object node builder.
 * Setting an existing field replaces its value.
 */
public interface ObjectNode extends JsonNode {

    /**
     * Sets a field to a node.
     */
    ObjectNode set(String fieldName, JsonNode value);
}
