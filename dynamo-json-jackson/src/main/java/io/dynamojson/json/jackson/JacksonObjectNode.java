package io.dynamojson.json.jackson;

import io.dynamojson.json.spi.JsonNode;
import io.dynamojson.json.spi.ObjectNode;

/**
 * Jackson implementation of ObjectNode.
 */
final class JacksonObjectNode extends JacksonJsonNode implements ObjectNode {
    private final com.fasterxml.jackson.databind.node.ObjectNode objectDelegate;

    JacksonObjectNode(com.fasterxml.jackson.databind.node.ObjectNode delegate) {
        super(delegate);
        this.objectDelegate = delegate;
    }

    @Override
    public ObjectNode set(String fieldName, JsonNode value) {
        objectDelegate.set(fieldName, JacksonJsonNode.unwrap(value));
        return this;
    }
}
