package io.dynamojson.json.jackson;

import io.dynamojson.json.spi.ArrayNode;
import io.dynamojson.json.spi.JsonNode;

/**
 * Jackson implementation of ArrayNode.
 */
final class JacksonArrayNode extends JacksonJsonNode implements ArrayNode {
    private final com.fasterxml.jackson.databind.node.ArrayNode arrayDelegate;

    JacksonArrayNode(com.fasterxml.jackson.databind.node.ArrayNode delegate) {
        super(delegate);
        this.arrayDelegate = delegate;
    }

    @Override
    public ArrayNode add(JsonNode value) {
        arrayDelegate.add(JacksonJsonNode.unwrap(value));
        return this;
    }

    @Override
    public ArrayNode add(String value) {
        arrayDelegate.add(value);
        return this;
    }
}
