package io.dynamojson.core;

import io.dynamojson.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts generic JSON trees to store attribute values.
 *
 * <p>Total: every tree has a representation. Numbers are written with the tree's own
 * canonical text ({@link JsonNode#asText()}). Never produces binaries or sets.
 */
public final class AttributeValueEncoder {

    public static final AttributeValueEncoder INSTANCE = new AttributeValueEncoder();

    private AttributeValueEncoder() {}

    /**
     * Encodes a tree. A Java {@code null} encodes like JSON null.
     */
    public AttributeValue encode(JsonNode node) {
        if (node == null) return AttributeValue.NullValue.INSTANCE;
        return switch (node.getNodeType()) {
            case BOOLEAN -> new AttributeValue.BooleanValue(node.asBoolean());
            case NUMBER -> new AttributeValue.NumberValue(node.asText());
            case STRING -> new AttributeValue.StringValue(node.asText());
            case ARRAY -> encodeArray(node);
            case OBJECT -> encodeObject(node);
            case NULL -> AttributeValue.NullValue.INSTANCE;
        };
    }

    private AttributeValue.ListValue encodeArray(JsonNode node) {
        List<AttributeValue> out = new ArrayList<>(node.size());
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            out.add(encode(it.next()));
        }
        return new AttributeValue.ListValue(out);
    }

    private AttributeValue.MapValue encodeObject(JsonNode node) {
        Map<String, AttributeValue> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            out.put(field.getKey(), encode(field.getValue()));
        }
        return new AttributeValue.MapValue(out);
    }
}
