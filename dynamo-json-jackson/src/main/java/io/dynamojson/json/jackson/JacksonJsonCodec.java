package io.dynamojson.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.dynamojson.json.spi.ArrayNode;
import io.dynamojson.json.spi.DeserializationException;
import io.dynamojson.json.spi.JsonCodec;
import io.dynamojson.json.spi.JsonNode;
import io.dynamojson.json.spi.ObjectNode;
import io.dynamojson.json.spi.SerializationException;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Provides tree conversion and JSON text handling using Jackson.
 *
 * <p>The default mapper registers {@link Jdk8Module} so that {@code Optional} record
 * components map to JSON null when empty.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory()).registerModule(new Jdk8Module()));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.nodes = mapper.getNodeFactory();
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public JsonNode valueToTree(Object value) throws SerializationException {
        if (value instanceof JacksonJsonNode node) {
            return node;
        }
        try {
            com.fasterxml.jackson.databind.JsonNode tree = mapper.valueToTree(value);
            return JacksonJsonNode.wrap(tree == null ? nodes.nullNode() : tree);
        } catch (Exception e) {
            throw new SerializationException("Failed to convert "
                    + (value == null ? "null" : value.getClass().getName()) + " to tree", e);
        }
    }

    @Override
    public <T> T treeToValue(JsonNode node, Class<T> type) throws DeserializationException {
        Objects.requireNonNull(type, "type");
        com.fasterxml.jackson.databind.JsonNode tree = JacksonJsonNode.unwrap(node);
        try {
            return mapper.treeToValue(tree, type);
        } catch (Exception e) {
            throw new DeserializationException("Failed to convert tree to " + type.getName(), e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws DeserializationException {
        try {
            return JacksonJsonNode.wrap(mapper.readTree(json));
        } catch (Exception e) {
            throw new DeserializationException("Failed to parse string to tree", e);
        }
    }

    @Override
    public String writeString(Object value) throws SerializationException {
        Object target = value instanceof JacksonJsonNode node ? node.delegate : value;
        try {
            return mapper.writeValueAsString(target);
        } catch (Exception e) {
            throw new SerializationException("Failed to serialize object to string", e);
        }
    }

    @Override
    public JsonNode nullNode() {
        return new JacksonJsonNode(nodes.nullNode());
    }

    @Override
    public JsonNode booleanNode(boolean value) {
        return new JacksonJsonNode(nodes.booleanNode(value));
    }

    @Override
    public JsonNode textNode(String value) {
        return new JacksonJsonNode(nodes.textNode(Objects.requireNonNull(value, "value")));
    }

    @Override
    public JsonNode numberNode(long value) {
        return new JacksonJsonNode(JacksonJsonNode.integral(value));
    }

    @Override
    public JsonNode numberNode(double value) {
        return new JacksonJsonNode(nodes.numberNode(value));
    }

    @Override
    public ObjectNode createObjectNode() {
        return new JacksonObjectNode(nodes.objectNode());
    }

    @Override
    public ArrayNode createArrayNode() {
        return new JacksonArrayNode(nodes.arrayNode());
    }
}
