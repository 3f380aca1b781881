package io.dynamojson.json.jackson;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NumericNode;
import io.dynamojson.json.spi.JsonNode;
import io.dynamojson.json.spi.JsonNodeType;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson implementation of JsonNode.
 * Wraps a Jackson JsonNode and delegates all operations to it.
 */
class JacksonJsonNode implements JsonNode {
    final com.fasterxml.jackson.databind.JsonNode delegate;

    JacksonJsonNode(com.fasterxml.jackson.databind.JsonNode delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public JsonNodeType getNodeType() {
        if (delegate.isObject()) return JsonNodeType.OBJECT;
        if (delegate.isArray()) return JsonNodeType.ARRAY;
        // binary nodes render as their base64 text and bind back to byte[] from it
        if (delegate.isTextual() || delegate.isBinary()) return JsonNodeType.STRING;
        if (delegate.isNumber()) return JsonNodeType.NUMBER;
        if (delegate.isBoolean()) return JsonNodeType.BOOLEAN;
        // missing and POJO nodes have no counterpart in the generic model
        return JsonNodeType.NULL;
    }

    @Override
    public JsonNode get(String fieldName) {
        return wrap(delegate.get(fieldName));
    }

    @Override
    public JsonNode get(int index) {
        return wrap(delegate.get(index));
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public String asText() {
        return delegate.asText();
    }

    @Override
    public long asLong() {
        return delegate.isNumber() ? delegate.asLong() : 0L;
    }

    @Override
    public double asDouble() {
        return delegate.isNumber() ? delegate.asDouble() : 0.0;
    }

    @Override
    public boolean asBoolean() {
        return delegate.isBoolean() && delegate.booleanValue();
    }

    @Override
    public Iterator<Map.Entry<String, JsonNode>> fields() {
        Iterator<Map.Entry<String, com.fasterxml.jackson.databind.JsonNode>> iter = delegate.fields();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iter.hasNext();
            }

            @Override
            public Map.Entry<String, JsonNode> next() {
                Map.Entry<String, com.fasterxml.jackson.databind.JsonNode> entry = iter.next();
                return Map.entry(entry.getKey(), wrap(entry.getValue()));
            }
        };
    }

    @Override
    public Iterator<JsonNode> elements() {
        Iterator<com.fasterxml.jackson.databind.JsonNode> iter = delegate.elements();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iter.hasNext();
            }

            @Override
            public JsonNode next() {
                return wrap(iter.next());
            }
        };
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JacksonJsonNode other)) return false;
        return delegate.equals(other.delegate);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }

    static JsonNode wrap(com.fasterxml.jackson.databind.JsonNode node) {
        if (node == null) return null;
        if (node instanceof com.fasterxml.jackson.databind.node.ObjectNode on) {
            return new JacksonObjectNode(on);
        }
        if (node instanceof com.fasterxml.jackson.databind.node.ArrayNode an) {
            return new JacksonArrayNode(an);
        }
        return new JacksonJsonNode(node);
    }

    /**
     * Integral node in the representation readTree picks: IntNode when the value fits, LongNode otherwise.
     */
    static NumericNode integral(long value) {
        if ((int) value == value) {
            return IntNode.valueOf((int) value);
        }
        return LongNode.valueOf(value);
    }

    static com.fasterxml.jackson.databind.JsonNode unwrap(JsonNode node) {
        if (node instanceof JacksonJsonNode jjn) {
            return jjn.delegate;
        }
        throw new IllegalArgumentException("Cannot unwrap non-Jackson JsonNode: "
                + (node == null ? "null" : node.getClass().getName()));
    }
}
