package io.dynamojson.core;

import io.dynamojson.json.spi.DeserializationException;
import io.dynamojson.json.spi.JsonCodec;
import io.dynamojson.json.spi.JsonNode;
import io.dynamojson.json.spi.SerializationException;

import java.util.Map;

/**
 * Converts between Java values, generic JSON trees and store attribute values.
 *
 * <p>Typed operations go through the configured {@link JsonCodec}; the tree operations are
 * infallible. Instances are immutable and safe to share.
 */
public interface DynamoJson {

    /**
     * Encodes a JSON tree as an attribute value.
     */
    AttributeValue toAttributeValue(JsonNode node);

    /**
     * Decodes an attribute value to a JSON tree. Sets become arrays.
     */
    JsonNode toJsonNode(AttributeValue value);

    /**
     * Serializes a value through the codec, then encodes it.
     * @throws SerializationException if the codec cannot represent the value
     */
    AttributeValue marshall(Object value) throws SerializationException;

    /**
     * Decodes an attribute value, then deserializes it through the codec.
     * @throws DeserializationException if the decoded tree does not fit {@code type}
     */
    <T> T unmarshall(AttributeValue value, Class<T> type) throws DeserializationException;

    /**
     * Marshalls a value into a top-level item (attribute name to value).
     * @throws SerializationException if the value cannot be represented or is not an object
     */
    Map<String, AttributeValue> marshallItem(Object value) throws SerializationException;

    /**
     * Unmarshalls a top-level item.
     * @throws DeserializationException if the item does not fit {@code type}
     */
    <T> T unmarshallItem(Map<String, AttributeValue> item, Class<T> type) throws DeserializationException;

    JsonCodec codec();

    NumberFallback numberFallback();

    /**
     * Creates an instance with the codec found on the class path and lenient number decoding.
     */
    static DynamoJson create() {
        return builder().build();
    }

    static DynamoJson create(JsonCodec codec) {
        return builder().codec(codec).build();
    }

    static DynamoJsonBuilder builder() {
        return new DynamoJsonBuilder();
    }
}
