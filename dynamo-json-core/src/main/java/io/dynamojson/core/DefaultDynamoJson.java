package io.dynamojson.core;

import io.dynamojson.json.spi.DeserializationException;
import io.dynamojson.json.spi.JsonCodec;
import io.dynamojson.json.spi.JsonNode;
import io.dynamojson.json.spi.SerializationException;

import java.util.Map;
import java.util.Objects;

final class DefaultDynamoJson implements DynamoJson {
    private final JsonCodec codec;
    private final AttributeValueDecoder decoder;

    DefaultDynamoJson(JsonCodec codec, AttributeValueDecoder decoder) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public AttributeValue toAttributeValue(JsonNode node) {
        return AttributeValueEncoder.INSTANCE.encode(node);
    }

    @Override
    public JsonNode toJsonNode(AttributeValue value) {
        return decoder.decode(value);
    }

    @Override
    public AttributeValue marshall(Object value) throws SerializationException {
        return toAttributeValue(codec.valueToTree(value));
    }

    @Override
    public <T> T unmarshall(AttributeValue value, Class<T> type) throws DeserializationException {
        return codec.treeToValue(toJsonNode(value), type);
    }

    @Override
    public Map<String, AttributeValue> marshallItem(Object value) throws SerializationException {
        AttributeValue encoded = marshall(value);
        if (!(encoded instanceof AttributeValue.MapValue map)) {
            throw new SerializationException("Item must serialize to a JSON object, got " + encoded.type()
                    + " for " + (value == null ? "null" : value.getClass().getName()));
        }
        return map.values();
    }

    @Override
    public <T> T unmarshallItem(Map<String, AttributeValue> item, Class<T> type) throws DeserializationException {
        Objects.requireNonNull(item, "item");
        return unmarshall(new AttributeValue.MapValue(item), type);
    }

    @Override
    public JsonCodec codec() {
        return codec;
    }

    @Override
    public NumberFallback numberFallback() {
        return decoder.numberFallback();
    }
}
