package io.dynamojson.core;

import io.dynamojson.json.spi.JsonCodec;
import io.dynamojson.json.spi.JsonCodecs;

import java.util.Objects;

public final class DynamoJsonBuilder {
    private JsonCodec codec;
    private NumberFallback numberFallback = NumberFallback.LENIENT;

    public DynamoJsonBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    public DynamoJsonBuilder numberFallback(NumberFallback numberFallback) {
        this.numberFallback = Objects.requireNonNull(numberFallback, "numberFallback");
        return this;
    }

    /**
     * Builds the instance, loading a codec through {@link JsonCodecs#load()} when none was set.
     * @throws IllegalStateException if no codec was set and none is on the class path
     */
    public DynamoJson build() {
        JsonCodec resolved = codec;
        if (resolved == null) {
            resolved = JsonCodecs.load();
        }
        return new DefaultDynamoJson(resolved, new AttributeValueDecoder(resolved, numberFallback));
    }
}
