package io.dynamojson.json.spi;

/**
 * ServiceLoader provider for {@link JsonCodec}.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
