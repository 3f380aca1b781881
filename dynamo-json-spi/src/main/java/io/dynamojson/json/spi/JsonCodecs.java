package io.dynamojson.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 *
 * <p>The first provider found wins. Callers that need a specific configuration
 * should construct their codec directly instead.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (providers.hasNext()) {
            JsonCodec codec = providers.next().codec();
            if (codec != null) return codec;
        }
        throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                + " found on the class path; add dynamo-json-jackson or pass a codec explicitly");
    }
}
