package io.dynamojson.core;

import io.dynamojson.json.spi.ArrayNode;
import io.dynamojson.json.spi.JsonCodec;
import io.dynamojson.json.spi.JsonNode;
import io.dynamojson.json.spi.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Converts store attribute values to generic JSON trees built by a {@link JsonCodec}.
 *
 * <p>Total: never throws for well-formed {@link AttributeValue} input.
 * <ul>
 *   <li>Binaries become arrays of unsigned byte numbers (0-255)</li>
 *   <li>Sets become arrays in set iteration order; set-ness is not recoverable</li>
 *   <li>Numbers containing {@code .} parse as doubles, all others as 64-bit integers;
 *       text that fails to parse is handled per {@link NumberFallback}</li>
 *   <li>{@code NULL} and unknown variants become JSON null</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class AttributeValueDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(AttributeValueDecoder.class);

    // Plain decimal literal; rejects what Double.parseDouble also accepts (hex, "1.5f", padding)
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    // Long.parseLong alone would also accept non-ASCII digits
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    private final JsonCodec codec;
    private final NumberFallback fallback;

    public AttributeValueDecoder(JsonCodec codec) {
        this(codec, NumberFallback.LENIENT);
    }

    public AttributeValueDecoder(JsonCodec codec, NumberFallback fallback) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public NumberFallback numberFallback() {
        return fallback;
    }

    /**
     * Decodes a value. A Java {@code null} decodes to JSON null.
     */
    public JsonNode decode(AttributeValue value) {
        if (value instanceof AttributeValue.StringValue s) {
            return codec.textNode(s.value());
        }
        if (value instanceof AttributeValue.BinaryValue b) {
            return decodeBinary(b);
        }
        if (value instanceof AttributeValue.BooleanValue b) {
            return codec.booleanNode(b.value());
        }
        if (value instanceof AttributeValue.MapValue m) {
            ObjectNode out = codec.createObjectNode();
            for (Map.Entry<String, AttributeValue> e : m.values().entrySet()) {
                out.set(e.getKey(), decode(e.getValue()));
            }
            return out;
        }
        if (value instanceof AttributeValue.ListValue l) {
            ArrayNode out = codec.createArrayNode();
            for (AttributeValue element : l.values()) {
                out.add(decode(element));
            }
            return out;
        }
        if (value instanceof AttributeValue.NumberSetValue ns) {
            ArrayNode out = codec.createArrayNode();
            for (String element : ns.values()) {
                out.add(decodeNumber(element));
            }
            return out;
        }
        if (value instanceof AttributeValue.BinarySetValue bs) {
            ArrayNode out = codec.createArrayNode();
            for (AttributeValue.BinaryValue element : bs.values()) {
                out.add(decodeBinary(element));
            }
            return out;
        }
        if (value instanceof AttributeValue.StringSetValue ss) {
            ArrayNode out = codec.createArrayNode();
            for (String element : ss.values()) {
                out.add(element);
            }
            return out;
        }
        if (value instanceof AttributeValue.NumberValue n) {
            return decodeNumber(n.value());
        }
        if (value instanceof AttributeValue.UnknownValue u) {
            LOG.debug("Decoding unrecognized attribute type {} as null", u.tag());
        }
        return codec.nullNode();
    }

    /**
     * Applies the numeric decode policy to number text.
     */
    public JsonNode decodeNumber(String text) {
        if (text.indexOf('.') >= 0) {
            if (DECIMAL.matcher(text).matches()) {
                double parsed = Double.parseDouble(text);
                if (Double.isFinite(parsed)) {
                    return codec.numberNode(parsed);
                }
            }
            return fallback(text);
        }
        if (!INTEGER.matcher(text).matches()) {
            return fallback(text);
        }
        try {
            return codec.numberNode(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return fallback(text);
        }
    }

    private JsonNode decodeBinary(AttributeValue.BinaryValue binary) {
        ArrayNode out = codec.createArrayNode();
        for (int i = 0; i < binary.length(); i++) {
            out.add(codec.numberNode(binary.unsignedAt(i)));
        }
        return out;
    }

    private JsonNode fallback(String text) {
        LOG.debug("Number text '{}' does not parse as long or double, applying {} fallback", text, fallback);
        return fallback == NumberFallback.LENIENT ? codec.textNode(text) : codec.nullNode();
    }
}
