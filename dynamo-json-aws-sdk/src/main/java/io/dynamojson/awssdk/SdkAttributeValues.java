package io.dynamojson.awssdk;

import io.dynamojson.core.AttributeValue;
import software.amazon.awssdk.core.SdkBytes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bridges {@link AttributeValue} and the AWS SDK for Java v2 DynamoDB model
 * ({@link software.amazon.awssdk.services.dynamodb.model.AttributeValue}).
 *
 * <p>SDK values whose type is {@code UNKNOWN_TO_SDK_VERSION} (or that carry no value at all)
 * map to {@link AttributeValue.UnknownValue}; an {@code UnknownValue} maps back to an empty SDK value.
 */
public final class SdkAttributeValues {
    private SdkAttributeValues() {}

    public static software.amazon.awssdk.services.dynamodb.model.AttributeValue toSdk(AttributeValue value) {
        Objects.requireNonNull(value, "value");
        var builder = software.amazon.awssdk.services.dynamodb.model.AttributeValue.builder();
        if (value instanceof AttributeValue.StringValue s) {
            builder.s(s.value());
        } else if (value instanceof AttributeValue.NumberValue n) {
            builder.n(n.value());
        } else if (value instanceof AttributeValue.BinaryValue b) {
            builder.b(SdkBytes.fromByteArray(b.bytes()));
        } else if (value instanceof AttributeValue.BooleanValue b) {
            builder.bool(b.value());
        } else if (value instanceof AttributeValue.NullValue n) {
            builder.nul(n.value());
        } else if (value instanceof AttributeValue.MapValue m) {
            builder.m(toSdkItem(m.values()));
        } else if (value instanceof AttributeValue.ListValue l) {
            List<software.amazon.awssdk.services.dynamodb.model.AttributeValue> out = new ArrayList<>(l.values().size());
            for (AttributeValue element : l.values()) out.add(toSdk(element));
            builder.l(out);
        } else if (value instanceof AttributeValue.StringSetValue ss) {
            builder.ss(new ArrayList<>(ss.values()));
        } else if (value instanceof AttributeValue.NumberSetValue ns) {
            builder.ns(new ArrayList<>(ns.values()));
        } else if (value instanceof AttributeValue.BinarySetValue bs) {
            List<SdkBytes> out = new ArrayList<>(bs.values().size());
            for (AttributeValue.BinaryValue element : bs.values()) out.add(SdkBytes.fromByteArray(element.bytes()));
            builder.bs(out);
        }
        return builder.build();
    }

    public static AttributeValue fromSdk(software.amazon.awssdk.services.dynamodb.model.AttributeValue value) {
        Objects.requireNonNull(value, "value");
        software.amazon.awssdk.services.dynamodb.model.AttributeValue.Type type = value.type();
        if (type == null) {
            return new AttributeValue.UnknownValue(null);
        }
        return switch (type) {
            case S -> new AttributeValue.StringValue(value.s());
            case N -> new AttributeValue.NumberValue(value.n());
            case B -> new AttributeValue.BinaryValue(value.b().asByteArray());
            case BOOL -> new AttributeValue.BooleanValue(value.bool());
            case NUL -> new AttributeValue.NullValue(value.nul());
            case M -> new AttributeValue.MapValue(fromSdkItem(value.m()));
            case L -> fromSdkList(value.l());
            case SS -> new AttributeValue.StringSetValue(new LinkedHashSet<>(value.ss()));
            case NS -> new AttributeValue.NumberSetValue(new LinkedHashSet<>(value.ns()));
            case BS -> fromSdkBinarySet(value.bs());
            default -> new AttributeValue.UnknownValue(type.toString());
        };
    }

    private static AttributeValue fromSdkList(List<software.amazon.awssdk.services.dynamodb.model.AttributeValue> values) {
        List<AttributeValue> out = new ArrayList<>(values.size());
        for (software.amazon.awssdk.services.dynamodb.model.AttributeValue element : values) {
            out.add(fromSdk(element));
        }
        return new AttributeValue.ListValue(out);
    }

    private static AttributeValue fromSdkBinarySet(List<SdkBytes> values) {
        Set<AttributeValue.BinaryValue> out = new LinkedHashSet<>();
        for (SdkBytes element : values) out.add(new AttributeValue.BinaryValue(element.asByteArray()));
        return new AttributeValue.BinarySetValue(out);
    }

    public static Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> toSdkItem(
            Map<String, AttributeValue> item) {
        Objects.requireNonNull(item, "item");
        Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> out = new LinkedHashMap<>();
        item.forEach((name, value) -> out.put(name, toSdk(value)));
        return out;
    }

    public static Map<String, AttributeValue> fromSdkItem(
            Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> item) {
        Objects.requireNonNull(item, "item");
        Map<String, AttributeValue> out = new LinkedHashMap<>();
        item.forEach((name, value) -> out.put(name, fromSdk(value)));
        return out;
    }
}
