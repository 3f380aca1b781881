package io.dynamojson.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Item attribute value of a document store: a closed union with one record per wire tag.
 *
 * <p>Numbers are carried as decimal text, never as binary numerics. Sets keep insertion order
 * and hold no duplicates. All variants are immutable; collections are copied on construction
 * and reject {@code null} elements.
 *
 * <p>Use the static factories for brevity:
 * <pre>{@code
 * AttributeValue item = AttributeValue.m(Map.of(
 *     "name", AttributeValue.s("widget"),
 *     "count", AttributeValue.n("3"),
 *     "tags", AttributeValue.ss("a", "b")));
 * }</pre>
 */
public sealed interface AttributeValue permits
        AttributeValue.StringValue,
        AttributeValue.NumberValue,
        AttributeValue.BinaryValue,
        AttributeValue.BooleanValue,
        AttributeValue.NullValue,
        AttributeValue.MapValue,
        AttributeValue.ListValue,
        AttributeValue.StringSetValue,
        AttributeValue.NumberSetValue,
        AttributeValue.BinarySetValue,
        AttributeValue.UnknownValue {

    /**
     * Returns the wire tag of this value.
     */
    AttributeType type();

    static StringValue s(String value) {
        return new StringValue(value);
    }

    static NumberValue n(String value) {
        return new NumberValue(value);
    }

    static BinaryValue b(byte[] bytes) {
        return new BinaryValue(bytes);
    }

    static BooleanValue bool(boolean value) {
        return new BooleanValue(value);
    }

    static NullValue nul() {
        return NullValue.INSTANCE;
    }

    static MapValue m(Map<String, ? extends AttributeValue> values) {
        return new MapValue(new LinkedHashMap<>(values));
    }

    static ListValue l(List<? extends AttributeValue> values) {
        return new ListValue(new ArrayList<>(values));
    }

    static ListValue l(AttributeValue... values) {
        return new ListValue(Arrays.asList(values));
    }

    static StringSetValue ss(String... values) {
        return new StringSetValue(new LinkedHashSet<>(Arrays.asList(values)));
    }

    static NumberSetValue ns(String... values) {
        return new NumberSetValue(new LinkedHashSet<>(Arrays.asList(values)));
    }

    static BinarySetValue bs(byte[]... values) {
        Set<BinaryValue> binaries = new LinkedHashSet<>();
        for (byte[] v : values) binaries.add(new BinaryValue(v));
        return new BinarySetValue(binaries);
    }

    /**
     * A string ({@code S}).
     */
    record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public AttributeType type() {
            return AttributeType.S;
        }
    }

    /**
     * A number in decimal text form ({@code N}). The text is not validated here;
     * decoding decides what to do with text that does not parse.
     */
    record NumberValue(String value) implements AttributeValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public AttributeType type() {
            return AttributeType.N;
        }
    }

    /**
     * A binary blob ({@code B}). Holds a private copy of the bytes; equality is by content.
     */
    record BinaryValue(byte[] bytes) implements AttributeValue {
        public BinaryValue {
            bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        /**
         * Returns a copy of the bytes.
         */
        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        public int length() {
            return bytes.length;
        }

        /**
         * Returns the byte at {@code index} as an unsigned value (0-255).
         */
        public int unsignedAt(int index) {
            return bytes[index] & 0xFF;
        }

        @Override
        public AttributeType type() {
            return AttributeType.B;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) return true;
            if (!(other instanceof BinaryValue)) return false;
            return Arrays.equals(bytes, ((BinaryValue) other).bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "BinaryValue[" + Base64.getEncoder().encodeToString(bytes) + "]";
        }
    }

    /**
     * A boolean ({@code BOOL}).
     */
    record BooleanValue(boolean value) implements AttributeValue {
        @Override
        public AttributeType type() {
            return AttributeType.BOOL;
        }
    }

    /**
     * A null ({@code NULL}). The flag is conventionally {@code true}.
     */
    record NullValue(boolean value) implements AttributeValue {
        public static final NullValue INSTANCE = new NullValue(true);

        @Override
        public AttributeType type() {
            return AttributeType.NULL;
        }
    }

    /**
     * A map of attribute names to values ({@code M}).
     */
    record MapValue(Map<String, AttributeValue> values) implements AttributeValue {
        public MapValue {
            Objects.requireNonNull(values, "values");
            Map<String, AttributeValue> copy = new LinkedHashMap<>();
            values.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value")));
            values = Collections.unmodifiableMap(copy);
        }

        public AttributeValue get(String name) {
            return values.get(name);
        }

        @Override
        public AttributeType type() {
            return AttributeType.M;
        }
    }

    /**
     * An ordered list of values ({@code L}).
     */
    record ListValue(List<AttributeValue> values) implements AttributeValue {
        public ListValue {
            values = List.copyOf(Objects.requireNonNull(values, "values"));
        }

        @Override
        public AttributeType type() {
            return AttributeType.L;
        }
    }

    /**
     * A set of strings ({@code SS}).
     */
    record StringSetValue(Set<String> values) implements AttributeValue {
        public StringSetValue {
            values = orderedSet(values);
        }

        @Override
        public AttributeType type() {
            return AttributeType.SS;
        }
    }

    /**
     * A set of numbers in decimal text form ({@code NS}).
     */
    record NumberSetValue(Set<String> values) implements AttributeValue {
        public NumberSetValue {
            values = orderedSet(values);
        }

        @Override
        public AttributeType type() {
            return AttributeType.NS;
        }
    }

    /**
     * A set of binary blobs ({@code BS}).
     */
    record BinarySetValue(Set<BinaryValue> values) implements AttributeValue {
        public BinarySetValue {
            values = orderedSet(values);
        }

        @Override
        public AttributeType type() {
            return AttributeType.BS;
        }
    }

    /**
     * A variant not known to this library. Decodes to null.
     *
     * @param tag the wire tag as reported by the source, if any
     */
    record UnknownValue(String tag) implements AttributeValue {
        @Override
        public AttributeType type() {
            return AttributeType.UNKNOWN;
        }
    }

    private static <E> Set<E> orderedSet(Set<E> values) {
        Objects.requireNonNull(values, "values");
        Set<E> copy = new LinkedHashSet<>();
        for (E v : values) copy.add(Objects.requireNonNull(v, "element"));
        return Collections.unmodifiableSet(copy);
    }
}
