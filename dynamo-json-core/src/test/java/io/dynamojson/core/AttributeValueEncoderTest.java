package io.dynamojson.core;

import io.dynamojson.json.jackson.JacksonJsonCodec;
import io.dynamojson.json.spi.JsonCodec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeValueEncoderTest {

    private final JsonCodec codec = new JacksonJsonCodec();
    private final AttributeValueEncoder encoder = AttributeValueEncoder.INSTANCE;

    @Test
    void encodesScalars() throws Exception {
        assertThat(encoder.encode(codec.readTree("null"))).isEqualTo(AttributeValue.nul());
        assertThat(encoder.encode(codec.readTree("true"))).isEqualTo(AttributeValue.bool(true));
        assertThat(encoder.encode(codec.readTree("\"hi\""))).isEqualTo(AttributeValue.s("hi"));
        assertThat(encoder.encode(codec.readTree("42"))).isEqualTo(AttributeValue.n("42"));
        assertThat(encoder.encode(codec.readTree("-1.5"))).isEqualTo(AttributeValue.n("-1.5"));
    }

    @Test
    void encodesJavaNullAsNullValue() {
        AttributeValue encoded = encoder.encode(null);
        assertThat(encoded).isEqualTo(new AttributeValue.NullValue(true));
        assertThat(encoded.type()).isEqualTo(AttributeType.NULL);
    }

    @Test
    void numberTextComesFromTheTree() throws Exception {
        assertThat(encoder.encode(codec.readTree("9223372036854775807"))).isEqualTo(AttributeValue.n("9223372036854775807"));
        assertThat(encoder.encode(codec.readTree("1e3"))).isEqualTo(AttributeValue.n("1000.0"));
        assertThat(encoder.encode(codec.numberNode(0.1))).isEqualTo(AttributeValue.n("0.1"));
    }

    @Test
    void encodesNestedContainers() throws Exception {
        AttributeValue encoded = encoder.encode(codec.readTree(
                "{\"name\":\"widget\",\"tags\":[\"a\",1,null],\"dims\":{\"w\":2,\"ok\":false}}"));

        assertThat(encoded).isEqualTo(AttributeValue.m(Map.of(
                "name", AttributeValue.s("widget"),
                "tags", AttributeValue.l(AttributeValue.s("a"), AttributeValue.n("1"), AttributeValue.nul()),
                "dims", AttributeValue.m(Map.of(
                        "w", AttributeValue.n("2"),
                        "ok", AttributeValue.bool(false))))));
    }

    @Test
    void keepsArrayOrder() throws Exception {
        AttributeValue encoded = encoder.encode(codec.readTree("[3,1,2]"));

        assertThat(((AttributeValue.ListValue) encoded).values())
                .containsExactly(AttributeValue.n("3"), AttributeValue.n("1"), AttributeValue.n("2"));
    }

    @Test
    void encodesEmptyContainers() throws Exception {
        assertThat(encoder.encode(codec.readTree("[]"))).isEqualTo(AttributeValue.l(List.of()));
        assertThat(encoder.encode(codec.readTree("{}"))).isEqualTo(AttributeValue.m(Map.of()));
    }

    @Test
    void neverProducesBinaryOrSets() throws Exception {
        AttributeValue encoded = encoder.encode(codec.readTree("[[1,2,255],[\"a\",\"b\"],[1.5,2]]"));

        assertThat(((AttributeValue.ListValue) encoded).values())
                .extracting(AttributeValue::type)
                .containsOnly(AttributeType.L);
    }
}
