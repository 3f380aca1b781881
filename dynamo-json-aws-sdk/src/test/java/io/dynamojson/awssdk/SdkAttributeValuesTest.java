package io.dynamojson.awssdk;

import io.dynamojson.core.AttributeValue;
import io.dynamojson.core.DynamoJson;
import io.dynamojson.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.SdkBytes;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SdkAttributeValuesTest {

    record Order(String id, int quantity, boolean shipped, List<String> notes) {}

    @Test
    void mapsEveryVariantToTheSdkModel() {
        assertThat(SdkAttributeValues.toSdk(AttributeValue.s("x")).s()).isEqualTo("x");
        assertThat(SdkAttributeValues.toSdk(AttributeValue.n("12.5")).n()).isEqualTo("12.5");
        assertThat(SdkAttributeValues.toSdk(AttributeValue.b(new byte[]{1, 2})).b())
                .isEqualTo(SdkBytes.fromByteArray(new byte[]{1, 2}));
        assertThat(SdkAttributeValues.toSdk(AttributeValue.bool(true)).bool()).isTrue();
        assertThat(SdkAttributeValues.toSdk(AttributeValue.nul()).nul()).isTrue();
        assertThat(SdkAttributeValues.toSdk(AttributeValue.ss("a", "b")).ss()).containsExactly("a", "b");
        assertThat(SdkAttributeValues.toSdk(AttributeValue.ns("1", "2")).ns()).containsExactly("1", "2");
        assertThat(SdkAttributeValues.toSdk(AttributeValue.bs(new byte[]{3})).bs())
                .containsExactly(SdkBytes.fromByteArray(new byte[]{3}));

        software.amazon.awssdk.services.dynamodb.model.AttributeValue list =
                SdkAttributeValues.toSdk(AttributeValue.l(AttributeValue.s("a"), AttributeValue.n("1")));
        assertThat(list.type()).isEqualTo(software.amazon.awssdk.services.dynamodb.model.AttributeValue.Type.L);
        assertThat(list.l()).hasSize(2);

        software.amazon.awssdk.services.dynamodb.model.AttributeValue map =
                SdkAttributeValues.toSdk(AttributeValue.m(Map.of("k", AttributeValue.bool(false))));
        assertThat(map.type()).isEqualTo(software.amazon.awssdk.services.dynamodb.model.AttributeValue.Type.M);
        assertThat(map.m().get("k").bool()).isFalse();
    }

    @Test
    void roundTripsThroughTheSdkModel() {
        AttributeValue value = AttributeValue.m(Map.of(
                "s", AttributeValue.s("text"),
                "n", AttributeValue.n("-3"),
                "b", AttributeValue.b(new byte[]{0, (byte) 255}),
                "bool", AttributeValue.bool(true),
                "null", AttributeValue.nul(),
                "l", AttributeValue.l(AttributeValue.l(), AttributeValue.m(Map.of())),
                "ss", AttributeValue.ss("z", "y"),
                "ns", AttributeValue.ns("1", "1.5"),
                "bs", AttributeValue.bs(new byte[]{1}, new byte[]{2})));

        assertThat(SdkAttributeValues.fromSdk(SdkAttributeValues.toSdk(value))).isEqualTo(value);
    }

    @Test
    void emptySdkValueIsUnknown() {
        software.amazon.awssdk.services.dynamodb.model.AttributeValue empty =
                software.amazon.awssdk.services.dynamodb.model.AttributeValue.builder().build();

        assertThat(SdkAttributeValues.fromSdk(empty)).isInstanceOf(AttributeValue.UnknownValue.class);
        assertThat(SdkAttributeValues.toSdk(new AttributeValue.UnknownValue("X")).type())
                .isIn(null, software.amazon.awssdk.services.dynamodb.model.AttributeValue.Type.UNKNOWN_TO_SDK_VERSION);
    }

    @Test
    void typedItemRoundTripsThroughTheSdk() throws Exception {
        DynamoJson dynamoJson = DynamoJson.create(new JacksonJsonCodec());
        Order order = new Order("o-1", 3, false, List.of("fragile"));

        Map<String, software.amazon.awssdk.services.dynamodb.model.AttributeValue> sdkItem =
                SdkAttributeValues.toSdkItem(dynamoJson.marshallItem(order));

        assertThat(sdkItem.get("id").s()).isEqualTo("o-1");
        assertThat(sdkItem.get("quantity").n()).isEqualTo("3");
        assertThat(sdkItem.get("notes").l()).hasSize(1);
        assertThat(dynamoJson.unmarshallItem(SdkAttributeValues.fromSdkItem(sdkItem), Order.class)).isEqualTo(order);
    }
}
