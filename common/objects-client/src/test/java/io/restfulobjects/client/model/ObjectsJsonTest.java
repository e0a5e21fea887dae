package io.restfulobjects.client.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObjectsJsonTest {

  private final ObjectMapper mapper = ObjectsJson.newObjectMapper();

  @Test
  void decodesObjectWithTypedAttributes() throws Exception {
    String json = """
        {
          "id": "ff808181932badb6",
          "name": "Apple iPad Air",
          "data": {
            "brand": "Apple",
            "version": 123,
            "flag": true,
            "price": 799.99,
            "dimensions": {"width": 178, "unit": "mm"},
            "colors": ["Blue", "Gray"],
            "note": null
          },
          "createdAt": "2024-11-21T20:06:23.986+00:00"
        }
        """;

    ObjectRecord record = mapper.readValue(json, ObjectRecord.class);

    assertThat(record.id()).isEqualTo("ff808181932badb6");
    assertThat(record.hasId()).isTrue();
    Attributes data = record.attributes();
    assertThat(data.require("brand")).isInstanceOf(AttributeValue.StringValue.class);
    assertThat(data.require("version")).isEqualTo(AttributeValue.of(123L));
    assertThat(data.require("version").asLong()).isEqualTo(123L);
    assertThat(data.require("flag").asBoolean()).isTrue();
    assertThat(data.require("price")).isInstanceOf(AttributeValue.DecimalValue.class);
    assertThat(data.require("price").asDouble()).isEqualTo(799.99);
    assertThat(data.require("dimensions").asStruct().require("width").asLong()).isEqualTo(178L);
    assertThat(data.require("colors").asList())
        .containsExactly(AttributeValue.of("Blue"), AttributeValue.of("Gray"));
    assertThat(data.require("note").isNull()).isTrue();
    assertThat(record.createdAt()).isEqualTo(Instant.parse("2024-11-21T20:06:23.986Z"));
    assertThat(record.updated()).isEmpty();
  }

  @Test
  void stringsAreNotCoercedToOtherTypes() throws Exception {
    ObjectRecord record = mapper.readValue(
        "{\"id\":\"1\",\"name\":\"n\",\"data\":{\"version\":\"123\",\"flag\":\"true\"}}", ObjectRecord.class);

    AttributeValue version = record.attributes().require("version");
    AttributeValue flag = record.attributes().require("flag");
    assertThat(version.asString()).isEqualTo("123");
    assertThatThrownBy(version::asLong).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(flag::asBoolean).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void timestampsAcceptEpochMillis() throws Exception {
    ObjectRecord record = mapper.readValue(
        "{\"id\":\"1\",\"name\":\"n\",\"createdAt\":1700000000000,\"updatedAt\":\"1700000005000\"}",
        ObjectRecord.class);

    assertThat(record.createdAt()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
    assertThat(record.updatedAt()).isEqualTo(Instant.ofEpochMilli(1_700_000_005_000L));
  }

  @Test
  void nullDataStaysAbsent() throws Exception {
    ObjectRecord record = mapper.readValue("{\"id\":\"7\",\"name\":\"Apple iPad Air\",\"data\":null}",
        ObjectRecord.class);

    assertThat(record.data()).isNull();
    assertThat(record.attributes().isEmpty()).isTrue();
  }

  @Test
  void requestSerialisesNameAndDataPreservingValueTypes() throws Exception {
    Attributes data = Attributes.builder()
        .put("source", "xunit")
        .put("version", 1)
        .put("active", true)
        .put("ratio", 0.5)
        .build();

    JsonNode node = mapper.readTree(mapper.writeValueAsString(new ObjectCreateRequest("probe", data)));

    assertThat(node.path("name").asText()).isEqualTo("probe");
    assertThat(node.path("data").path("source").isTextual()).isTrue();
    assertThat(node.path("data").path("version").isIntegralNumber()).isTrue();
    assertThat(node.path("data").path("version").asLong()).isEqualTo(1L);
    assertThat(node.path("data").path("active").isBoolean()).isTrue();
    assertThat(node.path("data").path("ratio").isFloatingPointNumber()).isTrue();
  }

  @Test
  void requestWithoutDataSendsExplicitNull() throws Exception {
    JsonNode node = mapper.readTree(mapper.writeValueAsString(ObjectCreateRequest.of("")));

    assertThat(node.has("data")).isTrue();
    assertThat(node.path("data").isNull()).isTrue();
    assertThat(node.path("name").asText()).isEmpty();
  }

  @Test
  void fixtureShapedJsonDecodesIntoCreateRequest() throws Exception {
    ObjectCreateRequest request = mapper.readValue(
        "{\"name\":\"Apple iPad Air\",\"data\":{\"capacity\":\"256 GB\",\"screenSize\":10.9,\"tags\":[1,\"a\"]}}",
        ObjectCreateRequest.class);

    assertThat(request.name()).isEqualTo("Apple iPad Air");
    assertThat(request.data().toJava())
        .isEqualTo(Map.of("capacity", "256 GB", "screenSize", 10.9, "tags", List.of(1L, "a")));
  }

  @Test
  void nonObjectDataIsRejected() {
    assertThatThrownBy(() -> mapper.readValue("{\"id\":\"1\",\"data\":\"oops\"}", ObjectRecord.class))
        .isInstanceOf(JsonMappingException.class);
  }

  @Test
  void longBoundaryIntegersStayIntegers() throws Exception {
    JsonNode node = mapper.readTree("{\"max\":9223372036854775807,\"min\":-9223372036854775808}");

    Attributes attributes = ObjectsJson.toAttributes(node);

    assertThat(attributes.require("max")).isEqualTo(AttributeValue.of(Long.MAX_VALUE));
    assertThat(attributes.require("min")).isEqualTo(AttributeValue.of(Long.MIN_VALUE));
  }

  @Test
  void integersBeyondLongRangeAreRejectedInsteadOfRounded() throws Exception {
    JsonNode node = mapper.readTree("92233720368547758070");

    assertThatThrownBy(() -> ObjectsJson.toValue(node))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not fit in a long");
    assertThatThrownBy(() -> mapper.readValue(
        "{\"id\":\"1\",\"data\":{\"serial\":92233720368547758070}}", ObjectRecord.class))
        .isInstanceOf(JsonMappingException.class)
        .hasStackTraceContaining("does not fit in a long");
  }
}
