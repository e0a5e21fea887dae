package io.restfulobjects.client.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Jackson wiring for the {@code /objects} wire model.
 */
public final class ObjectsJson {

  private ObjectsJson() {
  }

  public static ObjectMapper newObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.registerModule(module());
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    return mapper;
  }

  /**
   * Module carrying the attribute and timestamp codecs. Registered after {@link JavaTimeModule} so
   * that its {@link Instant} handling wins.
   */
  public static SimpleModule module() {
    SimpleModule module = new SimpleModule("restful-objects");
    module.addSerializer(Attributes.class, new AttributesSerializer());
    module.addDeserializer(Attributes.class, new AttributesDeserializer());
    module.addSerializer(AttributeValue.class, new AttributeValueSerializer());
    module.addDeserializer(AttributeValue.class, new AttributeValueDeserializer());
    module.addDeserializer(Instant.class, new LenientInstantDeserializer());
    return module;
  }

  static AttributeValue toValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return AttributeValue.nullValue();
    }
    if (node.isTextual()) {
      return AttributeValue.of(node.textValue());
    }
    if (node.isBoolean()) {
      return AttributeValue.of(node.booleanValue());
    }
    if (node.isIntegralNumber()) {
      if (!node.canConvertToLong()) {
        throw new IllegalArgumentException("Integer attribute " + node.asText() + " does not fit in a long");
      }
      return AttributeValue.of(node.longValue());
    }
    if (node.isNumber()) {
      return AttributeValue.of(node.doubleValue());
    }
    if (node.isObject()) {
      return AttributeValue.of(toAttributes(node));
    }
    if (node.isArray()) {
      List<AttributeValue> items = new ArrayList<>(node.size());
      node.forEach(item -> items.add(toValue(item)));
      return AttributeValue.ofList(items);
    }
    throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
  }

  static Attributes toAttributes(JsonNode node) {
    Attributes.Builder builder = Attributes.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      builder.put(field.getKey(), toValue(field.getValue()));
    }
    return builder.build();
  }

  static final class AttributesSerializer extends StdSerializer<Attributes> {

    AttributesSerializer() {
      super(Attributes.class);
    }

    @Override
    public void serialize(Attributes value, JsonGenerator gen, SerializerProvider provider) throws IOException {
      gen.writeStartObject();
      for (Map.Entry<String, AttributeValue> entry : value.asMap().entrySet()) {
        gen.writeFieldName(entry.getKey());
        writeValue(entry.getValue(), gen);
      }
      gen.writeEndObject();
    }
  }

  static final class AttributeValueSerializer extends StdSerializer<AttributeValue> {

    AttributeValueSerializer() {
      super(AttributeValue.class);
    }

    @Override
    public void serialize(AttributeValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
      writeValue(value, gen);
    }
  }

  private static void writeValue(AttributeValue value, JsonGenerator gen) throws IOException {
    if (value instanceof AttributeValue.StringValue text) {
      gen.writeString(text.value());
    } else if (value instanceof AttributeValue.IntegerValue integer) {
      gen.writeNumber(integer.value());
    } else if (value instanceof AttributeValue.DecimalValue decimal) {
      gen.writeNumber(decimal.value());
    } else if (value instanceof AttributeValue.BooleanValue flag) {
      gen.writeBoolean(flag.value());
    } else if (value instanceof AttributeValue.StructValue struct) {
      gen.writeStartObject();
      for (Map.Entry<String, AttributeValue> entry : struct.value().asMap().entrySet()) {
        gen.writeFieldName(entry.getKey());
        writeValue(entry.getValue(), gen);
      }
      gen.writeEndObject();
    } else if (value instanceof AttributeValue.ListValue list) {
      gen.writeStartArray();
      for (AttributeValue item : list.value()) {
        writeValue(item, gen);
      }
      gen.writeEndArray();
    } else {
      gen.writeNull();
    }
  }

  static final class AttributesDeserializer extends StdDeserializer<Attributes> {

    AttributesDeserializer() {
      super(Attributes.class);
    }

    @Override
    public Attributes deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
      JsonNode node = parser.readValueAsTree();
      if (node == null || !node.isObject()) {
        return (Attributes) ctxt.handleUnexpectedToken(Attributes.class, parser.currentToken(), parser,
            "Expected a JSON object for attributes");
      }
      return toAttributes(node);
    }
  }

  static final class AttributeValueDeserializer extends StdDeserializer<AttributeValue> {

    AttributeValueDeserializer() {
      super(AttributeValue.class);
    }

    @Override
    public AttributeValue deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
      JsonNode node = parser.readValueAsTree();
      return toValue(node);
    }

    @Override
    public AttributeValue getNullValue(DeserializationContext ctxt) {
      return AttributeValue.nullValue();
    }
  }

  /**
   * Accepts epoch milliseconds (as a number or a digit string) and ISO-8601 instants or offset
   * date-times.
   */
  static final class LenientInstantDeserializer extends StdDeserializer<Instant> {

    LenientInstantDeserializer() {
      super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
      JsonToken token = parser.currentToken();
      if (token == JsonToken.VALUE_NUMBER_INT) {
        return Instant.ofEpochMilli(parser.getLongValue());
      }
      if (token == JsonToken.VALUE_NUMBER_FLOAT) {
        return Instant.ofEpochMilli((long) parser.getDoubleValue());
      }
      if (token == JsonToken.VALUE_STRING) {
        String text = parser.getText().trim();
        if (text.isEmpty()) {
          return null;
        }
        try {
          return parseInstant(text);
        } catch (DateTimeParseException | NumberFormatException ex) {
          return (Instant) ctxt.handleWeirdStringValue(Instant.class, text,
              "Unrecognised timestamp: %s", ex.getMessage());
        }
      }
      return (Instant) ctxt.handleUnexpectedToken(Instant.class, parser);
    }

    static Instant parseInstant(String text) {
      if (text.chars().allMatch(Character::isDigit)) {
        return Instant.ofEpochMilli(Long.parseLong(text));
      }
      try {
        return Instant.parse(text);
      } catch (DateTimeParseException ex) {
        return OffsetDateTime.parse(text).toInstant();
      }
    }
  }
}
