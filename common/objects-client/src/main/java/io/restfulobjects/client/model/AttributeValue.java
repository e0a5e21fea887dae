package io.restfulobjects.client.model;

import java.util.List;
import java.util.Objects;

/**
 * One value inside an object's free-form {@code data} map.
 * <p>
 * The variants mirror JSON value kinds so that a value read back from the API keeps the type it was
 * written with: an integer never turns into a decimal and a boolean never turns into a string.
 */
public sealed interface AttributeValue permits AttributeValue.StringValue,
    AttributeValue.IntegerValue,
    AttributeValue.DecimalValue,
    AttributeValue.BooleanValue,
    AttributeValue.NullValue,
    AttributeValue.StructValue,
    AttributeValue.ListValue {

  static AttributeValue of(String value) {
    return value == null ? NullValue.INSTANCE : new StringValue(value);
  }

  static AttributeValue of(long value) {
    return new IntegerValue(value);
  }

  static AttributeValue of(double value) {
    return new DecimalValue(value);
  }

  static AttributeValue of(boolean value) {
    return new BooleanValue(value);
  }

  static AttributeValue of(Attributes value) {
    return value == null ? NullValue.INSTANCE : new StructValue(value);
  }

  static AttributeValue ofList(List<AttributeValue> values) {
    return values == null ? NullValue.INSTANCE : new ListValue(values);
  }

  static AttributeValue nullValue() {
    return NullValue.INSTANCE;
  }

  /**
   * Wraps a plain Java value: {@link String}, {@link Boolean}, integral and floating {@link Number}s,
   * {@link java.util.Map} with string keys, {@link List}, {@link Attributes}, an existing
   * {@link AttributeValue}, or {@code null}.
   *
   * @throws IllegalArgumentException for any other type
   */
  static AttributeValue from(Object value) {
    if (value == null) {
      return NullValue.INSTANCE;
    }
    if (value instanceof AttributeValue attributeValue) {
      return attributeValue;
    }
    if (value instanceof String text) {
      return new StringValue(text);
    }
    if (value instanceof Boolean flag) {
      return new BooleanValue(flag);
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return new IntegerValue(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      return new DecimalValue(number.doubleValue());
    }
    if (value instanceof Attributes attributes) {
      return new StructValue(attributes);
    }
    if (value instanceof java.util.Map<?, ?> map) {
      return new StructValue(Attributes.fromMap(map));
    }
    if (value instanceof List<?> list) {
      return new ListValue(list.stream().map(AttributeValue::from).toList());
    }
    throw new IllegalArgumentException("Unsupported attribute value type: " + value.getClass().getName());
  }

  default String asString() {
    throw new IllegalStateException("Not a string value: " + this);
  }

  default long asLong() {
    throw new IllegalStateException("Not an integer value: " + this);
  }

  /**
   * Numeric view of integer and decimal values.
   */
  default double asDouble() {
    throw new IllegalStateException("Not a numeric value: " + this);
  }

  default boolean asBoolean() {
    throw new IllegalStateException("Not a boolean value: " + this);
  }

  default Attributes asStruct() {
    throw new IllegalStateException("Not a struct value: " + this);
  }

  default List<AttributeValue> asList() {
    throw new IllegalStateException("Not a list value: " + this);
  }

  default boolean isNull() {
    return false;
  }

  /**
   * Converts back to plain Java objects, the inverse of {@link #from(Object)}.
   */
  Object toJava();

  record StringValue(String value) implements AttributeValue {

    public StringValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String asString() {
      return value;
    }

    @Override
    public Object toJava() {
      return value;
    }
  }

  record IntegerValue(long value) implements AttributeValue {

    @Override
    public long asLong() {
      return value;
    }

    @Override
    public double asDouble() {
      return value;
    }

    @Override
    public Object toJava() {
      return value;
    }
  }

  record DecimalValue(double value) implements AttributeValue {

    @Override
    public double asDouble() {
      return value;
    }

    @Override
    public Object toJava() {
      return value;
    }
  }

  record BooleanValue(boolean value) implements AttributeValue {

    @Override
    public boolean asBoolean() {
      return value;
    }

    @Override
    public Object toJava() {
      return value;
    }
  }

  record StructValue(Attributes value) implements AttributeValue {

    public StructValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Attributes asStruct() {
      return value;
    }

    @Override
    public Object toJava() {
      return value.toJava();
    }
  }

  record ListValue(List<AttributeValue> value) implements AttributeValue {

    public ListValue {
      value = List.copyOf(value);
    }

    @Override
    public List<AttributeValue> asList() {
      return value;
    }

    @Override
    public Object toJava() {
      return value.stream().map(AttributeValue::toJava).toList();
    }
  }

  final class NullValue implements AttributeValue {

    private static final NullValue INSTANCE = new NullValue();

    private NullValue() {
    }

    @Override
    public boolean isNull() {
      return true;
    }

    @Override
    public Object toJava() {
      return null;
    }

    @Override
    public String toString() {
      return "NullValue";
    }
  }
}
