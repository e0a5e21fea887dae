package io.restfulobjects.client.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered view of an object's {@code data} map.
 * <p>
 * The client treats the map as opaque: keys and values are carried verbatim in both directions and
 * no schema is applied.
 */
public final class Attributes {

  private static final Attributes EMPTY = new Attributes(Map.of());

  private final Map<String, AttributeValue> values;

  private Attributes(Map<String, AttributeValue> values) {
    this.values = values;
  }

  public static Attributes empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Attributes of(Map<String, AttributeValue> values) {
    Objects.requireNonNull(values, "values");
    Builder builder = builder();
    values.forEach(builder::put);
    return builder.build();
  }

  /**
   * Builds attributes from plain Java values, see {@link AttributeValue#from(Object)}.
   */
  public static Attributes fromMap(Map<?, ?> values) {
    Objects.requireNonNull(values, "values");
    Builder builder = builder();
    values.forEach((key, value) -> {
      if (!(key instanceof String name)) {
        throw new IllegalArgumentException("Attribute keys must be strings but found " + key);
      }
      builder.put(name, AttributeValue.from(value));
    });
    return builder.build();
  }

  public Optional<AttributeValue> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  /**
   * Returns the value stored under {@code key}.
   *
   * @throws IllegalStateException when the key is absent
   */
  public AttributeValue require(String key) {
    AttributeValue value = values.get(key);
    if (value == null) {
      throw new IllegalStateException("Missing attribute '" + key + "' in " + values.keySet());
    }
    return value;
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  public Set<String> keySet() {
    return values.keySet();
  }

  public Map<String, AttributeValue> asMap() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<String, Object> toJava() {
    Map<String, Object> result = new LinkedHashMap<>();
    values.forEach((key, value) -> result.put(key, value.toJava()));
    return result;
  }

  public Builder toBuilder() {
    Builder builder = builder();
    values.forEach(builder::put);
    return builder;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof Attributes that && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }

  public static final class Builder {

    private final Map<String, AttributeValue> values = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder put(String key, AttributeValue value) {
      Objects.requireNonNull(key, "key");
      values.put(key, value == null ? AttributeValue.nullValue() : value);
      return this;
    }

    public Builder put(String key, String value) {
      return put(key, AttributeValue.of(value));
    }

    public Builder put(String key, long value) {
      return put(key, AttributeValue.of(value));
    }

    public Builder put(String key, double value) {
      return put(key, AttributeValue.of(value));
    }

    public Builder put(String key, boolean value) {
      return put(key, AttributeValue.of(value));
    }

    public Builder remove(String key) {
      values.remove(key);
      return this;
    }

    public Attributes build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      return new Attributes(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }
  }
}
