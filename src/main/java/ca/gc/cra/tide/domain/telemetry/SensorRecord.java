package ca.gc.cra.tide.domain.telemetry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One flat telemetry row: an insertion-ordered mapping of column name to scalar value.
 *
 * <p>Values are restricted to {@link String}, {@link Boolean}, and finite {@link Number}s so every record
 * serializes to a single JSON object without nesting. Instances are immutable.</p>
 *
 * @since 0.1.0
 */
public final class SensorRecord {
  private final Map<String, Object> fields;

  private SensorRecord(Map<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  /**
   * Validates and copies an arbitrary field map.
   *
   * @param fields column name to scalar value; must not be {@code null}
   * @return immutable record preserving the iteration order of {@code fields}
   * @throws IllegalArgumentException if a name is blank or a value is not a supported scalar
   */
  public static SensorRecord of(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    Builder builder = builder();
    fields.forEach(builder::put);
    return builder.build();
  }

  /**
   * Starts an empty builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the fields in insertion order.
   *
   * @return unmodifiable view
   */
  public Map<String, Object> fields() {
    return fields;
  }

  /**
   * Looks up a single field.
   *
   * @param name column name
   * @return value or {@code null} when absent
   */
  public Object get(String name) {
    return fields.get(name);
  }

  /**
   * Number of columns in the record.
   *
   * @return field count
   */
  public int size() {
    return fields.size();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof SensorRecord that && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "SensorRecord" + fields;
  }

  /** Accumulates validated fields for a {@link SensorRecord}. */
  public static final class Builder {
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Adds or replaces a field.
     *
     * @param name column name; must not be blank
     * @param value scalar value
     * @return this builder
     * @throws IllegalArgumentException if the name is blank or the value unsupported
     */
    public Builder put(String name, Object value) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("field name must not be blank");
      }
      fields.put(name, requireScalar(name, value));
      return this;
    }

    /**
     * Freezes the accumulated fields.
     *
     * @return immutable record
     * @throws IllegalArgumentException if no fields were added
     */
    public SensorRecord build() {
      if (fields.isEmpty()) {
        throw new IllegalArgumentException("record must contain at least one field");
      }
      return new SensorRecord(new LinkedHashMap<>(fields));
    }
  }

  private static Object requireScalar(String name, Object value) {
    if (value == null) {
      throw new IllegalArgumentException("field " + name + " must not be null");
    }
    if (value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
      throw new IllegalArgumentException("field " + name + " must be a finite number");
    }
    if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
      throw new IllegalArgumentException("field " + name + " must be a finite number");
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof Double || value instanceof Float
        || value instanceof BigDecimal || value instanceof BigInteger) {
      return value;
    }
    throw new IllegalArgumentException(
        "field " + name + " has unsupported type " + value.getClass().getSimpleName());
  }
}
