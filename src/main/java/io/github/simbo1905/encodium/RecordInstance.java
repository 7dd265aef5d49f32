// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/// A record of a [Schema]. Every instance is valid: construction and [#set(String, Object)] run the full field
/// pipeline and the schema's cross-field check before the change becomes visible.
///
/// Instances are not thread-safe. Share them across threads only with external synchronization.
public final class RecordInstance {
  private final Schema schema;
  private final Object[] values;

  RecordInstance(Schema schema, Object[] values) {
    assert values.length == schema.fields().size() : "value count does not match field count of " + schema.name();
    this.schema = schema;
    this.values = values;
  }

  public Schema schema() {
    return schema;
  }

  /// The stored value or `null` when the field is absent. Byte arrays, including those inside lists, are returned
  /// as copies.
  public Object get(String fieldName) {
    return detach(values[indexOf(fieldName)]);
  }

  public Boolean getBoolean(String fieldName) {
    return typed(fieldName, FieldKind.BOOLEAN, Boolean.class);
  }

  public BigInteger getInteger(String fieldName) {
    return typed(fieldName, FieldKind.INTEGER, BigInteger.class);
  }

  /// @throws ArithmeticException if the value does not fit in a long
  public Long getLong(String fieldName) {
    final var value = getInteger(fieldName);
    return value == null ? null : value.longValueExact();
  }

  public String getString(String fieldName) {
    return typed(fieldName, FieldKind.STRING, String.class);
  }

  public byte[] getBytes(String fieldName) {
    final var value = typed(fieldName, FieldKind.BYTES, byte[].class);
    return value == null ? null : value.clone();
  }

  /// An unmodifiable view of the list stored in the field. Byte array elements are copies.
  public List<?> getList(String fieldName) {
    return (List<?>) detach(typed(fieldName, FieldKind.LIST, List.class));
  }

  public RecordInstance getRecord(String fieldName) {
    return typed(fieldName, FieldKind.RECORD, RecordInstance.class);
  }

  /// Validates and assigns one field, then runs the cross-field check with just that field name. If the check
  /// fails the previous value is restored.
  /// @throws ValidationException when the value or the record check is rejected
  public void set(String fieldName, Object value) {
    RecordEngine.mutate(this, fieldName, value);
  }

  /// An independent record with the same values. Nested records are copied too.
  public RecordInstance copy() {
    final var copied = new Object[values.length];
    for (int i = 0; i < copied.length; i++) {
      copied[i] = copyValue(values[i]);
    }
    return new RecordInstance(schema, copied);
  }

  private static Object copyValue(Object value) {
    if (value instanceof RecordInstance nested) {
      return nested.copy();
    } else if (value instanceof List<?> list) {
      return list.stream().map(RecordInstance::copyValue).toList();
    } else if (value instanceof byte[] bytes) {
      return bytes.clone();
    }
    return value;
  }

  /// Stored byte arrays never leave the record uncopied.
  private static Object detach(Object value) {
    if (value instanceof byte[] bytes) {
      return bytes.clone();
    } else if (value instanceof List<?> list && containsBytes(list)) {
      return list.stream().map(RecordInstance::detach).toList();
    }
    return value;
  }

  private static boolean containsBytes(List<?> list) {
    for (Object item : list) {
      if (item instanceof byte[] || item instanceof List<?> inner && containsBytes(inner)) {
        return true;
      }
    }
    return false;
  }

  /// The present values keyed by field name, suitable for [Schema#construct(Map)].
  public Map<String, Object> toMap() {
    final var map = new HashMap<String, Object>();
    for (var spec : schema.fields()) {
      final var value = get(spec.name());
      if (value != null) {
        map.put(spec.name(), value);
      }
    }
    return map;
  }

  Object valueAt(int index) {
    return values[index];
  }

  Object replace(int index, Object value) {
    final var previous = values[index];
    values[index] = value;
    return previous;
  }

  private int indexOf(String fieldName) {
    Objects.requireNonNull(fieldName, "field name must not be null");
    final int index = schema.indexOf(fieldName);
    if (index < 0) {
      throw schema.unknownField(fieldName);
    }
    return index;
  }

  private <V> V typed(String fieldName, FieldKind kind, Class<V> javaType) {
    final int index = indexOf(fieldName);
    final var spec = schema.fields().get(index);
    if (spec.type().kind() != kind) {
      throw new IllegalArgumentException("Field " + schema.name() + "." + fieldName + " is " +
          spec.type().describe() + ", not " + kind.displayName());
    }
    return javaType.cast(values[index]);
  }

  /// True when both records share the same schema instance and every field value is equal. Bytes compare by
  /// content, lists element by element and nested records recursively.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RecordInstance that)) return false;
    if (schema != that.schema) return false;
    final var fields = schema.fields();
    for (int i = 0; i < values.length; i++) {
      if (!valuesEqual(fields.get(i).type(), values[i], that.values[i])) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = schema.name().hashCode();
    final var fields = schema.fields();
    for (int i = 0; i < values.length; i++) {
      hash = 31 * hash + (values[i] == null ? 0 : valueHash(fields.get(i).type(), values[i]));
    }
    return hash;
  }

  @Override
  public String toString() {
    final var joiner = new StringJoiner(", ", schema.name() + "{", "}");
    final var fields = schema.fields();
    for (int i = 0; i < values.length; i++) {
      joiner.add(fields.get(i).name() + "=" + valueToString(fields.get(i).type(), values[i]));
    }
    return joiner.toString();
  }

  @SuppressWarnings("unchecked")
  private static <T> boolean valuesEqual(FieldType<T> type, Object a, Object b) {
    if (a == null || b == null) {
      return a == b;
    }
    return type.valuesEqual((T) a, (T) b);
  }

  @SuppressWarnings("unchecked")
  private static <T> int valueHash(FieldType<T> type, Object value) {
    return type.valueHash((T) value);
  }

  @SuppressWarnings("unchecked")
  private static <T> String valueToString(FieldType<T> type, Object value) {
    return value == null ? "null" : type.valueToString((T) value);
  }

  /// Collects values by name and validates them all at once on [#build()].
  public static final class Builder {
    private final Schema schema;
    private final Map<String, Object> values = new HashMap<>();

    Builder(Schema schema) {
      this.schema = schema;
    }

    public Builder with(String fieldName, Object value) {
      values.put(Objects.requireNonNull(fieldName, "field name must not be null"), value);
      return this;
    }

    public RecordInstance build() {
      return RecordEngine.construct(schema, values);
    }
  }
}
