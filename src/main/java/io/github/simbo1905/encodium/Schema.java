// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/// An ordered, immutable list of [FieldSpec]s identifying a record type. Schemas are compared by identity: two
/// records are of the same type only when they share the same `Schema` instance.
///
/// Schemas are created through [SchemaRegistry#schema(String)]:
/// ```java
/// final var registry = new SchemaRegistry();
/// final var tree = registry.schema("Tree")
///     .field("left", registry.reference("Tree"), FieldOption.optional())
///     .field("right", registry.reference("Tree"), FieldOption.optional())
///     .field("value", FieldType.string())
///     .register();
/// registry.freeze();
/// ```
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class Schema {
  private final String name;
  private final SchemaRegistry registry;
  private final List<FieldSpec> fields;
  private final Map<String, Integer> indexByName;
  private final Set<String> fieldNames;
  private final Optional<RecordCheck> check;

  Schema(String name, SchemaRegistry registry, List<FieldSpec> fields, Optional<RecordCheck> check) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.check = Objects.requireNonNull(check, "check must not be null");

    // Order is the declared sequence, never the order of any map.
    final var sorted = new ArrayList<>(Objects.requireNonNull(fields, "fields must not be null"));
    sorted.sort(Comparator.comparingInt(FieldSpec::sequence));
    final var index = new HashMap<String, Integer>();
    for (int i = 0; i < sorted.size(); i++) {
      final var spec = sorted.get(i);
      if (index.put(spec.name(), i) != null) {
        throw new IllegalArgumentException("Schema " + name + " declares field " + spec.name() + " more than once");
      }
      if (i > 0 && sorted.get(i - 1).sequence() == spec.sequence()) {
        throw new IllegalArgumentException("Schema " + name + " fields " + sorted.get(i - 1).name() + " and " +
            spec.name() + " share sequence " + spec.sequence());
      }
    }
    this.fields = List.copyOf(sorted);
    this.indexByName = Map.copyOf(index);
    final Set<String> names = new LinkedHashSet<>();
    this.fields.forEach(spec -> names.add(spec.name()));
    this.fieldNames = Collections.unmodifiableSet(names);
  }

  public String name() {
    return name;
  }

  SchemaRegistry registry() {
    return registry;
  }

  /// Fields in wire order.
  public List<FieldSpec> fields() {
    return fields;
  }

  /// Field names in wire order.
  public Set<String> fieldNames() {
    return fieldNames;
  }

  public Optional<RecordCheck> check() {
    return check;
  }

  /// @return the position of the field, or -1 when the schema has no such field
  public int indexOf(String fieldName) {
    final var index = indexByName.get(fieldName);
    return index == null ? -1 : index;
  }

  /// @throws ValidationException.UnknownField when the schema has no such field
  public FieldSpec field(String fieldName) {
    final int index = indexOf(fieldName);
    if (index < 0) {
      throw unknownField(fieldName);
    }
    return fields.get(index);
  }

  ValidationException.UnknownField unknownField(String fieldName) {
    return new ValidationException.UnknownField("schema " + name + " has no field named " + fieldName);
  }

  /// Builds a validated record from the supplied values. Missing or `null` entries take the field default.
  /// @throws ValidationException for the first field or cross-field rule that fails
  public RecordInstance construct(Map<String, ?> values) {
    return RecordEngine.construct(this, values);
  }

  /// Starts a record of this schema. Values are only validated by [RecordInstance.Builder#build()].
  public RecordInstance.Builder newRecord() {
    return new RecordInstance.Builder(this);
  }

  @Override
  public String toString() {
    return "Schema{name=" + name + ", fields=" + fields.stream()
        .map(f -> f.name() + ":" + f.type().describe() + (f.optional() ? "?" : ""))
        .collect(Collectors.joining(", ", "[", "]")) + "}";
  }

  /// Collects fields in declaration order. Each call to `field` takes the next sequence number.
  public static final class Builder {
    private final String name;
    private final SchemaRegistry registry;
    private final List<FieldSpec> fields = new ArrayList<>();
    private int nextSequence;
    private RecordCheck check;

    Builder(String name, SchemaRegistry registry) {
      this.name = Objects.requireNonNull(name, "name must not be null");
      this.registry = registry;
    }

    public Builder field(String fieldName, FieldType<?> type, FieldOption... options) {
      Objects.requireNonNull(options, "options must not be null");
      fields.add(FieldSpec.of(fieldName, type, nextSequence++, options));
      return this;
    }

    /// Sets the cross-field rule. Only one is allowed per schema.
    public Builder check(RecordCheck check) {
      if (this.check != null) {
        throw new IllegalStateException("Schema " + name + " already has a cross-field check");
      }
      this.check = Objects.requireNonNull(check, "check must not be null");
      return this;
    }

    /// Builds the schema and registers it with the registry that created this builder.
    public Schema register() {
      return registry.register(name, fields, check);
    }
  }
}
