// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.simbo1905.encodium.Pickler.LOGGER;

/// Name to [Schema] registry with a two phase lifecycle.
///
/// During registration (normally program start, single threaded) schemas are added with [#schema(String)] or
/// [#register(String, List, RecordCheck)]. [#freeze()] ends the phase: the registry becomes an immutable map that is
/// read without locking from any thread, and further registration fails.
///
/// Named references created with [#reference(String)] resolve on first use, so a schema may refer to itself or to
/// a schema registered after it.
public final class SchemaRegistry {
  private static final SchemaRegistry GLOBAL = new SchemaRegistry();

  private final Map<String, Schema> registering = new LinkedHashMap<>();
  private volatile Map<String, Schema> frozen;

  /// The process-wide registry.
  public static SchemaRegistry global() {
    return GLOBAL;
  }

  public Schema.Builder schema(String name) {
    return new Schema.Builder(name, this);
  }

  /// Registers a schema whose field order is given by [FieldSpec#sequence()].
  public Schema register(String name, List<FieldSpec> fields) {
    return register(name, fields, null);
  }

  /// Registers a schema with an optional cross-field check (`null` for none).
  /// @throws IllegalStateException after [#freeze()]
  /// @throws IllegalArgumentException if the name is taken or the fields are inconsistent
  public Schema register(String name, List<FieldSpec> fields, RecordCheck check) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(fields, "fields must not be null");
    synchronized (registering) {
      if (frozen != null) {
        throw new IllegalStateException("Registry is frozen, cannot register schema " + name);
      }
      if (registering.containsKey(name)) {
        throw new IllegalArgumentException("Schema " + name + " is already registered");
      }
      final var schema = new Schema(name, this, fields, Optional.ofNullable(check));
      registering.put(name, schema);
      LOGGER.fine(() -> "Registered " + schema);
      return schema;
    }
  }

  /// @throws ValidationException.UnknownSchema if no schema has the name
  public Schema resolve(String name) {
    Objects.requireNonNull(name, "name must not be null");
    var snapshot = frozen;
    final Schema schema;
    if (snapshot != null) {
      schema = snapshot.get(name);
    } else {
      synchronized (registering) {
        schema = registering.get(name);
      }
    }
    if (schema == null) {
      throw new ValidationException.UnknownSchema("no schema named " + name + " is registered");
    }
    return schema;
  }

  /// A nested record field type naming a schema of this registry, resolved on first use.
  public FieldType.RecordType reference(String name) {
    return new FieldType.RecordType(SchemaReference.lazy(name, this));
  }

  /// Ends the registration phase. Calling it again has no effect.
  public void freeze() {
    synchronized (registering) {
      if (frozen == null) {
        frozen = Map.copyOf(registering);
        LOGGER.info(() -> "Schema registry frozen with " + frozen.size() + " schemas: " + registering.keySet());
      }
    }
  }

  public boolean isFrozen() {
    return frozen != null;
  }

  public Set<String> names() {
    final var snapshot = frozen;
    if (snapshot != null) {
      return snapshot.keySet();
    }
    synchronized (registering) {
      return Set.copyOf(registering.keySet());
    }
  }
}
