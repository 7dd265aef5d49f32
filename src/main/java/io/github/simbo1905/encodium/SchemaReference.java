// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.Objects;

import static io.github.simbo1905.encodium.Pickler.LOGGER;

/// A schema named by reference. Resolution goes through the owning registry the first time the reference is
/// used, which lets a schema refer to itself or to one that is registered later.
public final class SchemaReference {
  private final String name;
  private final SchemaRegistry registry;
  private volatile Schema resolved;

  private SchemaReference(String name, SchemaRegistry registry, Schema resolved) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.registry = registry;
    this.resolved = resolved;
  }

  static SchemaReference lazy(String name, SchemaRegistry registry) {
    return new SchemaReference(name, Objects.requireNonNull(registry, "registry must not be null"), null);
  }

  static SchemaReference of(Schema schema) {
    Objects.requireNonNull(schema, "schema must not be null");
    return new SchemaReference(schema.name(), schema.registry(), schema);
  }

  public String name() {
    return name;
  }

  public boolean isResolved() {
    return resolved != null;
  }

  /// @throws ValidationException.UnknownSchema if nothing is registered under the name
  public Schema resolve() {
    var schema = resolved;
    if (schema == null) {
      schema = registry.resolve(name);
      resolved = schema;
      LOGGER.finer(() -> "Resolved schema reference " + name);
    }
    return schema;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SchemaReference that)) return false;
    return name.equals(that.name) && registry == that.registry;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, System.identityHashCode(registry));
  }

  @Override
  public String toString() {
    return "SchemaReference{name=" + name + ", resolved=" + isResolved() + "}";
  }
}
