// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/// Declared metadata of one schema field. The `sequence` fixes the field's position on the wire; it is assigned
/// by [Schema.Builder#field(String, FieldType, FieldOption...)] in call order.
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public record FieldSpec(
    String name,
    FieldType<?> type,
    boolean optional,
    Optional<Supplier<?>> defaultValue,
    List<FieldCheck> checks,
    int sequence
) {
  public FieldSpec {
    Objects.requireNonNull(name, "name must not be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Field name must not be blank");
    }
    Objects.requireNonNull(type, "type must not be null for field " + name);
    Objects.requireNonNull(defaultValue, "defaultValue must not be null for field " + name);
    checks = List.copyOf(Objects.requireNonNull(checks, "checks must not be null for field " + name));
  }

  static FieldSpec of(String name, FieldType<?> type, int sequence, FieldOption... options) {
    boolean optional = false;
    Optional<Supplier<?>> defaultValue = Optional.empty();
    final var checks = new ArrayList<FieldCheck>();
    for (FieldOption option : options) {
      if (option instanceof FieldOption.Optionality) {
        optional = true;
      } else if (option instanceof FieldOption.Default d) {
        if (defaultValue.isPresent()) {
          throw new IllegalArgumentException("Field " + name + " declares more than one default");
        }
        defaultValue = Optional.of(d.supplier());
      } else if (option instanceof FieldOption.Check c) {
        checks.add(c.check());
      }
    }
    return new FieldSpec(name, type, optional, defaultValue, checks, sequence);
  }

  /// The default evaluated now, or `null` when the field has none. Suppliers run on every call.
  Object evaluateDefault() {
    return defaultValue.<Object>map(Supplier::get).orElse(null);
  }
}
