// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/// Options accepted by [Schema.Builder#field(String, FieldType, FieldOption...)].
public sealed interface FieldOption permits FieldOption.Optionality, FieldOption.Default, FieldOption.Check {

  /// The field may hold no value.
  static FieldOption optional() {
    return new Optionality();
  }

  /// A constant default used when no value is supplied.
  static FieldOption defaultValue(Object value) {
    Objects.requireNonNull(value, "default value must not be null, omit the option instead");
    return new Default(() -> value);
  }

  /// A default produced on each use, for values that must not be shared.
  static FieldOption defaultFrom(Supplier<?> supplier) {
    return new Default(supplier);
  }

  /// An extra rule over the checked value of this field. The value passed to the rule is in canonical form, so an
  /// integer field sees a [java.math.BigInteger].
  static <T> FieldOption check(Predicate<T> rule, String message) {
    return new Check(new FieldCheck(rule, message));
  }

  record Optionality() implements FieldOption {
  }

  record Default(Supplier<?> supplier) implements FieldOption {
    public Default {
      Objects.requireNonNull(supplier, "supplier must not be null");
    }
  }

  record Check(FieldCheck check) implements FieldOption {
    public Check {
      Objects.requireNonNull(check, "check must not be null");
    }
  }
}
