// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.Objects;
import java.util.function.Predicate;

/// A user rule attached to a single field. It runs after the kind's own constraints.
public record FieldCheck(Predicate<?> rule, String message) {
  public FieldCheck {
    Objects.requireNonNull(rule, "rule must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }

  @SuppressWarnings("unchecked")
  void apply(Object value) {
    final boolean passed;
    try {
      passed = ((Predicate<Object>) rule).test(value);
    } catch (ClassCastException e) {
      final var mismatch = ValidationException.TypeMismatch.of(value, "the type the check was written for");
      mismatch.initCause(e);
      throw mismatch;
    }
    if (!passed) {
      throw new ValidationException.ConstraintViolation(message);
    }
  }
}
