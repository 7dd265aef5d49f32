// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.github.simbo1905.encodium.Pickler.LOGGER;

/// The validation pipeline shared by construction, mutation and deserialization.
final class RecordEngine {

  private RecordEngine() {
  }

  static RecordInstance construct(Schema schema, Map<String, ?> provided) {
    Objects.requireNonNull(schema, "schema must not be null");
    Objects.requireNonNull(provided, "values must not be null");
    for (String key : provided.keySet()) {
      if (schema.indexOf(key) < 0) {
        throw schema.unknownField(key);
      }
    }
    final var fields = schema.fields();
    final var values = new Object[fields.size()];
    for (int i = 0; i < values.length; i++) {
      final var spec = fields.get(i);
      values[i] = validateField(spec, provided.get(spec.name()));
    }
    final var record = new RecordInstance(schema, values);
    schema.check().ifPresent(check -> check.check(record, schema.fieldNames()));
    LOGGER.finer(() -> "Constructed " + record);
    return record;
  }

  static void mutate(RecordInstance record, String fieldName, Object value) {
    Objects.requireNonNull(fieldName, "field name must not be null");
    final var schema = record.schema();
    final int index = schema.indexOf(fieldName);
    if (index < 0) {
      throw schema.unknownField(fieldName);
    }
    final var checked = validateField(schema.fields().get(index), value);
    final var previous = record.replace(index, checked);
    final var check = schema.check();
    if (check.isPresent()) {
      try {
        check.get().check(record, Set.of(fieldName));
      } catch (RuntimeException e) {
        record.replace(index, previous);
        LOGGER.fine(() -> "Rolled back " + schema.name() + "." + fieldName + " after cross-field check failed: " +
            e.getMessage());
        throw e;
      }
    }
  }

  /// Runs default, optional, type, constraint and field checks in that order.
  /// @return the canonical value to store, `null` for an absent optional field
  static Object validateField(FieldSpec spec, Object value) {
    try {
      final var candidate = value != null ? value : spec.evaluateDefault();
      if (candidate == null) {
        if (!spec.optional()) {
          throw new ValidationException.MissingValue("cannot be absent");
        }
        return null;
      }
      final Object checked = checkValue(spec.type(), candidate);
      for (FieldCheck check : spec.checks()) {
        check.apply(checked);
      }
      return checked;
    } catch (ValidationException e) {
      throw e.prependPath(spec.name());
    }
  }

  private static <T> T checkValue(FieldType<T> type, Object value) {
    final T typed = type.checkType(value);
    type.checkConstraints(typed);
    return typed;
  }
}
