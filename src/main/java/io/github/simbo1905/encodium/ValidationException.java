// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/// Raised whenever a value, a record or a wire message does not satisfy its schema.
///
/// As the failure propagates out of nested structures each enclosing frame calls [#prependPath(String)] with its
/// field name or with [#INNER_ELEMENT], so the final message reads like `children inner element name too long`.
public sealed abstract class ValidationException extends RuntimeException permits
    ValidationException.MissingValue, ValidationException.TypeMismatch, ValidationException.ConstraintViolation,
    ValidationException.CheckFailed, ValidationException.UnknownField, ValidationException.UnknownSchema,
    ValidationException.LengthTooLarge, ValidationException.TruncatedData, ValidationException.MalformedData {

  /// Path segment used for list elements.
  public static final String INNER_ELEMENT = "inner element";

  private final String detail;
  private final Deque<String> path = new ArrayDeque<>();

  ValidationException(String detail) {
    super(detail);
    this.detail = Objects.requireNonNull(detail, "detail must not be null");
  }

  ValidationException(String detail, Throwable cause) {
    super(detail, cause);
    this.detail = Objects.requireNonNull(detail, "detail must not be null");
  }

  /// Adds an enclosing path segment in front of the existing ones.
  /// @return this same exception so that callers can `throw e.prependPath(name)`
  public ValidationException prependPath(String segment) {
    path.addFirst(Objects.requireNonNull(segment, "segment must not be null"));
    return this;
  }

  /// The path segments from the outermost field inwards.
  public List<String> path() {
    return List.copyOf(path);
  }

  /// The message without any path prefix.
  public String detail() {
    return detail;
  }

  @Override
  public String getMessage() {
    if (path.isEmpty()) {
      return detail;
    }
    return String.join(" ", path) + " " + detail;
  }

  /// A required field is absent and there is no default for it.
  public static final class MissingValue extends ValidationException {
    public MissingValue(String detail) {
      super(detail);
    }
  }

  /// The runtime value is not of the kind the field declares.
  public static final class TypeMismatch extends ValidationException {
    public TypeMismatch(String detail) {
      super(detail);
    }

    static TypeMismatch of(Object value, String expected) {
      return new TypeMismatch("is of type " + value.getClass().getSimpleName() + ", expected " + expected);
    }
  }

  /// A per-kind or per-field rule rejected the value.
  public static sealed class ConstraintViolation extends ValidationException permits TooLong {
    public ConstraintViolation(String detail) {
      super(detail);
    }
  }

  /// A string, byte string or similar exceeded its `maxLength`.
  public static final class TooLong extends ConstraintViolation {
    public TooLong(String detail) {
      super(detail);
    }
  }

  /// A cross-field [RecordCheck] rejected the record. User code throws this.
  public static final class CheckFailed extends ValidationException {
    public CheckFailed(String detail) {
      super(detail);
    }
  }

  /// A value was supplied for a name the schema does not declare.
  public static final class UnknownField extends ValidationException {
    public UnknownField(String detail) {
      super(detail);
    }
  }

  /// A schema reference named a schema that was never registered.
  public static final class UnknownSchema extends ValidationException {
    public UnknownSchema(String detail) {
      super(detail);
    }
  }

  /// A chunk length needs more than six length bytes.
  public static final class LengthTooLarge extends ValidationException {
    public LengthTooLarge(String detail) {
      super(detail);
    }
  }

  /// The wire bytes end before the structure they describe.
  public static final class TruncatedData extends ValidationException {
    public TruncatedData(String detail) {
      super(detail);
    }
  }

  /// The wire bytes are complete but do not follow the format.
  public static final class MalformedData extends ValidationException {
    public MalformedData(String detail) {
      super(detail);
    }

    public MalformedData(String detail, Throwable cause) {
      super(detail, cause);
    }
  }
}
