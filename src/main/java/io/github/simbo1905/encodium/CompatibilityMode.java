// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.Arrays;

/// Compatibility mode. Set via system property `io.github.simbo1905.encodium.Compatibility`. The default is DISABLED.
///
/// Chunks pair with fields strictly by position and the wire carries no field count. If set to DISABLED (our
/// default) deserialization requires exactly one chunk per field: fewer chunks raise
/// [ValidationException.TruncatedData] and more raise [ValidationException.MalformedData].
/// If set to ENABLED (the opt-in):
/// - missing trailing chunks are treated as absent, so the field default applies before validation
/// - surplus trailing chunks are logged and ignored
/// This allows a sender to lag or lead by appended fields, but never by renamed or reordered ones.
public enum CompatibilityMode {
  /// Strict mode: the chunk count must match the field count.
  DISABLED,

  /// Lenient mode: missing trailing fields are absent, extra trailing chunks are skipped.
  ENABLED;

  public static final String PROPERTY = "io.github.simbo1905.encodium.Compatibility";

  static CompatibilityMode current() {
    final String mode = System.getProperty(PROPERTY, "DISABLED").toUpperCase();
    try {
      return CompatibilityMode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid compatibility mode: " + mode + ". Must be one of: " +
          Arrays.toString(CompatibilityMode.values()), e);
    }
  }
}
