// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.encodium;

/// Closed set of field kinds. Type checks compare these tags, never class names.
public enum FieldKind {
  BOOLEAN("Boolean"),
  INTEGER("Integer"),
  BYTES("Bytes"),
  STRING("String"),
  LIST("List"),
  RECORD("Record");

  private final String displayName;

  FieldKind(String displayName) {
    this.displayName = displayName;
  }

  /// Name used in validation messages such as `is of type Long, expected String`.
  public String displayName() {
    return displayName;
  }
}
