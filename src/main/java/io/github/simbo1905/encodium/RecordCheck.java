// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import java.util.Set;

/// A cross-field rule. Construction calls it once with every field name; [RecordInstance#set(String, Object)]
/// calls it with just the assigned field. Reject the record by throwing [ValidationException.CheckFailed].
@FunctionalInterface
public interface RecordCheck {
  void check(RecordInstance record, Set<String> changedFields);
}
