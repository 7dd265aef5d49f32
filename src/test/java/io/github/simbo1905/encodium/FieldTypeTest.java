// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Payload encodings and checks of the built-in field kinds
public class FieldTypeTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void booleanPayloadIsOneByte() {
    final var type = FieldType.bool();
    assertThat(type.serializeValue(true)).containsExactly(0x01);
    assertThat(type.serializeValue(false)).containsExactly(0x00);
    assertThat(type.deserializeValue(new byte[]{0x01})).isTrue();
    assertThat(type.deserializeValue(new byte[]{0x00})).isFalse();
    assertThatThrownBy(() -> type.deserializeValue(new byte[]{0x02}))
        .isInstanceOf(ValidationException.MalformedData.class);
  }

  @Test
  @DisplayName("Signed 128 gets a leading zero byte so it cannot read back as -128")
  void signedIntegerSignPadding() {
    final var type = FieldType.integer();
    assertThat(type.serializeValue(BigInteger.valueOf(128))).containsExactly(0x00, 0x80);
    assertThat(type.serializeValue(BigInteger.valueOf(-128))).containsExactly(0x80);
    assertThat(type.serializeValue(BigInteger.valueOf(127))).containsExactly(0x7F);
    assertThat(type.serializeValue(BigInteger.ZERO)).containsExactly(0x00);
    assertThat(type.serializeValue(BigInteger.valueOf(255))).containsExactly(0x00, 0xFF);
    assertThat(type.serializeValue(BigInteger.valueOf(-129))).containsExactly(0xFF, 0x7F);
    assertThat(type.deserializeValue(new byte[]{0x00, (byte) 0x80})).isEqualTo(BigInteger.valueOf(128));
    assertThat(type.deserializeValue(new byte[]{(byte) 0x80})).isEqualTo(BigInteger.valueOf(-128));
  }

  @Test
  void unsignedIntegerUsesMagnitudeBytes() {
    final var type = FieldType.unsignedInteger();
    assertThat(type.serializeValue(BigInteger.valueOf(128))).containsExactly(0x80);
    assertThat(type.serializeValue(BigInteger.valueOf(255))).containsExactly(0xFF);
    assertThat(type.serializeValue(BigInteger.valueOf(256))).containsExactly(0x01, 0x00);
    assertThat(type.serializeValue(BigInteger.ZERO)).containsExactly(0x00);
    assertThat(type.deserializeValue(new byte[]{(byte) 0xFF})).isEqualTo(BigInteger.valueOf(255));
    assertThatThrownBy(() -> type.checkConstraints(BigInteger.valueOf(-1)))
        .isInstanceOf(ValidationException.ConstraintViolation.class)
        .hasMessage("cannot be negative when unsigned");
  }

  @Test
  void integerSizeMatchesPayload() {
    final var signed = FieldType.integer();
    final var unsigned = FieldType.unsignedInteger();
    for (long v : new long[]{0, 1, 127, 128, 255, 256, 65535, Long.MAX_VALUE}) {
      final var value = BigInteger.valueOf(v);
      assertThat(signed.sizeOf(value)).isEqualTo(signed.serializeValue(value).length);
      assertThat(unsigned.sizeOf(value)).isEqualTo(unsigned.serializeValue(value).length);
      assertThat(signed.sizeOf(value.negate())).isEqualTo(signed.serializeValue(value.negate()).length);
    }
  }

  @Test
  void integerAcceptsBoxedWholeNumbers() {
    final var type = FieldType.integer();
    assertThat(type.checkType(7)).isEqualTo(BigInteger.valueOf(7));
    assertThat(type.checkType(7L)).isEqualTo(BigInteger.valueOf(7));
    assertThat(type.checkType((short) 7)).isEqualTo(BigInteger.valueOf(7));
    assertThat(type.checkType((byte) 7)).isEqualTo(BigInteger.valueOf(7));
    assertThatThrownBy(() -> type.checkType(7.0))
        .isInstanceOf(ValidationException.TypeMismatch.class)
        .hasMessage("is of type Double, expected Integer");
    assertThatThrownBy(() -> type.checkType("7"))
        .isInstanceOf(ValidationException.TypeMismatch.class);
  }

  @Test
  void integerRangeOptions() {
    final var type = FieldType.integer().min(-5).max(5);
    type.checkConstraints(BigInteger.valueOf(-5));
    type.checkConstraints(BigInteger.valueOf(5));
    assertThatThrownBy(() -> type.checkConstraints(BigInteger.valueOf(6)))
        .hasMessage("must be at most 5");
    assertThatThrownBy(() -> type.checkConstraints(BigInteger.valueOf(-6)))
        .hasMessage("must be at least -5");
    assertThatThrownBy(() -> FieldType.integer().requireNonNegative().checkConstraints(BigInteger.valueOf(-1)))
        .isInstanceOf(ValidationException.ConstraintViolation.class)
        .hasMessage("cannot be negative");
    assertThatThrownBy(() -> FieldType.integer().min(3).max(2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void stringMaxLength() {
    final var type = FieldType.string().maxLength(3);
    type.checkConstraints("abc");
    assertThatThrownBy(() -> type.checkConstraints("abcd"))
        .isInstanceOf(ValidationException.TooLong.class)
        .isInstanceOf(ValidationException.ConstraintViolation.class);
    // counts code points, not UTF-16 units
    type.checkConstraints("😀ab");
  }

  @Test
  void stringPayloadHasPresenceByte() {
    final var type = FieldType.string();
    assertThat(type.serializeValue("hi")).containsExactly(0x01, 'h', 'i');
    assertThat(type.serializeValue("")).containsExactly(0x01);
    assertThat(type.deserializeValue(new byte[]{0x01})).isEmpty();
    assertThat(type.deserializeValue(type.serializeValue("héllo ☃"))).isEqualTo("héllo ☃");
    assertThatThrownBy(() -> type.deserializeValue(new byte[]{0x00, 'h'}))
        .isInstanceOf(ValidationException.MalformedData.class);
    assertThatThrownBy(() -> type.deserializeValue(new byte[]{0x01, (byte) 0xC3}))
        .isInstanceOf(ValidationException.MalformedData.class)
        .hasMessageContaining("UTF-8");
  }

  @Test
  void bytesAreCopiedAndComparedByContent() {
    final var type = FieldType.bytes().maxLength(4);
    final byte[] original = {1, 2, 3};
    final byte[] checked = type.checkType(original);
    original[0] = 9;
    assertThat(checked).containsExactly(1, 2, 3);
    assertThat(type.valuesEqual(checked, new byte[]{1, 2, 3})).isTrue();
    assertThat(type.valueHash(checked)).isEqualTo(Arrays.hashCode(new byte[]{1, 2, 3}));
    assertThat(type.serializeValue(checked)).containsExactly(0x01, 1, 2, 3);
    assertThat(type.deserializeValue(new byte[]{0x01})).isEmpty();
    assertThatThrownBy(() -> type.checkConstraints(new byte[5]))
        .isInstanceOf(ValidationException.TooLong.class);
  }

  @Test
  @DisplayName("List [1, 2, 3] is a presence byte and three one byte chunks")
  void listOfIntegers() {
    final var type = FieldType.list(FieldType.integer());
    final var value = type.checkType(List.of(1, 2, 3));
    assertThat(type.serializeValue(value)).containsExactly(0x01, 0x01, 0x01, 0x01, 0x02, 0x01, 0x03);
    assertThat(type.deserializeValue(new byte[]{0x01, 0x01, 0x01, 0x01, 0x02, 0x01, 0x03}))
        .containsExactly(BigInteger.ONE, BigInteger.TWO, BigInteger.valueOf(3));
    assertThat(type.serializeValue(List.of())).containsExactly(0x01);
  }

  @Test
  void listElementFailuresArePrefixed() {
    final var type = FieldType.list(FieldType.string().maxLength(2));
    assertThatThrownBy(() -> type.checkType(List.of("ok", 5)))
        .isInstanceOf(ValidationException.TypeMismatch.class)
        .hasMessage("inner element is of type Integer, expected String");
    assertThatThrownBy(() -> type.checkConstraints(List.of("ok", "long")))
        .isInstanceOf(ValidationException.TooLong.class)
        .hasMessageStartingWith("inner element too long");

    final var withNull = new ArrayList<String>();
    withNull.add(null);
    assertThatThrownBy(() -> type.checkType(withNull))
        .isInstanceOf(ValidationException.MissingValue.class)
        .hasMessage("inner element cannot be absent");
    assertThatThrownBy(() -> type.checkType("not a list"))
        .hasMessage("is of type String, expected List<String>");
  }

  @Test
  @DisplayName("Element types are checked before any element constraint")
  void listTypeCheckPrecedesConstraints() {
    final var registry = new SchemaRegistry();
    final var names = registry.schema("Names")
        .field("names", FieldType.list(FieldType.string().maxLength(3)))
        .register();
    assertThatThrownBy(() -> names.construct(Map.of("names", List.of("abcd", 5))))
        .isInstanceOf(ValidationException.TypeMismatch.class)
        .hasMessage("names inner element is of type Integer, expected String");
  }

  @Test
  void checkedListIsUnmodifiable() {
    final var type = FieldType.list(FieldType.bool());
    final var source = new ArrayList<>(List.of(true, false));
    final var checked = type.checkType(source);
    source.add(true);
    assertThat(checked).containsExactly(true, false);
    assertThatThrownBy(() -> checked.add(true)).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void listPayloadWithoutPresenceByteIsMalformed() {
    final var type = FieldType.list(FieldType.integer());
    assertThatThrownBy(() -> type.deserializeValue(new byte[]{0x02, 0x01, 0x01}))
        .isInstanceOf(ValidationException.MalformedData.class);
    assertThatThrownBy(() -> type.deserializeValue(new byte[]{0x01, 0x05, 0x01}))
        .isInstanceOf(ValidationException.TruncatedData.class);
  }
}
