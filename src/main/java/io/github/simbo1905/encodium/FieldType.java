// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static io.github.simbo1905.encodium.Pickler.LOGGER;
import static io.github.simbo1905.encodium.ValidationException.INNER_ELEMENT;
import static java.nio.charset.StandardCharsets.UTF_8;

/// The built-in field kinds. Each node knows how to check a value and how to write and read its chunk payload.
/// The constraint options of a kind are the components of its record.
///
/// `checkType` both verifies the runtime kind and returns the canonical stored form of the value: integers widen
/// to [BigInteger], byte arrays and lists are copied.
public sealed interface FieldType<T> permits
    FieldType.BooleanType, FieldType.IntegerType, FieldType.BytesType, FieldType.StringType,
    FieldType.ListType, FieldType.RecordType {

  /// Leading byte of the bytes, string and list payloads. It keeps an empty value one byte long so that it can
  /// never be mistaken for the absence marker.
  byte PRESENT = 0x01;

  FieldKind kind();

  /// @return the value in its canonical stored form
  /// @throws ValidationException.TypeMismatch if the value is not of this kind
  T checkType(Object value);

  /// @throws ValidationException.ConstraintViolation if a constraint option rejects the value
  void checkConstraints(T value);

  /// Exact number of payload bytes [#write(ByteBuffer, Object)] produces.
  int sizeOf(T value);

  void write(ByteBuffer buffer, T value);

  /// Decodes a payload. The buffer holds exactly one chunk payload.
  T read(ByteBuffer payload);

  /// Decodes a payload on behalf of a pickler. Nested records decode under the pickler's compatibility mode.
  default T read(ByteBuffer payload, CompatibilityMode compatibilityMode) {
    return read(payload);
  }

  default byte[] serializeValue(T value) {
    final var buffer = ByteBuffer.allocate(sizeOf(value));
    write(buffer, value);
    return buffer.array();
  }

  default T deserializeValue(byte[] payload) {
    return read(ByteBuffer.wrap(payload));
  }

  default boolean valuesEqual(T a, T b) {
    return Objects.equals(a, b);
  }

  default int valueHash(T value) {
    return Objects.hashCode(value);
  }

  default String valueToString(T value) {
    return String.valueOf(value);
  }

  /// Human readable type name used in messages.
  default String describe() {
    return kind().displayName();
  }

  static BooleanType bool() {
    return new BooleanType();
  }

  static IntegerType integer() {
    return new IntegerType(true, false, Optional.empty(), Optional.empty());
  }

  static IntegerType unsignedInteger() {
    return integer().unsigned();
  }

  static BytesType bytes() {
    return new BytesType(OptionalInt.empty());
  }

  static StringType string() {
    return new StringType(OptionalInt.empty());
  }

  static @NotNull <E> ListType<E> list(@NotNull FieldType<E> element) {
    return new ListType<>(element);
  }

  /// A nested record of an already built schema. Use [SchemaRegistry#reference(String)] for self references.
  static @NotNull RecordType record(@NotNull Schema schema) {
    return new RecordType(SchemaReference.of(schema));
  }

  private static void expectPresent(ByteBuffer payload, FieldKind kind) {
    if (!payload.hasRemaining()) {
      throw new ValidationException.TruncatedData(kind.displayName() + " payload is empty");
    }
    final byte marker = payload.get();
    if (marker != PRESENT) {
      throw new ValidationException.MalformedData(kind.displayName() + " payload starts with 0x" +
          HexFormat.of().toHexDigits(marker) + " instead of the presence byte 0x01");
    }
  }

  private static byte[] remainingBytes(ByteBuffer payload) {
    final var bytes = new byte[payload.remaining()];
    payload.get(bytes);
    return bytes;
  }

  record BooleanType() implements FieldType<Boolean> {
    @Override
    public FieldKind kind() {
      return FieldKind.BOOLEAN;
    }

    @Override
    public Boolean checkType(Object value) {
      if (value instanceof Boolean b) {
        return b;
      }
      throw ValidationException.TypeMismatch.of(value, describe());
    }

    @Override
    public void checkConstraints(Boolean value) {
    }

    @Override
    public int sizeOf(Boolean value) {
      return 1;
    }

    @Override
    public void write(ByteBuffer buffer, Boolean value) {
      buffer.put(value ? (byte) 0x01 : (byte) 0x00);
    }

    @Override
    public Boolean read(ByteBuffer payload) {
      if (payload.remaining() != 1) {
        throw new ValidationException.MalformedData("Boolean payload must be 1 byte but is " + payload.remaining());
      }
      final byte b = payload.get();
      if (b == 0x01) {
        return Boolean.TRUE;
      } else if (b == 0x00) {
        return Boolean.FALSE;
      }
      throw new ValidationException.MalformedData("Boolean payload 0x" + HexFormat.of().toHexDigits(b) +
          " is neither 0x00 nor 0x01");
    }
  }

  /// Arbitrary precision integers. Signed values use minimal two's complement, which puts a leading `0x00` in front
  /// of positive values whose bit length is a multiple of eight. Unsigned values use minimal magnitude bytes.
  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  record IntegerType(boolean signed, boolean nonNegative, Optional<BigInteger> min,
                     Optional<BigInteger> max) implements FieldType<BigInteger> {
    public IntegerType {
      Objects.requireNonNull(min, "min must not be null");
      Objects.requireNonNull(max, "max must not be null");
      if (min.isPresent() && max.isPresent() && min.get().compareTo(max.get()) > 0) {
        throw new IllegalArgumentException("min " + min.get() + " is greater than max " + max.get());
      }
    }

    public IntegerType unsigned() {
      return new IntegerType(false, nonNegative, min, max);
    }

    public IntegerType requireNonNegative() {
      return new IntegerType(signed, true, min, max);
    }

    public IntegerType min(long min) {
      return new IntegerType(signed, nonNegative, Optional.of(BigInteger.valueOf(min)), max);
    }

    public IntegerType max(long max) {
      return new IntegerType(signed, nonNegative, min, Optional.of(BigInteger.valueOf(max)));
    }

    @Override
    public FieldKind kind() {
      return FieldKind.INTEGER;
    }

    @Override
    public BigInteger checkType(Object value) {
      if (value instanceof BigInteger i) {
        return i;
      } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
        return BigInteger.valueOf(((Number) value).longValue());
      }
      throw ValidationException.TypeMismatch.of(value, describe());
    }

    @Override
    public void checkConstraints(BigInteger value) {
      if (value.signum() < 0) {
        if (!signed) {
          throw new ValidationException.ConstraintViolation("cannot be negative when unsigned");
        }
        if (nonNegative) {
          throw new ValidationException.ConstraintViolation("cannot be negative");
        }
      }
      min.filter(m -> value.compareTo(m) < 0).ifPresent(m -> {
        throw new ValidationException.ConstraintViolation("must be at least " + m);
      });
      max.filter(m -> value.compareTo(m) > 0).ifPresent(m -> {
        throw new ValidationException.ConstraintViolation("must be at most " + m);
      });
    }

    @Override
    public int sizeOf(BigInteger value) {
      if (signed) {
        return value.bitLength() / 8 + 1;
      }
      return Math.max((value.bitLength() + 7) >>> 3, 1);
    }

    @Override
    public void write(ByteBuffer buffer, BigInteger value) {
      final byte[] twosComplement = value.toByteArray();
      if (!signed && twosComplement.length > 1 && twosComplement[0] == 0) {
        buffer.put(twosComplement, 1, twosComplement.length - 1);
      } else {
        buffer.put(twosComplement);
      }
    }

    @Override
    public BigInteger read(ByteBuffer payload) {
      final byte[] bytes = remainingBytes(payload);
      if (bytes.length == 0) {
        throw new ValidationException.TruncatedData("Integer payload is empty");
      }
      return signed ? new BigInteger(bytes) : new BigInteger(1, bytes);
    }
  }

  record BytesType(OptionalInt maxLength) implements FieldType<byte[]> {
    public BytesType {
      Objects.requireNonNull(maxLength, "maxLength must not be null");
    }

    public BytesType maxLength(int maxLength) {
      if (maxLength < 0) {
        throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
      }
      return new BytesType(OptionalInt.of(maxLength));
    }

    @Override
    public FieldKind kind() {
      return FieldKind.BYTES;
    }

    @Override
    public byte[] checkType(Object value) {
      if (value instanceof byte[] bytes) {
        return bytes.clone();
      }
      throw ValidationException.TypeMismatch.of(value, describe());
    }

    @Override
    public void checkConstraints(byte[] value) {
      if (maxLength.isPresent() && value.length > maxLength.getAsInt()) {
        throw new ValidationException.TooLong("too long (" + value.length + " bytes, maximum " +
            maxLength.getAsInt() + ")");
      }
    }

    @Override
    public int sizeOf(byte[] value) {
      return 1 + value.length;
    }

    @Override
    public void write(ByteBuffer buffer, byte[] value) {
      buffer.put(PRESENT);
      buffer.put(value);
    }

    @Override
    public byte[] read(ByteBuffer payload) {
      expectPresent(payload, kind());
      return remainingBytes(payload);
    }

    @Override
    public boolean valuesEqual(byte[] a, byte[] b) {
      return Arrays.equals(a, b);
    }

    @Override
    public int valueHash(byte[] value) {
      return Arrays.hashCode(value);
    }

    @Override
    public String valueToString(byte[] value) {
      return value == null ? "null" : "0x" + HexFormat.of().formatHex(value);
    }
  }

  /// UTF-8 text. `maxLength` counts code points.
  record StringType(OptionalInt maxLength) implements FieldType<String> {
    public StringType {
      Objects.requireNonNull(maxLength, "maxLength must not be null");
    }

    public StringType maxLength(int maxLength) {
      if (maxLength < 0) {
        throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
      }
      return new StringType(OptionalInt.of(maxLength));
    }

    @Override
    public FieldKind kind() {
      return FieldKind.STRING;
    }

    @Override
    public String checkType(Object value) {
      if (value instanceof String s) {
        return s;
      }
      throw ValidationException.TypeMismatch.of(value, describe());
    }

    @Override
    public void checkConstraints(String value) {
      if (maxLength.isPresent()) {
        final int length = value.codePointCount(0, value.length());
        if (length > maxLength.getAsInt()) {
          throw new ValidationException.TooLong("too long (" + length + " characters, maximum " +
              maxLength.getAsInt() + ")");
        }
      }
    }

    @Override
    public int sizeOf(String value) {
      return 1 + value.getBytes(UTF_8).length;
    }

    @Override
    public void write(ByteBuffer buffer, String value) {
      buffer.put(PRESENT);
      buffer.put(value.getBytes(UTF_8));
    }

    @Override
    public String read(ByteBuffer payload) {
      expectPresent(payload, kind());
      try {
        return UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(payload)
            .toString();
      } catch (CharacterCodingException e) {
        throw new ValidationException.MalformedData("String payload is not valid UTF-8: " + e, e);
      }
    }

    @Override
    public String valueToString(String value) {
      return value == null ? "null" : '"' + value + '"';
    }
  }

  /// A homogeneous list. Its payload is the presence byte followed by one chunk per element.
  record ListType<E>(FieldType<E> element) implements FieldType<List<E>> {
    public ListType {
      Objects.requireNonNull(element, "element type must not be null");
    }

    @Override
    public FieldKind kind() {
      return FieldKind.LIST;
    }

    @Override
    public String describe() {
      return "List<" + element.describe() + ">";
    }

    @Override
    public List<E> checkType(Object value) {
      if (!(value instanceof List<?> list)) {
        throw ValidationException.TypeMismatch.of(value, describe());
      }
      final var checked = new ArrayList<E>(list.size());
      for (Object item : list) {
        if (item == null) {
          throw new ValidationException.MissingValue("cannot be absent").prependPath(INNER_ELEMENT);
        }
        try {
          checked.add(element.checkType(item));
        } catch (ValidationException e) {
          throw e.prependPath(INNER_ELEMENT);
        }
      }
      return Collections.unmodifiableList(checked);
    }

    @Override
    public void checkConstraints(List<E> value) {
      for (E item : value) {
        try {
          element.checkConstraints(item);
        } catch (ValidationException e) {
          throw e.prependPath(INNER_ELEMENT);
        }
      }
    }

    @Override
    public int sizeOf(List<E> value) {
      int size = 1;
      for (E item : value) {
        size += Chunks.sizeOf(element, item);
      }
      return size;
    }

    @Override
    public void write(ByteBuffer buffer, List<E> value) {
      buffer.put(PRESENT);
      for (E item : value) {
        Chunks.write(buffer, element, item);
      }
    }

    @Override
    public List<E> read(ByteBuffer payload) {
      return read(payload, CompatibilityMode.current());
    }

    @Override
    public List<E> read(ByteBuffer payload, CompatibilityMode compatibilityMode) {
      expectPresent(payload, kind());
      final var chunks = Chunks.split(payload);
      final var items = new ArrayList<E>(chunks.size());
      for (ByteBuffer chunk : chunks) {
        if (chunk == null) {
          items.add(null);
          continue;
        }
        try {
          items.add(element.read(chunk, compatibilityMode));
        } catch (ValidationException e) {
          throw e.prependPath(INNER_ELEMENT);
        }
      }
      LOGGER.finer(() -> "Read " + describe() + " of " + items.size() + " elements");
      return items;
    }

    @Override
    public boolean valuesEqual(List<E> a, List<E> b) {
      if (a == b) {
        return true;
      }
      if (a == null || b == null || a.size() != b.size()) {
        return false;
      }
      for (int i = 0; i < a.size(); i++) {
        if (!element.valuesEqual(a.get(i), b.get(i))) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int valueHash(List<E> value) {
      if (value == null) {
        return 0;
      }
      int hash = 1;
      for (E item : value) {
        hash = 31 * hash + element.valueHash(item);
      }
      return hash;
    }

    @Override
    public String valueToString(List<E> value) {
      if (value == null) {
        return "null";
      }
      return value.stream().map(element::valueToString).collect(Collectors.joining(", ", "[", "]"));
    }
  }

  /// A nested record. The payload is the complete wire value of the nested record.
  record RecordType(SchemaReference reference) implements FieldType<RecordInstance> {
    public RecordType {
      Objects.requireNonNull(reference, "reference must not be null");
    }

    @Override
    public FieldKind kind() {
      return FieldKind.RECORD;
    }

    @Override
    public String describe() {
      return reference.name();
    }

    @Override
    public RecordInstance checkType(Object value) {
      if (value instanceof RecordInstance instance) {
        if (instance.schema() == reference.resolve()) {
          return instance;
        }
        throw new ValidationException.TypeMismatch("is of type " + instance.schema().name() + ", expected " +
            reference.name());
      }
      throw ValidationException.TypeMismatch.of(value, describe());
    }

    @Override
    public void checkConstraints(RecordInstance value) {
    }

    @Override
    public int sizeOf(RecordInstance value) {
      return WireCodec.sizeOfRecord(value);
    }

    @Override
    public void write(ByteBuffer buffer, RecordInstance value) {
      WireCodec.writeRecord(buffer, value);
    }

    @Override
    public RecordInstance read(ByteBuffer payload) {
      return read(payload, CompatibilityMode.current());
    }

    @Override
    public RecordInstance read(ByteBuffer payload, CompatibilityMode compatibilityMode) {
      return WireCodec.readRecord(reference.resolve(), payload, compatibilityMode);
    }
  }
}
