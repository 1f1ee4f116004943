package io.tabfields.codec;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.annotations.SerializedName;
import io.tabfields.codec.errors.EncodingLengthException;
import io.tabfields.codec.errors.FieldValueException;
import io.tabfields.codec.errors.InvalidFieldConfigException;
import io.tabfields.codec.errors.ValueRangeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Fixed-width integer codec that expands every bit into its own two-way one-hot channel.
///
/// ## Layout
///
/// A value in [0, 2^numBits) is written as a zero-padded binary string, most
/// significant bit first, and each bit becomes a pair of slots:
///
/// ```
///   numBits = 4, value = 5  ->  0 1 0 1
///
///   bit:     0       1       0       1
///   slots: [1, 0] [0, 1] [1, 0] [0, 1]
/// ```
///
/// Each pair is an independent binary [DiscreteField] over `[0, 1]`, so
/// [#describe()] reports `numBits` discrete descriptors of width 2 rather than
/// one fused channel. Decoding takes the arg-max of every pair, ties going to bit 0.
///
/// Values that need more than `numBits` bits are rejected with a
/// [ValueRangeException] instead of widening the encoding.
@FieldType(BitField.FIELD_TYPE)
public final class BitField implements Field<Long> {

    public static final String FIELD_TYPE = "bit";

    /// Largest supported width; values are non-negative longs.
    public static final int MAX_BITS = 63;

    private static final List<Integer> BINARY = List.of(0, 1);

    @SerializedName("name")
    private final String name;

    @SerializedName("num_bits")
    private final int numBits;

    private final transient List<DiscreteField<Integer>> channels;

    /// Creates a bit field.
    ///
    /// @param name the column name
    /// @param numBits number of binary digits, in [1, 63]
    /// @throws InvalidFieldConfigException if numBits is out of range
    public BitField(String name, int numBits) {
        this.name = Fields.requireName(name);
        if (numBits < 1 || numBits > MAX_BITS) {
            throw new InvalidFieldConfigException(String.format(
                "Field '%s': num_bits must be in [1, %d], got %d", this.name, MAX_BITS, numBits));
        }
        this.numBits = numBits;
        List<DiscreteField<Integer>> bits = new ArrayList<>(numBits);
        for (int i = 0; i < numBits; i++) {
            bits.add(new DiscreteField<>(this.name + ".bit" + i, BINARY));
        }
        this.channels = Collections.unmodifiableList(bits);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int width() {
        return 2 * numBits;
    }

    public int getNumBits() {
        return numBits;
    }

    /// @return the largest encodable value, `2^numBits - 1`
    public long maxValue() {
        return (1L << numBits) - 1;
    }

    /// @return the per-bit channels, most significant bit first
    public List<DiscreteField<Integer>> channels() {
        return channels;
    }

    /// Encodes a non-negative integer.
    ///
    /// @param value the value, in [0, 2^numBits)
    /// @return `2 * numBits` slots
    /// @throws ValueRangeException if the value is negative or needs more than numBits bits
    public double[] normalize(long value) {
        if (value < 0 || value > maxValue()) {
            throw new ValueRangeException(name, value, numBits);
        }
        double[] out = new double[width()];
        for (int i = 0; i < numBits; i++) {
            int bit = (int) ((value >>> (numBits - 1 - i)) & 1L);
            System.arraycopy(channels.get(i).normalize(bit), 0, out, 2 * i, 2);
        }
        return out;
    }

    @Override
    public double[] normalize(Long value) {
        if (value == null) {
            throw new FieldValueException("Field '" + name + "': cannot encode null");
        }
        return normalize(value.longValue());
    }

    /// Decodes a flat sequence of bit pairs.
    ///
    /// @param encoded exactly `2 * numBits` slots
    /// @return the decoded value
    /// @throws EncodingLengthException if the length is not `2 * numBits`
    @Override
    public Long denormalize(double[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        if (encoded.length != width()) {
            throw new EncodingLengthException(name, width(), encoded.length);
        }
        long value = 0L;
        for (int i = 0; i < numBits; i++) {
            int bit = channels.get(i).denormalize(new double[]{encoded[2 * i], encoded[2 * i + 1]});
            value = (value << 1) | bit;
        }
        return value;
    }

    @Override
    public List<OutputDescriptor> describe() {
        List<OutputDescriptor> outputs = new ArrayList<>(numBits);
        for (DiscreteField<Integer> channel : channels) {
            outputs.add(channel.descriptor());
        }
        return outputs;
    }

    /// Accepts any integral [Number]; fractional values are rejected.
    @Override
    public Long coerce(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number) {
            double asDouble = ((Number) raw).doubleValue();
            long asLong = (long) asDouble;
            // (long) saturates at Long.MAX_VALUE, so 2^63 and above would pass the equality check
            if (asDouble < 0x1p63 && asDouble == asLong) {
                return asLong;
            }
        }
        throw new FieldValueException(String.format("Field '%s': cannot encode %s as a %d-bit integer",
            name, raw, numBits));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BitField)) return false;
        BitField that = (BitField) o;
        return numBits == that.numBits && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, numBits);
    }

    @Override
    public String toString() {
        return "BitField[name=" + name + ", numBits=" + numBits + "]";
    }
}
