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

import io.tabfields.codec.errors.DimensionMismatchException;
import io.tabfields.codec.errors.EncodingLengthException;
import io.tabfields.codec.errors.FieldValueException;
import io.tabfields.codec.errors.InvalidFieldConfigException;
import io.tabfields.codec.errors.ValueRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("BitField")
class BitFieldTest {

    @Test
    @DisplayName("should expand each bit into a one-hot pair, most significant first")
    void shouldEncodeBits() {
        BitField field = new BitField("flags", 4);

        assertThat(field.normalize(5)).containsExactly(1, 0, 0, 1, 1, 0, 0, 1);
        assertThat(field.normalize(0)).containsExactly(1, 0, 1, 0, 1, 0, 1, 0);
        assertThat(field.normalize(15)).containsExactly(0, 1, 0, 1, 0, 1, 0, 1);
        assertThat(field.width()).isEqualTo(8);
    }

    @Test
    @DisplayName("should decode bit pairs back to the integer")
    void shouldDecodeBits() {
        BitField field = new BitField("flags", 4);

        assertThat(field.denormalize(new double[]{1, 0, 0, 1, 1, 0, 0, 1})).isEqualTo(5L);
        assertThat(field.denormalize(new double[]{0.9, 0.1, 0.2, 0.8, 0.6, 0.4, 0.3, 0.7})).isEqualTo(5L);
        assertThat(field.denormalize(new double[]{0.5, 0.5, 0.5, 0.5, 0.5, 0.5, 0.5, 0.5})).isEqualTo(0L);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 8, 10})
    @DisplayName("should round trip every representable value")
    void shouldRoundTripAll(int numBits) {
        BitField field = new BitField("v", numBits);

        for (long d = 0; d < (1L << numBits); d++) {
            assertThat(field.denormalize(field.normalize(d))).isEqualTo(d);
        }
    }

    @Test
    @DisplayName("should round trip at the widest supported size")
    void shouldRoundTripWidest() {
        BitField field = new BitField("wide", BitField.MAX_BITS);

        assertThat(field.maxValue()).isEqualTo(Long.MAX_VALUE);
        assertThat(field.denormalize(field.normalize(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
        assertThat(field.denormalize(field.normalize(0x5A5A5A5AL))).isEqualTo(0x5A5A5A5AL);
    }

    @Test
    @DisplayName("should reject values needing more bits than configured")
    void shouldRejectOverflow() {
        BitField field = new BitField("v", 3);

        assertThatThrownBy(() -> field.normalize(8))
            .isInstanceOf(ValueRangeException.class)
            .hasMessageContaining("2^3");
        assertThatThrownBy(() -> field.normalize(-1))
            .isInstanceOf(ValueRangeException.class);
        assertThatThrownBy(() -> field.normalize((Long) null))
            .isInstanceOf(FieldValueException.class);
    }

    @Test
    @DisplayName("should reject encodings of the wrong length")
    void shouldRejectWrongLength() {
        BitField field = new BitField("v", 3);

        assertThatThrownBy(() -> field.denormalize(new double[]{1, 0, 1, 0}))
            .isInstanceOf(EncodingLengthException.class)
            .isInstanceOf(DimensionMismatchException.class)
            .hasMessageContaining("length 4, expected 6");
    }

    @Test
    @DisplayName("should reject unsupported bit counts")
    void shouldRejectBitCounts() {
        assertThatThrownBy(() -> new BitField("v", 0)).isInstanceOf(InvalidFieldConfigException.class);
        assertThatThrownBy(() -> new BitField("v", 64)).isInstanceOf(InvalidFieldConfigException.class);
    }

    @Test
    @DisplayName("should describe one binary discrete output per bit")
    void shouldDescribePerBit() {
        BitField field = new BitField("v", 4);

        assertThat(field.describe())
            .hasSize(4)
            .allSatisfy(d -> {
                assertThat(d.kind()).isEqualTo(OutputKind.DISCRETE);
                assertThat(d.width()).isEqualTo(2);
            });
        assertThat(field.channels()).extracting(DiscreteField::name)
            .containsExactly("v.bit0", "v.bit1", "v.bit2", "v.bit3");
    }

    @Test
    @DisplayName("should coerce integral numbers only")
    void shouldCoerceIntegrals() {
        BitField field = new BitField("v", 8);

        assertThat(field.coerce(7)).isEqualTo(7L);
        assertThat(field.coerce(7.0)).isEqualTo(7L);
        assertThatThrownBy(() -> field.coerce(7.5)).isInstanceOf(FieldValueException.class);
        assertThatThrownBy(() -> field.coerce("7")).isInstanceOf(FieldValueException.class);
    }

    @Test
    @DisplayName("should reject doubles beyond the long range")
    void shouldRejectSaturatingDoubles() {
        BitField field = new BitField("v", BitField.MAX_BITS);

        assertThatThrownBy(() -> field.coerce(0x1p63)).isInstanceOf(FieldValueException.class);
        assertThatThrownBy(() -> field.coerce(1e19)).isInstanceOf(FieldValueException.class);
        assertThat(field.coerce(0x1p62)).isEqualTo(1L << 62);
    }
}
