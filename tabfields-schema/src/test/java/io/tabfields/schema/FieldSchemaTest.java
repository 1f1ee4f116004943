package io.tabfields.schema;

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

import io.tabfields.codec.BitField;
import io.tabfields.codec.ContinuousField;
import io.tabfields.codec.Normalization;
import io.tabfields.codec.OutputDescriptor;
import io.tabfields.codec.OutputKind;
import io.tabfields.codec.errors.DimensionMismatchException;
import io.tabfields.codec.errors.FieldValueException;
import io.tabfields.codec.errors.InvalidFieldConfigException;
import io.tabfields.codec.errors.ValueRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("FieldSchema")
class FieldSchemaTest {

    static FieldSchema flowSchema() {
        return FieldSchema.builder()
            .continuous("duration", 0.0, 10.0, Normalization.ZERO_ONE)
            .discrete("protocol", List.of("TCP", "UDP", "ICMP"))
            .bit("src_port", 16)
            .continuous("position", -1.0, 1.0, Normalization.MINUSONE_ONE, 2)
            .build();
    }

    static Map<String, Object> flowRow(double duration, String protocol, long port) {
        Map<String, Object> row = new HashMap<>();
        row.put("duration", duration);
        row.put("protocol", protocol);
        row.put("src_port", port);
        row.put("position", new double[]{0.5, -0.5});
        return row;
    }

    @Nested
    @DisplayName("layout")
    class Layout {

        @Test
        @DisplayName("should sum field widths and place fields in order")
        void shouldComputeOffsets() {
            FieldSchema schema = flowSchema();

            assertThat(schema.size()).isEqualTo(4);
            assertThat(schema.width()).isEqualTo(1 + 3 + 32 + 2);
            assertThat(schema.offsetOf("duration")).isZero();
            assertThat(schema.offsetOf("protocol")).isEqualTo(1);
            assertThat(schema.offsetOf("src_port")).isEqualTo(4);
            assertThat(schema.offsetOf("position")).isEqualTo(36);
        }

        @Test
        @DisplayName("should describe every channel with widths summing to the schema width")
        void shouldDescribeAllChannels() {
            FieldSchema schema = flowSchema();
            List<OutputDescriptor> outputs = schema.describe();

            assertThat(outputs).hasSize(1 + 1 + 16 + 1);
            assertThat(outputs.stream().mapToInt(OutputDescriptor::width).sum()).isEqualTo(schema.width());
            assertThat(outputs.get(0)).isEqualTo(OutputDescriptor.continuous(1, Normalization.ZERO_ONE));
            assertThat(outputs.get(1)).isEqualTo(OutputDescriptor.discrete(3));
            assertThat(outputs.subList(2, 18)).allMatch(d -> d.kind() == OutputKind.DISCRETE && d.width() == 2);
        }

        @Test
        @DisplayName("should look fields up by name")
        void shouldLookUpFields() {
            FieldSchema schema = flowSchema();

            assertThat(schema.field("src_port")).isInstanceOf(BitField.class);
            assertThat(schema.contains("missing")).isFalse();
            assertThatThrownBy(() -> schema.field("missing"))
                .isInstanceOf(FieldValueException.class)
                .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("should reject duplicate names and empty schemas")
        void shouldRejectInvalidSchemas() {
            assertThatThrownBy(() -> FieldSchema.of(
                new BitField("a", 2), new ContinuousField("a", 0, 1, Normalization.ZERO_ONE)))
                .isInstanceOf(InvalidFieldConfigException.class)
                .hasMessageContaining("Duplicate");
            assertThatThrownBy(() -> FieldSchema.of(List.of()))
                .isInstanceOf(InvalidFieldConfigException.class);
        }
    }

    @Nested
    @DisplayName("rows")
    class Rows {

        @Test
        @DisplayName("should concatenate field encodings")
        void shouldEncodeRow() {
            double[] encoded = flowSchema().normalizeRow(flowRow(2.5, "UDP", 5));

            assertThat(encoded).hasSize(38);
            assertThat(encoded[0]).isEqualTo(0.25);
            assertThat(Arrays.copyOfRange(encoded, 1, 4)).containsExactly(0.0, 1.0, 0.0);
            assertThat(Arrays.copyOfRange(encoded, 28, 36)).containsExactly(1, 0, 0, 1, 1, 0, 0, 1);
        }

        @Test
        @DisplayName("should round trip a row")
        void shouldRoundTripRow() {
            FieldSchema schema = flowSchema();

            Map<String, Object> decoded = schema.denormalizeRow(schema.normalizeRow(flowRow(2.5, "ICMP", 443)));

            assertThat(decoded).containsOnlyKeys("duration", "protocol", "src_port", "position");
            assertThat(decoded.keySet()).containsExactly("duration", "protocol", "src_port", "position");
            assertThat((double[]) decoded.get("duration")).containsExactly(2.5);
            assertThat(decoded.get("protocol")).isEqualTo("ICMP");
            assertThat(decoded.get("src_port")).isEqualTo(443L);
            assertThat((double[]) decoded.get("position")).containsExactly(new double[]{0.5, -0.5}, within(1e-12));
        }

        @Test
        @DisplayName("should encode unknown categories as zeros within the row")
        void shouldEncodeUnknownCategory() {
            double[] encoded = flowSchema().normalizeRow(flowRow(1.0, "SCTP", 1));

            assertThat(Arrays.copyOfRange(encoded, 1, 4)).containsOnly(0.0);
        }

        @Test
        @DisplayName("should report missing columns and unusable values")
        void shouldRejectBadRows() {
            FieldSchema schema = flowSchema();
            Map<String, Object> missing = flowRow(1.0, "TCP", 1);
            missing.remove("src_port");
            Map<String, Object> wrongType = flowRow(1.0, "TCP", 1);
            wrongType.put("duration", "one");

            assertThatThrownBy(() -> schema.normalizeRow(missing))
                .isInstanceOf(FieldValueException.class)
                .hasMessageContaining("src_port");
            assertThatThrownBy(() -> schema.normalizeRow(wrongType))
                .isInstanceOf(FieldValueException.class);
            assertThatThrownBy(() -> schema.normalizeRow(flowRow(1.0, "TCP", 70_000)))
                .isInstanceOf(ValueRangeException.class);
        }

        @Test
        @DisplayName("should reject encoded rows of the wrong width")
        void shouldRejectWrongWidth() {
            assertThatThrownBy(() -> flowSchema().denormalizeRow(new double[10]))
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessageContaining("schema width is 38");
        }
    }
}
