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
import io.tabfields.codec.DiscreteField;
import io.tabfields.codec.Field;
import io.tabfields.codec.Normalization;
import io.tabfields.codec.OutputDescriptor;
import io.tabfields.codec.errors.DimensionMismatchException;
import io.tabfields.codec.errors.FieldValueException;
import io.tabfields.codec.errors.InvalidFieldConfigException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of uniquely named fields that together encode one table row.
 *
 * <h2>Layout</h2>
 *
 * <p>A row is encoded by concatenating every field's encoding in schema order:
 *
 * <pre>{@code
 *   duration (continuous, 1) | protocol (discrete, 3) | src_port (bit, 2 x 16)
 *   [ 0 ]                    | [ 1 .. 3 ]             | [ 4 .. 35 ]
 * }</pre>
 *
 * <p>{@link #describe()} returns the descriptors of all fields in the same order,
 * so the sum of their widths equals {@link #width()}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * FieldSchema schema = FieldSchema.builder()
 *     .continuous("duration", 0.0, 10.0, Normalization.ZERO_ONE)
 *     .discrete("protocol", List.of("TCP", "UDP", "ICMP"))
 *     .bit("src_port", 16)
 *     .build();
 *
 * double[] encoded = schema.normalizeRow(Map.of("duration", 2.5, "protocol", "UDP", "src_port", 443));
 * Map<String, Object> decoded = schema.denormalizeRow(encoded);
 * }</pre>
 *
 * <p>Schemas are immutable and safe to share across threads.
 */
public final class FieldSchema {

    private final List<Field<?>> fields;
    private final Map<String, Field<?>> byName;
    private final Map<String, Integer> offsets;
    private final int width;

    private FieldSchema(List<? extends Field<?>> fields) {
        Objects.requireNonNull(fields, "fields cannot be null");
        if (fields.isEmpty()) {
            throw new InvalidFieldConfigException("A schema needs at least one field");
        }
        Map<String, Field<?>> names = new LinkedHashMap<>();
        Map<String, Integer> starts = new LinkedHashMap<>();
        int offset = 0;
        for (Field<?> field : fields) {
            Objects.requireNonNull(field, "fields cannot contain null");
            if (names.putIfAbsent(field.name(), field) != null) {
                throw new InvalidFieldConfigException("Duplicate field name in schema: '" + field.name() + "'");
            }
            starts.put(field.name(), offset);
            offset += field.width();
        }
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.byName = Collections.unmodifiableMap(names);
        this.offsets = Collections.unmodifiableMap(starts);
        this.width = offset;
    }

    public static FieldSchema of(List<? extends Field<?>> fields) {
        return new FieldSchema(fields);
    }

    public static FieldSchema of(Field<?>... fields) {
        return new FieldSchema(Arrays.asList(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the fields in encoding order */
    public List<Field<?>> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    /** @return total slots of one encoded row */
    public int width() {
        return width;
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * @param name a field name
     * @return the field
     * @throws FieldValueException if no field has this name
     */
    public Field<?> field(String name) {
        Field<?> field = byName.get(name);
        if (field == null) {
            throw new FieldValueException("Unknown field '" + name + "', known fields: " + byName.keySet());
        }
        return field;
    }

    /**
     * @param name a field name
     * @return the first slot of the field within an encoded row
     * @throws FieldValueException if no field has this name
     */
    public int offsetOf(String name) {
        field(name);
        return offsets.get(name);
    }

    /** @return the output descriptors of every field, in encoding order */
    public List<OutputDescriptor> describe() {
        List<OutputDescriptor> outputs = new ArrayList<>();
        for (Field<?> field : fields) {
            outputs.addAll(field.describe());
        }
        return outputs;
    }

    /**
     * Encodes one row.
     *
     * @param row native values keyed by field name; extra keys are ignored
     * @return {@link #width()} slots
     * @throws FieldValueException if a field's column is missing or holds an unusable value
     */
    public double[] normalizeRow(Map<String, ?> row) {
        Objects.requireNonNull(row, "row cannot be null");
        double[] encoded = new double[width];
        for (Field<?> field : fields) {
            if (!row.containsKey(field.name())) {
                throw new FieldValueException("Row is missing column '" + field.name() + "'");
            }
            double[] part = encode(field, row.get(field.name()));
            System.arraycopy(part, 0, encoded, offsets.get(field.name()), part.length);
        }
        return encoded;
    }

    /**
     * Decodes one row.
     *
     * @param encoded exactly {@link #width()} slots
     * @return native values keyed by field name, in schema order
     * @throws DimensionMismatchException if the row length is not {@link #width()}
     */
    public Map<String, Object> denormalizeRow(double[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        if (encoded.length != width) {
            throw new DimensionMismatchException(
                String.format("Encoded row has %d slots, schema width is %d", encoded.length, width),
                null, width, encoded.length);
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (Field<?> field : fields) {
            int start = offsets.get(field.name());
            row.put(field.name(), field.denormalize(Arrays.copyOfRange(encoded, start, start + field.width())));
        }
        return row;
    }

    private static <V> double[] encode(Field<V> field, Object raw) {
        return field.normalize(field.coerce(raw));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSchema)) return false;
        return fields.equals(((FieldSchema) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FieldSchema[width=" + width + ", fields=" + byName.keySet() + "]";
    }

    /**
     * Fluent construction of a {@link FieldSchema}, in field order.
     */
    public static final class Builder {
        private final List<Field<?>> fields = new ArrayList<>();

        private Builder() {}

        public Builder add(Field<?> field) {
            fields.add(Objects.requireNonNull(field, "field cannot be null"));
            return this;
        }

        public Builder continuous(String name, double minValue, double maxValue, Normalization normalization) {
            return add(new ContinuousField(name, minValue, maxValue, normalization));
        }

        public Builder continuous(String name, double minValue, double maxValue, Normalization normalization,
                                  int width) {
            return add(new ContinuousField(name, minValue, maxValue, normalization, width));
        }

        public <T> Builder discrete(String name, List<T> vocabulary) {
            return add(new DiscreteField<>(name, vocabulary));
        }

        public Builder bit(String name, int numBits) {
            return add(new BitField(name, numBits));
        }

        public FieldSchema build() {
            return new FieldSchema(fields);
        }
    }
}
