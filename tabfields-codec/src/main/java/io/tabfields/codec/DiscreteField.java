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
import io.tabfields.codec.errors.DimensionMismatchException;
import io.tabfields.codec.errors.InvalidFieldConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Categorical one-hot codec over a fixed, ordered vocabulary.
 *
 * <p>The vocabulary order fixes the column order of the encoding. For the
 * vocabulary {@code ["a", "b", "c"]}:
 * <pre>{@code
 * normalize("b")               -> [0, 1, 0]
 * normalizeAll(List.of("a","c")) -> [[1, 0, 0], [0, 0, 1]]
 * denormalize([0.1, 0.7, 0.2]) -> "b"
 * }</pre>
 *
 * <h2>Unknown categories</h2>
 *
 * <p>A value that is not in the vocabulary encodes to an all-zero row instead of
 * failing. Decoding always yields some vocabulary entry: the arg-max column, with
 * ties going to the lowest index, so an all-zero row decodes to the first entry.
 * Decoding is therefore not an inverse for unknown or noisy inputs.
 *
 * @param <T> the label type
 */
@FieldType(DiscreteField.FIELD_TYPE)
public final class DiscreteField<T> implements Field<T> {

    public static final String FIELD_TYPE = "discrete";

    @SerializedName("name")
    private final String name;

    @SerializedName("vocabulary")
    private final List<T> vocabulary;

    private final transient Map<T, Integer> columns;

    /**
     * Creates a discrete field.
     *
     * @param name the column name
     * @param vocabulary the ordered, distinct, non-null labels
     * @throws InvalidFieldConfigException if the vocabulary is null, empty, or has null or repeated labels
     */
    public DiscreteField(String name, List<T> vocabulary) {
        this.name = Fields.requireName(name);
        if (vocabulary == null) {
            throw new InvalidFieldConfigException("Field '" + this.name + "': vocabulary should be a list");
        }
        if (vocabulary.isEmpty()) {
            throw new InvalidFieldConfigException("Field '" + this.name + "': vocabulary cannot be empty");
        }
        Map<T, Integer> index = new HashMap<>();
        for (int i = 0; i < vocabulary.size(); i++) {
            T label = vocabulary.get(i);
            if (label == null) {
                throw new InvalidFieldConfigException("Field '" + this.name + "': vocabulary entry " + i + " is null");
            }
            Integer previous = index.putIfAbsent(label, i);
            if (previous != null) {
                throw new InvalidFieldConfigException(String.format(
                    "Field '%s': vocabulary label '%s' repeats at positions %d and %d", this.name, label, previous, i));
            }
        }
        this.vocabulary = Collections.unmodifiableList(new ArrayList<>(vocabulary));
        this.columns = Collections.unmodifiableMap(index);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int width() {
        return vocabulary.size();
    }

    /** @return the labels in column order */
    public List<T> getVocabulary() {
        return vocabulary;
    }

    /**
     * @param label a label
     * @return the column of the label, or -1 if it is not in the vocabulary
     */
    public int indexOf(T label) {
        if (label == null) {
            return -1;
        }
        Integer column = columns.get(label);
        return column == null ? -1 : column;
    }

    @Override
    public double[] normalize(T value) {
        double[] row = new double[vocabulary.size()];
        int column = indexOf(value);
        if (column >= 0) {
            row[column] = 1.0;
        }
        return row;
    }

    /**
     * One-hot encodes a sequence of labels.
     *
     * @param values the labels
     * @return one row per label
     */
    public double[][] normalizeAll(List<? extends T> values) {
        Objects.requireNonNull(values, "values cannot be null");
        double[][] rows = new double[values.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = normalize(values.get(i));
        }
        return rows;
    }

    /**
     * @throws DimensionMismatchException if the row length is not {@link #width()}
     */
    @Override
    public T denormalize(double[] row) {
        Objects.requireNonNull(row, "row cannot be null");
        if (row.length != vocabulary.size()) {
            throw new DimensionMismatchException(name, vocabulary.size(), row.length);
        }
        return vocabulary.get(Fields.argmax(row, 0, row.length));
    }

    /**
     * Decodes each row of a matrix of one-hot or score rows.
     *
     * @param rows the encoded rows
     * @return one label per row
     */
    public List<T> denormalizeAll(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        List<T> labels = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            labels.add(denormalize(row));
        }
        return labels;
    }

    /** @return a single discrete descriptor as wide as the vocabulary */
    public OutputDescriptor descriptor() {
        return OutputDescriptor.discrete(vocabulary.size());
    }

    @Override
    public List<OutputDescriptor> describe() {
        return List.of(descriptor());
    }

    /**
     * Passes the raw value through. A value of the wrong type is simply not in the
     * vocabulary and encodes to an all-zero row.
     */
    @Override
    @SuppressWarnings("unchecked")
    public T coerce(Object raw) {
        return (T) raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscreteField)) return false;
        DiscreteField<?> that = (DiscreteField<?>) o;
        return name.equals(that.name) && vocabulary.equals(that.vocabulary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, vocabulary);
    }

    @Override
    public String toString() {
        return "DiscreteField[name=" + name + ", vocabulary=" + vocabulary + "]";
    }
}
