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
import io.tabfields.codec.errors.DegenerateRangeException;
import io.tabfields.codec.errors.DimensionMismatchException;
import io.tabfields.codec.errors.FieldValueException;
import io.tabfields.codec.errors.InvalidFieldConfigException;

import java.util.List;
import java.util.Objects;

/**
 * Affine range-scaling codec for real-valued vectors of a fixed width.
 *
 * <h2>Mapping</h2>
 *
 * <p>Each of the {@code width} channels is scaled independently from the native
 * interval [min, max] into the interval of the configured {@link Normalization}:
 * <pre>{@code
 * ZERO_ONE:      x' = (x - min) / (max - min)
 * MINUSONE_ONE:  x' = 2 (x - min) / (max - min) - 1
 * }</pre>
 *
 * <p>{@link #denormalize(double[])} applies the exact algebraic inverse, so for x in
 * [min, max] a round trip reproduces x up to floating-point rounding. Values outside
 * [min, max] are extrapolated linearly rather than clamped.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ContinuousField duration = new ContinuousField("duration", 0.0, 10.0, Normalization.ZERO_ONE);
 * duration.normalizeValue(2.5);   // 0.25
 * duration.denormalizeValue(0.25); // 2.5
 * }</pre>
 */
@FieldType(ContinuousField.FIELD_TYPE)
public final class ContinuousField implements Field<double[]> {

    public static final String FIELD_TYPE = "continuous";

    @SerializedName("name")
    private final String name;

    @SerializedName("min_value")
    private final double minValue;

    @SerializedName("max_value")
    private final double maxValue;

    @SerializedName("normalization")
    private final Normalization normalization;

    @SerializedName("width")
    private final int width;

    private final transient double range;

    /**
     * Creates a single-channel continuous field.
     *
     * @see #ContinuousField(String, double, double, Normalization, int)
     */
    public ContinuousField(String name, double minValue, double maxValue, Normalization normalization) {
        this(name, minValue, maxValue, normalization, 1);
    }

    /**
     * Creates a continuous field.
     *
     * @param name the column name
     * @param minValue lower bound of the native domain
     * @param maxValue upper bound of the native domain, greater than minValue
     * @param normalization the target interval
     * @param width number of channels encoded together
     * @throws DegenerateRangeException if minValue equals maxValue
     * @throws InvalidFieldConfigException for any other invalid parameter
     */
    public ContinuousField(String name, double minValue, double maxValue, Normalization normalization, int width) {
        this.name = Fields.requireName(name);
        if (!Double.isFinite(minValue) || !Double.isFinite(maxValue)) {
            throw new InvalidFieldConfigException(String.format(
                "Field '%s': bounds must be finite, got [%s, %s]", this.name, minValue, maxValue));
        }
        if (minValue == maxValue) {
            throw new DegenerateRangeException(this.name, minValue);
        }
        if (maxValue < minValue) {
            throw new InvalidFieldConfigException(String.format(
                "Field '%s': max_value %s must be greater than min_value %s", this.name, maxValue, minValue));
        }
        if (!Double.isFinite(maxValue - minValue)) {
            throw new InvalidFieldConfigException(String.format(
                "Field '%s': range [%s, %s] is too wide to scale", this.name, minValue, maxValue));
        }
        if (normalization == null) {
            throw new InvalidFieldConfigException("Field '" + this.name + "': normalization cannot be null");
        }
        if (width < 1) {
            throw new InvalidFieldConfigException("Field '" + this.name + "': width must be positive: " + width);
        }
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.normalization = normalization;
        this.width = width;
        this.range = maxValue - minValue;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int width() {
        return width;
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    @Override
    public double[] normalize(double[] x) {
        requireWidth(x);
        double[] out = new double[width];
        for (int i = 0; i < width; i++) {
            out[i] = scale(x[i]);
        }
        return out;
    }

    /**
     * Normalizes each row of a matrix whose trailing dimension is {@link #width()}.
     *
     * @param rows the native rows
     * @return a new matrix of normalized rows
     */
    public double[][] normalize(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        double[][] out = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            out[r] = normalize(rows[r]);
        }
        return out;
    }

    @Override
    public double[] denormalize(double[] y) {
        requireWidth(y);
        double[] out = new double[width];
        for (int i = 0; i < width; i++) {
            out[i] = unscale(y[i]);
        }
        return out;
    }

    /**
     * Denormalizes each row of a matrix whose trailing dimension is {@link #width()}.
     *
     * @param rows the normalized rows
     * @return a new matrix of native rows
     */
    public double[][] denormalize(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        double[][] out = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            out[r] = denormalize(rows[r]);
        }
        return out;
    }

    /**
     * Normalizes a single value of a one-channel field.
     *
     * @throws DimensionMismatchException if this field is wider than one channel
     */
    public double normalizeValue(double x) {
        requireScalar();
        return scale(x);
    }

    /**
     * Denormalizes a single value of a one-channel field.
     *
     * @throws DimensionMismatchException if this field is wider than one channel
     */
    public double denormalizeValue(double y) {
        requireScalar();
        return unscale(y);
    }

    /** @return a single continuous descriptor of this field's width */
    public OutputDescriptor descriptor() {
        return OutputDescriptor.continuous(width, normalization);
    }

    @Override
    public List<OutputDescriptor> describe() {
        return List.of(descriptor());
    }

    /**
     * Accepts a {@code double[]}, a {@code float[]}, or for one-channel fields a single {@link Number}.
     */
    @Override
    public double[] coerce(Object raw) {
        if (raw instanceof double[]) {
            return (double[]) raw;
        }
        if (raw instanceof float[]) {
            float[] floats = (float[]) raw;
            double[] values = new double[floats.length];
            for (int i = 0; i < floats.length; i++) {
                values[i] = floats[i];
            }
            return values;
        }
        if (raw instanceof Number && width == 1) {
            return new double[]{((Number) raw).doubleValue()};
        }
        throw new FieldValueException(String.format("Field '%s': cannot encode %s as %d continuous value(s)",
            name, raw == null ? "null" : raw.getClass().getSimpleName(), width));
    }

    private double scale(double x) {
        switch (normalization) {
            case ZERO_ONE:
                return (x - minValue) / range;
            case MINUSONE_ONE:
                return 2 * (x - minValue) / range - 1;
            default:
                throw new InvalidFieldConfigException("Not a valid normalization option: " + normalization);
        }
    }

    private double unscale(double y) {
        switch (normalization) {
            case ZERO_ONE:
                return y * range + minValue;
            case MINUSONE_ONE:
                return (y + 1) / 2.0 * range + minValue;
            default:
                throw new InvalidFieldConfigException("Not a valid normalization option: " + normalization);
        }
    }

    private void requireWidth(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length != width) {
            throw new DimensionMismatchException(name, width, values.length);
        }
    }

    private void requireScalar() {
        if (width != 1) {
            throw new DimensionMismatchException(name, width, 1);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContinuousField)) return false;
        ContinuousField that = (ContinuousField) o;
        return Double.compare(that.minValue, minValue) == 0 &&
               Double.compare(that.maxValue, maxValue) == 0 &&
               width == that.width &&
               normalization == that.normalization &&
               name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, minValue, maxValue, normalization, width);
    }

    @Override
    public String toString() {
        return "ContinuousField[name=" + name + ", min=" + minValue + ", max=" + maxValue +
               ", normalization=" + normalization + ", width=" + width + "]";
    }
}
