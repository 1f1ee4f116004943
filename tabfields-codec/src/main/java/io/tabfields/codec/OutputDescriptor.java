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

import io.tabfields.codec.errors.InvalidFieldConfigException;

import java.util.Optional;

/**
 * Describes one encoded channel of a field: its kind, how many numeric slots it
 * occupies, and for continuous channels the interval the values were scaled into.
 *
 * <p>Descriptors are produced by {@link Field#describe()} and consumed when the
 * model's output heads are sized. The normalization is present exactly when the
 * kind is {@link OutputKind#CONTINUOUS}.
 *
 * @param kind the channel kind
 * @param width number of numeric slots, always positive
 * @param normalization the scaling interval, or null for discrete channels
 */
public record OutputDescriptor(OutputKind kind, int width, Normalization normalization) {

    public OutputDescriptor {
        if (kind == null) {
            throw new InvalidFieldConfigException("Output kind cannot be null");
        }
        if (width <= 0) {
            throw new InvalidFieldConfigException("Output width must be positive: " + width);
        }
        if (kind == OutputKind.CONTINUOUS && normalization == null) {
            throw new InvalidFieldConfigException("Continuous outputs require a normalization");
        }
        if (kind == OutputKind.DISCRETE && normalization != null) {
            throw new InvalidFieldConfigException("Discrete outputs carry no normalization, got " + normalization);
        }
    }

    public static OutputDescriptor continuous(int width, Normalization normalization) {
        return new OutputDescriptor(OutputKind.CONTINUOUS, width, normalization);
    }

    public static OutputDescriptor discrete(int width) {
        return new OutputDescriptor(OutputKind.DISCRETE, width, null);
    }

    public Optional<Normalization> normalizationMode() {
        return Optional.ofNullable(normalization);
    }

    @Override
    public String toString() {
        return kind == OutputKind.CONTINUOUS
            ? "OutputDescriptor[" + kind + ", width=" + width + ", " + normalization + "]"
            : "OutputDescriptor[" + kind + ", width=" + width + "]";
    }
}
