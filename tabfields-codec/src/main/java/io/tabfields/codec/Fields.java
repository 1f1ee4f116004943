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

/// Shared checks and helpers for field implementations.
final class Fields {

    private Fields() {
        // Utility class
    }

    static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidFieldConfigException("Field name cannot be null or empty");
        }
        return name.trim();
    }

    /// Index of the largest value in `values[from, from + length)`, relative to `from`.
    /// Ties resolve to the lowest index. NaN entries are skipped; a slice of only
    /// NaN resolves to index 0.
    static int argmax(double[] values, int from, int length) {
        int best = 0;
        double bestValue = Double.NaN;
        for (int i = 0; i < length; i++) {
            double value = values[from + i];
            if (Double.isNaN(value)) {
                continue;
            }
            if (Double.isNaN(bestValue) || value > bestValue) {
                bestValue = value;
                best = i;
            }
        }
        return best;
    }
}
