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

/// Target interval of a continuous field's range scaling.
///
/// | Mode         | Interval | Forward map                   |
/// |--------------|----------|-------------------------------|
/// | ZERO_ONE     | [0, 1]   | (x - min) / (max - min)       |
/// | MINUSONE_ONE | [-1, 1]  | 2 (x - min) / (max - min) - 1 |
public enum Normalization {

    ZERO_ONE(0.0, 1.0),

    MINUSONE_ONE(-1.0, 1.0);

    private final double lower;
    private final double upper;

    Normalization(double lower, double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /// @return the lower end of the target interval
    public double lower() {
        return lower;
    }

    /// @return the upper end of the target interval
    public double upper() {
        return upper;
    }
}
