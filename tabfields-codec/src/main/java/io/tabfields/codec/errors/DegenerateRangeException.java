package io.tabfields.codec.errors;

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

/// Thrown when a continuous field is configured with an empty range, where
/// scaling would divide by zero.
public class DegenerateRangeException extends InvalidFieldConfigException {

    private final double bound;

    public DegenerateRangeException(String fieldName, double bound) {
        super(String.format("Field '%s': min_value and max_value are both %s, range must be non-empty",
            fieldName, bound));
        this.bound = bound;
    }

    public double getBound() {
        return bound;
    }
}
