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

/// Thrown when an integer cannot be represented by a bit field of the configured width.
public class ValueRangeException extends FieldCodecException {

    private final long value;
    private final int numBits;

    public ValueRangeException(String fieldName, long value, int numBits) {
        super(String.format("Field '%s': value %d is outside [0, 2^%d)", fieldName, value, numBits));
        this.value = value;
        this.numBits = numBits;
    }

    public long getValue() {
        return value;
    }

    public int getNumBits() {
        return numBits;
    }
}
