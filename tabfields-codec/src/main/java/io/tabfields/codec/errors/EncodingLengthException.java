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

/// Thrown when a flat bit encoding does not have exactly two slots per bit.
public class EncodingLengthException extends DimensionMismatchException {

    public EncodingLengthException(String fieldName, int expected, int actual) {
        super(String.format("Field '%s': bit encoding has length %d, expected %d", fieldName, actual, expected),
            fieldName, expected, actual);
    }
}
