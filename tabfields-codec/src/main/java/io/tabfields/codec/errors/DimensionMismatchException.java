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

/// Thrown when an input's trailing dimension does not match the declared width of a field.
public class DimensionMismatchException extends FieldCodecException {

    private final String fieldName;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String fieldName, int expected, int actual) {
        this(String.format("Field '%s': dimension is %d, expected dimension is %d", fieldName, actual, expected),
            fieldName, expected, actual);
    }

    public DimensionMismatchException(String message, String fieldName, int expected, int actual) {
        super(message);
        this.fieldName = fieldName;
        this.expected = expected;
        this.actual = actual;
    }

    public String getFieldName() {
        return fieldName;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
