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

/// Base type for every error raised by field encoding and decoding.
///
/// All subtypes describe programming or configuration faults rather than
/// transient conditions, so they are unchecked and never retried.
public class FieldCodecException extends RuntimeException {

    public FieldCodecException(String message) {
        super(message);
    }

    public FieldCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
