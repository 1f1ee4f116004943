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

import java.util.List;

/// A named, immutable codec between one column's native values and a
/// fixed-width numeric encoding.
///
/// ## Contract
///
/// - [#normalize] maps a native value to exactly [#width] numeric slots
/// - [#denormalize] maps such slots back to a native value
/// - [#describe] lists the encoded channels in slot order; their widths sum to [#width]
///
/// ## Implementations
///
/// | Field             | Native type | Width        | Channels          |
/// |-------------------|-------------|--------------|-------------------|
/// | [ContinuousField] | double[]    | width        | 1 continuous      |
/// | [DiscreteField]   | T           | vocabulary   | 1 discrete        |
/// | [BitField]        | Long        | 2 × numBits  | numBits discrete  |
///
/// ## Thread Safety
///
/// Field configuration never changes after construction and every operation
/// allocates its own output, so instances may be shared freely across threads.
///
/// @param <V> the native value type
public interface Field<V> {

    /// @return the column identifier, not interpreted by the field itself
    String name();

    /// @return the number of numeric slots one encoded value occupies
    int width();

    /// Encodes a native value.
    ///
    /// @param value the native value
    /// @return a new array of [#width] slots
    double[] normalize(V value);

    /// Decodes an encoded value.
    ///
    /// @param encoded the encoded slots
    /// @return the native value
    V denormalize(double[] encoded);

    /// Describes the encoded channels in slot order.
    ///
    /// @return a new list of descriptors, never empty
    List<OutputDescriptor> describe();

    /// Converts a loosely typed value, as found in a row map, to this field's native type.
    ///
    /// @param raw the raw value
    /// @return the native value
    /// @throws io.tabfields.codec.errors.FieldValueException if the raw value cannot be converted
    V coerce(Object raw);
}
