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

/// # Field codecs
///
/// Bidirectional, deterministic mappings between tabular column values and
/// fixed-width numeric vectors for a generative model.
///
/// ```
///   native value ──normalize──►  double[width]  ──denormalize──► native value
///                                     │
///                                 describe()
///                                     ▼
///                          List<OutputDescriptor>
/// ```
///
/// - [io.tabfields.codec.ContinuousField]: range scaling into [0, 1] or [-1, 1]
/// - [io.tabfields.codec.DiscreteField]: one-hot over an ordered vocabulary
/// - [io.tabfields.codec.BitField]: one two-way one-hot channel per bit
///
/// Callers supply ranges and vocabularies; nothing here inspects a dataset.
package io.tabfields.codec;
