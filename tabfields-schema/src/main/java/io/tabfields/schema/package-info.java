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

/**
 * Row-level encoding on top of the field codecs.
 *
 * <ul>
 *   <li>{@link io.tabfields.schema.FieldSchema} - ordered, uniquely named fields forming one encoded row</li>
 *   <li>{@link io.tabfields.schema.BatchNormalizer} - parallel encoding and decoding of many rows</li>
 *   <li>{@code io.tabfields.schema.json} - Gson configuration and schema files</li>
 * </ul>
 */
package io.tabfields.schema;
