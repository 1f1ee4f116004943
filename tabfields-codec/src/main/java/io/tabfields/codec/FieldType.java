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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name for a {@link Field} implementation.
 *
 * <p>The name appears as the {@code "type"} property of a field's JSON form and
 * selects the implementation when a schema file is read:
 *
 * <pre>{@code
 * {
 *   "type": "bit",
 *   "name": "src_port",
 *   "num_bits": 16
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FieldType {
    /**
     * The type name used in JSON serialization. Lowercase, unique across field types.
     *
     * @return the type discriminator string
     */
    String value();
}
