package io.tabfields.schema.json;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.tabfields.schema.FieldSchema;

/// Centralized Gson configuration for field and schema serialization.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-editable schema files |
/// | HTML escaping | Disabled | Labels written as-is |
/// | Field adapter | Registered | Polymorphic field support |
/// | Schema adapter | Registered | Validated schema construction |
///
/// The returned [Gson] instances are thread-safe and can be shared.
///
/// @see FieldTypeAdapterFactory
/// @see FieldSchemaIO
public final class TabfieldsGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private TabfieldsGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a compact (non-pretty-printed) Gson instance, suited to one schema per line.
    ///
    /// @return a compact Gson instance
    public static Gson compactGson() {
        return builder().create();
    }

    /// Creates a new GsonBuilder with the field and schema adapters registered.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(FieldTypeAdapterFactory.create())
            .registerTypeAdapterFactory(FieldSchemaTypeAdapter.FACTORY);
    }
}
