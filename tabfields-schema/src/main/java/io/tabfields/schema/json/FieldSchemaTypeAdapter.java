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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.tabfields.codec.Field;
import io.tabfields.codec.errors.InvalidFieldConfigException;
import io.tabfields.schema.FieldSchema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Reads and writes a [FieldSchema] as `{"fields": [ ... ]}`, delegating each
/// entry to the polymorphic [Field] adapter.
final class FieldSchemaTypeAdapter extends TypeAdapter<FieldSchema> {

    private static final String FIELDS = "fields";

    static final TypeAdapterFactory FACTORY = new TypeAdapterFactory() {
        @Override
        @SuppressWarnings("unchecked")
        public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
            if (type.getRawType() != FieldSchema.class) {
                return null;
            }
            return (TypeAdapter<T>) new FieldSchemaTypeAdapter(gson);
        }
    };

    private final Gson gson;

    FieldSchemaTypeAdapter(Gson gson) {
        this.gson = gson;
    }

    @Override
    public void write(JsonWriter out, FieldSchema schema) throws IOException {
        if (schema == null) {
            out.nullValue();
            return;
        }
        TypeAdapter<Field> fieldAdapter = gson.getAdapter(Field.class);
        out.beginObject();
        out.name(FIELDS);
        out.beginArray();
        for (Field<?> field : schema.fields()) {
            fieldAdapter.write(out, field);
        }
        out.endArray();
        out.endObject();
    }

    @Override
    public FieldSchema read(JsonReader in) throws IOException {
        JsonElement element = JsonParser.parseReader(in);
        if (element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonObject()) {
            throw new InvalidFieldConfigException("Schema must be a JSON object: " + element);
        }
        JsonObject obj = element.getAsJsonObject();
        JsonElement entries = obj.get(FIELDS);
        if (entries == null || !entries.isJsonArray()) {
            throw new InvalidFieldConfigException("Schema needs a '" + FIELDS + "' array: " + obj);
        }

        TypeAdapter<Field> fieldAdapter = gson.getAdapter(Field.class);
        List<Field<?>> fields = new ArrayList<>();
        for (JsonElement entry : entries.getAsJsonArray()) {
            fields.add(fieldAdapter.fromJsonTree(entry));
        }
        return FieldSchema.of(fields);
    }
}
