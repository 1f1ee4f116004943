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
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.tabfields.codec.BitField;
import io.tabfields.codec.ContinuousField;
import io.tabfields.codec.DiscreteField;
import io.tabfields.codec.Field;
import io.tabfields.codec.FieldType;
import io.tabfields.codec.Normalization;
import io.tabfields.codec.errors.InvalidFieldConfigException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * GSON TypeAdapterFactory for polymorphic {@link Field} serialization.
 *
 * <h2>Architecture</h2>
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  BitField                               { "type": "bit", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Get @FieldType("bit")               1. Read "type" field
 *  2. Serialize declared properties       2. Lookup registered reader
 *  3. Put "type" field first              3. Read properties
 *        │                                4. Call the field's constructor
 *        ▼                                         │
 *  {                                               ▼
 *    "type": "bit",                       BitField
 *    "name": "src_port",
 *    "num_bits": 16
 *  }
 * }</pre>
 *
 * <p>Reading always goes through the public constructors, so a field read from
 * JSON is validated exactly like one built in code. Any structural problem in the
 * JSON is reported as an {@link InvalidFieldConfigException}.
 *
 * @see FieldType
 * @see TabfieldsGsonConfig
 */
public final class FieldTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<?>> typeToClass = new HashMap<>();
    private final Map<Class<?>, String> classToType = new HashMap<>();
    private final Map<String, Function<JsonObject, ? extends Field<?>>> readers = new HashMap<>();

    private FieldTypeAdapterFactory() {
    }

    /**
     * Creates a new factory with the standard field types registered.
     *
     * @return a configured factory
     */
    public static FieldTypeAdapterFactory create() {
        FieldTypeAdapterFactory factory = new FieldTypeAdapterFactory();
        factory.registerType(ContinuousField.class, FieldTypeAdapterFactory::readContinuous);
        factory.registerType(DiscreteField.class, FieldTypeAdapterFactory::readDiscrete);
        factory.registerType(BitField.class, FieldTypeAdapterFactory::readBit);
        return factory;
    }

    /**
     * Registers a field implementation with the reader that builds it from JSON.
     *
     * @param fieldClass the field class, annotated with {@link FieldType}
     * @param reader builds an instance from the JSON object, "type" included
     * @throws IllegalArgumentException if the class has no FieldType annotation
     *         or if the type name is already registered
     */
    public void registerType(Class<?> fieldClass, Function<JsonObject, ? extends Field<?>> reader) {
        if (!Field.class.isAssignableFrom(fieldClass)) {
            throw new IllegalArgumentException("Class " + fieldClass.getName() + " is not a Field");
        }
        FieldType annotation = fieldClass.getAnnotation(FieldType.class);
        if (annotation == null) {
            throw new IllegalArgumentException("Class " + fieldClass.getName() + " has no @FieldType annotation");
        }
        String typeName = annotation.value();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, fieldClass);
        classToType.put(fieldClass, typeName);
        readers.put(typeName, reader);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!Field.class.isAssignableFrom(type.getRawType())) {
            return null;
        }
        Class<? super T> requested = type.getRawType();

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                String typeName = classToType.get(value.getClass());
                if (typeName == null) {
                    throw new IllegalArgumentException("Unregistered field type: " + value.getClass().getName());
                }
                if (value instanceof DiscreteField) {
                    requireStringLabels((DiscreteField<?>) value);
                }

                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    FieldTypeAdapterFactory.this, TypeToken.get(value.getClass()));
                JsonObject properties = concreteDelegate.toJsonTree(value).getAsJsonObject();

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : properties.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }
                Streams.write(result, out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                if (!element.isJsonObject()) {
                    throw new InvalidFieldConfigException("Field definition must be a JSON object: " + element);
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new InvalidFieldConfigException("Missing '" + TYPE_FIELD + "' field in JSON: " + obj);
                }

                JsonElement type = obj.get(TYPE_FIELD);
                if (!type.isJsonPrimitive()) {
                    throw new InvalidFieldConfigException("Field '" + TYPE_FIELD + "' must be a string: " + obj);
                }
                String typeName = type.getAsString();
                Function<JsonObject, ? extends Field<?>> reader = readers.get(typeName);
                if (reader == null) {
                    throw new InvalidFieldConfigException(
                        "Unknown field type: '" + typeName + "'. Known types: " + typeToClass.keySet());
                }

                Field<?> field;
                try {
                    field = reader.apply(obj);
                } catch (IllegalStateException | UnsupportedOperationException | ClassCastException | NumberFormatException e) {
                    throw new InvalidFieldConfigException("Malformed '" + typeName + "' field: " + obj, e);
                }
                if (!requested.isInstance(field)) {
                    throw new InvalidFieldConfigException(
                        "Expected " + requested.getSimpleName() + " but JSON declares type '" + typeName + "'");
                }
                return (T) field;
            }
        };
    }

    /**
     * Returns the type name for a given field class.
     *
     * @param fieldClass the field class
     * @return the type name, or null if not registered
     */
    public String getTypeName(Class<?> fieldClass) {
        return classToType.get(fieldClass);
    }

    private static ContinuousField readContinuous(JsonObject obj) {
        String mode = requireMember(obj, "normalization").getAsString();
        Normalization normalization;
        try {
            normalization = Normalization.valueOf(mode);
        } catch (IllegalArgumentException e) {
            throw new InvalidFieldConfigException("Not a valid normalization option: '" + mode + "'", e);
        }
        int width = obj.has("width") ? obj.get("width").getAsInt() : 1;
        return new ContinuousField(
            requireMember(obj, "name").getAsString(),
            requireMember(obj, "min_value").getAsDouble(),
            requireMember(obj, "max_value").getAsDouble(),
            normalization,
            width);
    }

    private static DiscreteField<String> readDiscrete(JsonObject obj) {
        String name = requireMember(obj, "name").getAsString();
        JsonElement vocabulary = requireMember(obj, "vocabulary");
        if (!vocabulary.isJsonArray()) {
            throw new InvalidFieldConfigException("Field '" + name + "': vocabulary should be a list");
        }
        JsonArray labels = vocabulary.getAsJsonArray();
        List<String> values = new ArrayList<>(labels.size());
        for (JsonElement label : labels) {
            values.add(label.isJsonNull() ? null : label.getAsString());
        }
        return new DiscreteField<>(name, values);
    }

    /// Discrete vocabularies are read back as strings, so any other label type
    /// would not survive a round trip.
    private static void requireStringLabels(DiscreteField<?> field) {
        for (Object label : field.getVocabulary()) {
            if (!(label instanceof String)) {
                throw new InvalidFieldConfigException(String.format(
                    "Field '%s': only string labels can be written to JSON, got %s (%s)",
                    field.name(), label, label.getClass().getSimpleName()));
            }
        }
    }

    private static BitField readBit(JsonObject obj) {
        return new BitField(
            requireMember(obj, "name").getAsString(),
            requireMember(obj, "num_bits").getAsInt());
    }

    private static JsonElement requireMember(JsonObject obj, String member) {
        JsonElement value = obj.get(member);
        if (value == null || value.isJsonNull()) {
            throw new InvalidFieldConfigException(
                "Missing '" + member + "' in '" + obj.get(TYPE_FIELD).getAsString() + "' field: " + obj);
        }
        return value;
    }
}
