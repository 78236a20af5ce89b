package io.nosqlbench.divstats.io;

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
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.divstats.attrs.CategoricalSummary;
import io.nosqlbench.divstats.attrs.DatetimeSummary;
import io.nosqlbench.divstats.attrs.NumericSummary;
import io.nosqlbench.divstats.attrs.SummaryEntry;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/// Gson [TypeAdapterFactory] for polymorphic [SummaryEntry] serialization.
///
/// Each entry is written with a leading `type` field naming its variant, followed by
/// the fields of the concrete class:
///
/// ```json
/// {"type":"numeric","stats":{"count":5,"mean":3.0,...},"min":1.0,"max":5.0,"naCount":0}
/// {"type":"categorical","freqTable":[{"value":"a","freq":2}],"complete":true,"naCount":1}
/// {"type":"datetime","min":"2024-01-01T00:00:00Z","max":"2024-02-01T00:00:00Z","naCount":0}
/// ```
///
/// Undefined statistics are written as `NaN`, so reading and writing go through
/// lenient streams.
public final class SummaryEntryTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends SummaryEntry>> typeToClass = new LinkedHashMap<>();
    private final Map<Class<? extends SummaryEntry>, String> classToType = new LinkedHashMap<>();

    private SummaryEntryTypeAdapterFactory() {
    }

    /// Creates a factory with every summary variant registered.
    ///
    /// @return the factory
    public static SummaryEntryTypeAdapterFactory create() {
        SummaryEntryTypeAdapterFactory factory = new SummaryEntryTypeAdapterFactory();
        factory.registerType("numeric", NumericSummary.class);
        factory.registerType("categorical", CategoricalSummary.class);
        factory.registerType("datetime", DatetimeSummary.class);
        return factory;
    }

    private void registerType(String typeName, Class<? extends SummaryEntry> entryClass) {
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException("Type '" + typeName + "' is already registered to "
                + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, entryClass);
        classToType.put(entryClass, typeName);
    }

    /// Returns the discriminator written for a summary class.
    ///
    /// @param entryClass the summary class
    /// @return the type name, or null if not registered
    public String getTypeName(Class<? extends SummaryEntry> entryClass) {
        return classToType.get(entryClass);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!SummaryEntry.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                String typeName = classToType.get(value.getClass());
                if (typeName == null) {
                    throw new JsonParseException("Unregistered summary class: " + value.getClass().getName());
                }
                TypeAdapter<T> delegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    SummaryEntryTypeAdapterFactory.this, TypeToken.get(value.getClass()));

                StringWriter buffer = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(buffer);
                lenientWriter.setLenient(true);
                delegate.write(lenientWriter, value);
                lenientWriter.close();

                JsonObject fields = JsonParser.parseString(buffer.toString()).getAsJsonObject();
                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }

                boolean wasLenient = out.isLenient();
                out.setLenient(true);
                try {
                    Streams.write(result, out);
                } finally {
                    out.setLenient(wasLenient);
                }
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                if (!element.isJsonObject()) {
                    throw new JsonParseException("Summary entry must be an object, got: " + element);
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in summary entry: " + obj);
                }
                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends SummaryEntry> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new JsonParseException("Unknown summary type: '" + typeName + "'. Known types: "
                        + typeToClass.keySet());
                }
                if (!type.getRawType().isAssignableFrom(targetClass)) {
                    throw new JsonParseException("Summary type '" + typeName + "' is not a "
                        + type.getRawType().getSimpleName());
                }
                obj.remove(TYPE_FIELD);

                TypeAdapter<? extends SummaryEntry> delegate =
                    gson.getDelegateAdapter(SummaryEntryTypeAdapterFactory.this, TypeToken.get(targetClass));
                JsonReader lenientReader = new JsonReader(new StringReader(obj.toString()));
                lenientReader.setLenient(true);
                return (T) delegate.read(lenientReader);
            }
        };
    }
}
