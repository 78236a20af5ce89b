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
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.nosqlbench.divstats.accumulate.PercentileTable;
import io.nosqlbench.divstats.attrs.GlobalAttributes;
import io.nosqlbench.divstats.attrs.SummaryEntry;
import io.nosqlbench.divstats.dataset.DatasetAttribute;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Writes [GlobalAttributes] as a JSON object keyed by attribute name.
///
/// Each known attribute is read back with its own value type; unknown names are
/// skipped so files written by newer versions stay readable. Opaque partition keys
/// are read as plain JSON values (strings, doubles, lists and maps).
final class GlobalAttributesTypeAdapterFactory implements TypeAdapterFactory {

    private static final Type KEYS_TYPE = new TypeToken<List<Object>>() { }.getType();
    private static final Type HASHES_TYPE = new TypeToken<List<String>>() { }.getType();
    private static final Type SUMMARY_TYPE = new TypeToken<LinkedHashMap<String, SummaryEntry>>() { }.getType();

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (type.getRawType() != GlobalAttributes.class) {
            return null;
        }
        return (TypeAdapter<T>) new TypeAdapter<GlobalAttributes>() {
            @Override
            public void write(JsonWriter out, GlobalAttributes value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                out.beginObject();
                for (Map.Entry<String, Object> entry : value.toAttributeMap().entrySet()) {
                    DatasetAttribute attribute = DatasetAttribute.fromName(entry.getKey()).orElseThrow();
                    out.name(entry.getKey());
                    gson.toJson(entry.getValue(), valueType(attribute), out);
                }
                out.endObject();
            }

            @Override
            public GlobalAttributes read(JsonReader in) throws IOException {
                if (in.peek() == JsonToken.NULL) {
                    in.nextNull();
                    return null;
                }
                Map<String, Object> attrs = new LinkedHashMap<>();
                in.beginObject();
                while (in.hasNext()) {
                    String name = in.nextName();
                    Optional<DatasetAttribute> attribute = DatasetAttribute.fromName(name);
                    if (attribute.isEmpty()) {
                        in.skipValue();
                        continue;
                    }
                    Object attrValue = gson.fromJson(in, valueType(attribute.get()));
                    if (attrValue != null) {
                        attrs.put(name, attrValue);
                    }
                }
                in.endObject();
                return GlobalAttributes.fromAttributeMap(attrs);
            }
        };
    }

    private static Type valueType(DatasetAttribute attribute) {
        switch (attribute) {
            case TOT_OBJECT_SIZE:
                return Double.class;
            case N_DIV:
            case N_ROW:
                return Long.class;
            case KEYS:
                return KEYS_TYPE;
            case KEY_HASHES:
                return HASHES_TYPE;
            case SPLIT_SIZE_DISTN:
            case SPLIT_ROW_DISTN:
                return PercentileTable.class;
            case SUMMARY:
                return SUMMARY_TYPE;
            default:
                throw new IllegalArgumentException("No value type for attribute " + attribute);
        }
    }
}
