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
import com.google.gson.GsonBuilder;

import java.time.Instant;

/// Centralized Gson configuration for divstats attribute and partition files.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled ([#gson()] only) | Human-readable attribute files |
/// | HTML escaping | Disabled | Keys and category values stay readable |
/// | Special floats | Serialized | Undefined statistics are `NaN` |
/// | [Instant] adapter | Registered | ISO-8601 datetime bounds |
/// | [SummaryEntryTypeAdapterFactory] | Registered | Polymorphic column summaries |
/// | [GlobalAttributesTypeAdapterFactory] | Registered | Attribute maps keyed by attribute name |
///
/// The [Gson] instances are thread-safe and shared.
public final class DivstatsGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private DivstatsGsonConfig() {
    }

    /// Returns the shared, pretty-printing Gson instance.
    ///
    /// @return the configured Gson
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns the shared single-line Gson instance.
    ///
    /// Used wherever the exact bytes matter, such as size estimation and key hashing.
    ///
    /// @return a compact Gson
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with divstats adapters registered and no pretty printing.
    ///
    /// @return a new builder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter().nullSafe())
            .registerTypeAdapterFactory(SummaryEntryTypeAdapterFactory.create())
            .registerTypeAdapterFactory(new GlobalAttributesTypeAdapterFactory());
    }
}
