package io.nosqlbench.divstats.plan;

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

import io.nosqlbench.divstats.dataset.DatasetAttribute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable map from attribute name to whether it must be computed in this run.
///
/// Only attributes that are both required and implemented appear in the map; an
/// attribute absent from the map is never computed.
public final class AttributeNeed {

    private final Map<String, Boolean> needs;

    private AttributeNeed(Map<String, Boolean> needs) {
        this.needs = needs;
    }

    /// Creates a need map.
    ///
    /// @param needs attribute name to "must be computed"; neither names nor flags may be null
    /// @return the need map
    public static AttributeNeed of(Map<String, Boolean> needs) {
        Objects.requireNonNull(needs, "needs cannot be null");
        Map<String, Boolean> copy = new LinkedHashMap<>();
        needs.forEach((name, needed) -> {
            if (name == null || needed == null) {
                throw new IllegalArgumentException("need map entries cannot be null, got: " + name + "=" + needed);
            }
            copy.put(name, needed);
        });
        return new AttributeNeed(Collections.unmodifiableMap(copy));
    }

    /// Creates a need map in which each given attribute must be computed.
    ///
    /// @param attributes the attributes to compute
    /// @return the need map
    public static AttributeNeed of(DatasetAttribute... attributes) {
        Map<String, Boolean> needs = new LinkedHashMap<>();
        for (DatasetAttribute attribute : attributes) {
            needs.put(attribute.attrName(), true);
        }
        return of(needs);
    }

    public boolean isNeeded(DatasetAttribute attribute) {
        return isNeeded(attribute.attrName());
    }

    public boolean isNeeded(String attrName) {
        return Boolean.TRUE.equals(needs.get(attrName));
    }

    /// Returns true if at least one attribute must be computed.
    ///
    /// @return true when work is needed
    public boolean anyNeeded() {
        return needs.containsValue(Boolean.TRUE);
    }

    /// Returns true if any row-data attribute (`nRow`, `splitRowDistn`, `summary`) is needed.
    ///
    /// @return true when partitions must be viewed as row data
    public boolean needsRowData() {
        for (DatasetAttribute attribute : DatasetAttribute.values()) {
            if (attribute.usesRowData() && isNeeded(attribute)) {
                return true;
            }
        }
        return false;
    }

    /// Returns the names of the attributes that must be computed.
    ///
    /// @return needed names in planning order
    public Set<String> neededNames() {
        Set<String> names = new LinkedHashSet<>();
        needs.forEach((name, needed) -> {
            if (Boolean.TRUE.equals(needed)) names.add(name);
        });
        return Collections.unmodifiableSet(names);
    }

    public Map<String, Boolean> asMap() {
        return needs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeNeed)) return false;
        return needs.equals(((AttributeNeed) o).needs);
    }

    @Override
    public int hashCode() {
        return needs.hashCode();
    }

    @Override
    public String toString() {
        return "AttributeNeed" + needs;
    }
}
