/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lodestone.internal.catalog.descriptors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Secondary index descriptor. Apart from the identity of the index, it keeps the options the index was created with, including the
 * serialized index target.
 */
public class CatalogIndexDescriptor extends CatalogObjectDescriptor {
    /** Option holding the serialized index target. */
    public static final String TARGET_OPTION_NAME = "target";

    /** Option holding the implementation class of a custom index. */
    public static final String CUSTOM_INDEX_OPTION_NAME = "class_name";

    /** Legacy option marking an index over the keys of a collection column. */
    public static final String INDEX_KEYS_OPTION_NAME = "index_keys";

    /** Legacy option marking an index over the values of a collection column. */
    public static final String INDEX_VALUES_OPTION_NAME = "index_values";

    /** Legacy option marking an index over the entries of a map column. */
    public static final String INDEX_ENTRIES_OPTION_NAME = "index_keys_and_values";

    private final int tableId;

    private final Map<String, String> options;

    /**
     * Constructor.
     *
     * @param id Index id.
     * @param name Index name.
     * @param tableId Id of the indexed table.
     * @param options Index options.
     */
    public CatalogIndexDescriptor(int id, String name, int tableId, Map<String, String> options) {
        super(id, name);

        this.tableId = tableId;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(options, "options")));
    }

    /** Returns id of the indexed table. */
    public int tableId() {
        return tableId;
    }

    /** Returns all options of the index. */
    public Map<String, String> options() {
        return options;
    }

    /**
     * Returns a value of the option.
     *
     * @param name Option name.
     * @return Option value or {@code null} if the option is not set.
     */
    public @Nullable String option(String name) {
        return options.get(name);
    }

    /** Returns {@code true} if the index is backed by a custom implementation. */
    public boolean isCustom() {
        return options.containsKey(CUSTOM_INDEX_OPTION_NAME);
    }

    @Override
    public String toString() {
        return "CatalogIndexDescriptor [id=" + id() + ", name=" + name() + ", tableId=" + tableId + ", options=" + options + ']';
    }
}
