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

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toUnmodifiableMap;
import static org.lodestone.internal.catalog.CatalogParamsValidationUtils.validateUniqueNames;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.lodestone.internal.catalog.CatalogValidationException;
import org.lodestone.internal.lang.ByteArray;

/**
 * Table descriptor.
 *
 * <p>Columns are looked up by the UTF-8 encoded form of their names. The descriptor is immutable and may be read concurrently.
 */
public class CatalogTableDescriptor extends CatalogObjectDescriptor {
    private final List<CatalogTableColumnDescriptor> columns;

    private final Map<ByteArray, CatalogTableColumnDescriptor> columnsByName;

    /**
     * Constructor.
     *
     * @param id Table id.
     * @param name Table name.
     * @param columns Table columns, in definition order.
     * @throws CatalogValidationException If the columns list is empty or contains duplicate names.
     */
    public CatalogTableDescriptor(int id, String name, List<CatalogTableColumnDescriptor> columns) {
        super(id, name);

        Objects.requireNonNull(columns, "columns");

        if (columns.isEmpty()) {
            throw new CatalogValidationException("Table should have at least one column [table={}]", name);
        }

        validateUniqueNames(columns, CatalogTableColumnDescriptor::name, "Table '" + name + "'");

        this.columns = List.copyOf(columns);
        this.columnsByName = columns.stream().collect(toUnmodifiableMap(c -> ByteArray.fromString(c.name()), identity()));
    }

    /** Returns table columns in definition order. */
    public List<CatalogTableColumnDescriptor> columns() {
        return columns;
    }

    /**
     * Returns a column with the given name.
     *
     * @param name Column name.
     * @return Column descriptor or {@code null} if the table has no such column.
     */
    public @Nullable CatalogTableColumnDescriptor column(String name) {
        return columnsByName.get(ByteArray.fromString(name));
    }

    @Override
    public String toString() {
        return "CatalogTableDescriptor [id=" + id() + ", name=" + name() + ", columns=" + columns + ']';
    }
}
