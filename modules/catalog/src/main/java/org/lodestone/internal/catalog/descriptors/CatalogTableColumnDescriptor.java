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

import static org.lodestone.internal.catalog.CatalogParamsValidationUtils.validateIdentifier;

import java.util.Objects;

/**
 * Table column descriptor. Instances are owned by {@link CatalogTableDescriptor}.
 */
public class CatalogTableColumnDescriptor {
    private final String name;

    private final ColumnType type;

    private final boolean nullable;

    /**
     * Constructor.
     *
     * @param name Column name.
     * @param type Column type.
     * @param nullable Whether the column accepts {@code null} values.
     */
    public CatalogTableColumnDescriptor(String name, ColumnType type, boolean nullable) {
        validateIdentifier(name, "Name of the column");

        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.nullable = nullable;
    }

    /** Returns name of the column. */
    public String name() {
        return name;
    }

    /** Returns type of the column. */
    public ColumnType type() {
        return type;
    }

    /** Returns {@code true} if the column accepts {@code null} values. */
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toString() {
        return "CatalogTableColumnDescriptor [name=" + name + ", type=" + type + ", nullable=" + nullable + ']';
    }
}
