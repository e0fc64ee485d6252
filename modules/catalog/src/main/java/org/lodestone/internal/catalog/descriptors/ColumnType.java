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

/**
 * Types of table columns known to the catalog.
 */
public enum ColumnType {
    BOOLEAN(false),
    INT32(false),
    INT64(false),
    DOUBLE(false),
    DECIMAL(false),
    STRING(false),
    BYTE_ARRAY(false),
    UUID(false),
    TIMESTAMP(false),

    /** Ordered collection of values. */
    LIST(true),

    /** Collection of unique values. */
    SET(true),

    /** Collection of key-value entries. */
    MAP(true);

    private final boolean collection;

    ColumnType(boolean collection) {
        this.collection = collection;
    }

    /** Returns {@code true} if values of the type are collections, which may be indexed by keys, values or entries. */
    public boolean isCollection() {
        return collection;
    }
}
