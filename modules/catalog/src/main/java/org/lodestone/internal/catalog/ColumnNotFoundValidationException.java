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

package org.lodestone.internal.catalog;

/**
 * This exception is thrown when a column referenced by name is not found in the table.
 */
public class ColumnNotFoundValidationException extends CatalogValidationException {
    private static final long serialVersionUID = -3540473938460546125L;

    private final String columnName;

    /**
     * Constructor.
     *
     * @param tableName Name of the table that was searched.
     * @param columnName Name of the column that is missing.
     */
    public ColumnNotFoundValidationException(String tableName, String columnName) {
        super("Column '{}' not found in table '{}'", columnName, tableName);

        this.columnName = columnName;
    }

    /** Returns the name of the missing column. */
    public String columnName() {
        return columnName;
    }
}
