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

/**
 * Base class for catalog objects which are identified both by id and by name.
 */
public abstract class CatalogObjectDescriptor {
    private final int id;

    private final String name;

    CatalogObjectDescriptor(int id, String name) {
        validateIdentifier(name, "Name of the catalog object");

        this.id = id;
        this.name = name;
    }

    /** Returns id of the described object. */
    public int id() {
        return id;
    }

    /** Returns name of the described object. */
    public String name() {
        return name;
    }
}
