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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.lodestone.internal.lang.ByteArray;

/**
 * Utility class for validating catalog descriptor parameters.
 */
public class CatalogParamsValidationUtils {
    /**
     * Validates that given identifier string neither null nor blank.
     *
     * @param identifier Identifier to validate.
     * @param context Context to build message for exception in case validation fails.
     *      The message has the following format: `{context} can't be null or blank`.
     * @throws CatalogValidationException If the specified identifier does not meet the requirements.
     */
    public static void validateIdentifier(@Nullable String identifier, String context) throws CatalogValidationException {
        if (identifier == null || identifier.isBlank()) {
            throw new CatalogValidationException("{} can't be null or blank", context);
        }
    }

    /**
     * Validates that the given objects have distinct names. Names are compared by their UTF-8 encoded form.
     *
     * @param objects Objects to check.
     * @param nameExtractor Function returning a name of an object.
     * @param context Context to build message for exception in case validation fails.
     * @throws CatalogValidationException If some name occurs more than once.
     */
    public static <T> void validateUniqueNames(List<T> objects, Function<T, String> nameExtractor, String context) {
        Set<ByteArray> seen = new HashSet<>();

        for (T object : objects) {
            String name = nameExtractor.apply(object);

            if (!seen.add(ByteArray.fromString(name))) {
                throw new CatalogValidationException("{} contains duplicate name [name={}]", context, name);
            }
        }
    }
}
