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

package org.lodestone.lang;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.Locale;

/**
 * Error groups of the project and the error codes registered in them. A group is registered when its holder class is initialized,
 * which happens the first time one of its codes is read.
 */
@SuppressWarnings("PublicInnerClass")
public class ErrorGroups {
    /** Registered groups by group code. */
    private static final Int2ObjectMap<ErrorGroup> registeredGroups = new Int2ObjectOpenHashMap<>();

    /**
     * Registers a new error group.
     *
     * @param groupName Group name, stored in upper case.
     * @param groupCode Group code.
     * @return Registered group.
     * @throws IllegalArgumentException If the name is empty, or the name or the code is taken by another group.
     */
    public static synchronized ErrorGroup registerGroup(String groupName, short groupCode) {
        if (groupName == null || groupName.isEmpty()) {
            throw new IllegalArgumentException("Group name is null or empty");
        }

        String name = groupName.toUpperCase(Locale.ENGLISH);

        ErrorGroup existing = registeredGroups.get(groupCode);

        if (existing == null) {
            for (ErrorGroup group : registeredGroups.values()) {
                if (group.name().equals(name)) {
                    existing = group;

                    break;
                }
            }
        }

        if (existing != null) {
            throw new IllegalArgumentException(
                    "Error group already registered [groupName=" + name + ", groupCode=" + groupCode + ", registeredGroup=" + existing + ']');
        }

        ErrorGroup group = new ErrorGroup(name, groupCode);

        registeredGroups.put(groupCode, group);

        return group;
    }

    /**
     * Returns the group part of a full error code.
     *
     * @param code Full error code.
     * @return Group code.
     */
    public static short extractGroupCode(int code) {
        return (short) (code >>> 16);
    }

    /**
     * Returns the group a full error code belongs to.
     *
     * @param code Full error code.
     * @return Error group.
     */
    public static synchronized ErrorGroup errorGroupByCode(int code) {
        ErrorGroup group = registeredGroups.get(extractGroupCode(code));

        assert group != null : "Unknown error group [code=" + code + ']';

        return group;
    }

    /** Common error group. */
    public static class Common {
        /** Common error group. */
        public static final ErrorGroup COMMON_ERR_GROUP = registerGroup("CMN", (short) 1);

        /** Internal error caused by faulty logic, not by user input. */
        public static final int INTERNAL_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 0xFFFF);
    }

    /** Index error group. */
    public static class Index {
        /** Index error group. */
        public static final ErrorGroup INDEX_ERR_GROUP = registerGroup("IDX", (short) 6);

        /** Index definition can not be used, see the cause for details. */
        public static final int INVALID_INDEX_DEFINITION_ERR = INDEX_ERR_GROUP.registerErrorCode((short) 1);

        /** Index target descriptor has a shape that can not be decoded. */
        public static final int INVALID_INDEX_TARGET_ERR = INDEX_ERR_GROUP.registerErrorCode((short) 4);
    }

    /** Catalog error group. */
    public static class Catalog {
        /** Catalog error group. */
        public static final ErrorGroup CATALOG_ERR_GROUP = registerGroup("CATALOG", (short) 17);

        /** Catalog object has not passed the validation. */
        public static final int VALIDATION_ERR = CATALOG_ERR_GROUP.registerErrorCode((short) 1);
    }
}
