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

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Named, numbered collection of error codes of one component. A full error code keeps the group code in the upper 16 bits and the
 * error code in the lower 16 bits.
 */
public class ErrorGroup {
    /** Prefix of human-readable error codes, e.g. {@code LDS-IDX-4}. */
    public static final String ERR_PREFIX = "LDS";

    private final String groupName;

    private final short groupCode;

    private final Set<Short> codes = new HashSet<>();

    ErrorGroup(String groupName, short groupCode) {
        this.groupName = groupName;
        this.groupCode = groupCode;
    }

    /** Returns name of the group. */
    public String name() {
        return groupName;
    }

    /** Returns code of the group. */
    public short groupCode() {
        return groupCode;
    }

    /**
     * Registers an error code in this group.
     *
     * @param errorCode Error code, unique within the group.
     * @return Full error code.
     * @throws IllegalArgumentException If the code is already registered.
     */
    public synchronized int registerErrorCode(short errorCode) {
        if (!codes.add(errorCode)) {
            throw new IllegalArgumentException("Error code already registered [errorCode=" + errorCode + ", group=" + groupName + ']');
        }

        return (groupCode << 16) | (errorCode & 0xFFFF);
    }

    /**
     * Returns the error part of a full error code.
     *
     * @param code Full error code.
     * @return Error code within the group.
     */
    public static short extractErrorCode(int code) {
        return (short) (code & 0xFFFF);
    }

    /**
     * Renders an error message as {@code LDS-<group>-<code> <message> TraceId:<first 8 chars of the trace id>}.
     *
     * @param traceId Trace id of the error.
     * @param groupName Group name.
     * @param code Full error code.
     * @param message Message, may be {@code null} or empty.
     * @return Rendered message.
     */
    public static String errorMessage(UUID traceId, String groupName, int code, String message) {
        StringBuilder sb = new StringBuilder(ERR_PREFIX).append('-').append(groupName).append('-')
                .append(Short.toUnsignedInt(extractErrorCode(code)));

        if (message != null && !message.isEmpty()) {
            sb.append(' ').append(message);
        }

        return sb.append(" TraceId:").append(traceId.toString(), 0, 8).toString();
    }

    @Override
    public String toString() {
        return "ErrorGroup [name=" + groupName + ", groupCode=" + groupCode + ']';
    }
}
