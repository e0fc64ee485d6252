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

package org.lodestone.internal.lang;

import static org.lodestone.lang.ErrorGroup.errorMessage;
import static org.lodestone.lang.ErrorGroup.extractErrorCode;
import static org.lodestone.lang.ErrorGroups.errorGroupByCode;
import static org.lodestone.lang.ErrorGroups.extractGroupCode;
import static org.lodestone.lang.util.TraceIdUtils.getOrCreateTraceId;

import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.lodestone.lang.TraceableException;

/**
 * Base class of internal errors. Carries a full error code (group code in the upper 16 bits, error code in the lower 16 bits) and a
 * trace id, which is taken from the cause when the cause has one so that a chain of wrapped errors shares a single id.
 */
public class LodestoneInternalException extends RuntimeException implements TraceableException {
    private static final long serialVersionUID = 0L;

    private final String groupName;

    private final int code;

    private final UUID traceId;

    /**
     * Creates an exception with a message and a cause.
     *
     * @param code Full error code.
     * @param message Detail message.
     * @param cause Cause, may be {@code null}.
     */
    public LodestoneInternalException(int code, String message, @Nullable Throwable cause) {
        super(message, cause);

        this.groupName = errorGroupByCode(code).name();
        this.code = code;
        this.traceId = getOrCreateTraceId(cause);
    }

    /**
     * Creates an exception with a message built from a pattern.
     *
     * @param code Full error code.
     * @param messagePattern Message pattern with {@code {}} anchors.
     * @param params Values for the anchors.
     * @see LodestoneStringFormatter#format(String, Object...)
     */
    public LodestoneInternalException(int code, String messagePattern, Object... params) {
        this(code, LodestoneStringFormatter.format(messagePattern, params), (Throwable) null);
    }

    /**
     * Creates an exception with a message built from a pattern and a cause.
     *
     * @param code Full error code.
     * @param messagePattern Message pattern with {@code {}} anchors.
     * @param cause Cause, may be {@code null}.
     * @param params Values for the anchors.
     * @see LodestoneStringFormatter#format(String, Object...)
     */
    public LodestoneInternalException(int code, String messagePattern, @Nullable Throwable cause, Object... params) {
        this(code, LodestoneStringFormatter.format(messagePattern, params), cause);
    }

    /** Returns name of the error group, e.g. {@code IDX}. */
    public String groupName() {
        return groupName;
    }

    @Override
    public int code() {
        return code;
    }

    @Override
    public short groupCode() {
        return extractGroupCode(code);
    }

    @Override
    public short errorCode() {
        return extractErrorCode(code);
    }

    @Override
    public UUID traceId() {
        return traceId;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + errorMessage(traceId, groupName, code, getLocalizedMessage());
    }
}
