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

package org.lodestone.lang.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.lodestone.lang.TraceableException;

/**
 * Extracts a trace identifier from a {@link TraceableException} found in a cause chain or creates a new one.
 */
public class TraceIdUtils {
    /**
     * Returns trace identifier of the first {@link TraceableException} in the cause chain of the given throwable, or a new random
     * identifier if there is none.
     *
     * @param t Throwable to extract a trace identifier.
     * @return Trace identifier.
     */
    public static UUID getOrCreateTraceId(@Nullable Throwable t) {
        Throwable e = t;

        // Guards against cyclic cause chains.
        Set<Throwable> dejaVu = Collections.newSetFromMap(new IdentityHashMap<>());

        while (e != null) {
            if (e instanceof TraceableException) {
                return ((TraceableException) e).traceId();
            }
            if (!dejaVu.add(e)) {
                break;
            }
            e = e.getCause();
        }

        return UUID.randomUUID();
    }
}
