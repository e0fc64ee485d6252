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

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Formats messages with {@code {}} placeholders, substituting the given parameters in order.
 *
 * <p>A placeholder preceded by a backslash is printed as is. Parameters without a matching placeholder are ignored, placeholders
 * without a matching parameter are printed as is. Arrays are rendered element by element.
 */
public final class LodestoneStringFormatter {
    private static final String PLACEHOLDER = "{}";

    private static final char ESCAPE_CHAR = '\\';

    private LodestoneStringFormatter() {
        // No-op.
    }

    /**
     * Substitutes parameters into the message pattern.
     *
     * @param messagePattern Message pattern with {@code {}} placeholders.
     * @param params Parameters to substitute.
     * @return Formatted message.
     */
    public static String format(@Nullable String messagePattern, @Nullable Object... params) {
        if (messagePattern == null) {
            return null;
        }

        if (params == null || params.length == 0) {
            return messagePattern;
        }

        StringBuilder sb = new StringBuilder(messagePattern.length() + 16 * params.length);

        int from = 0;
        int paramIdx = 0;

        while (paramIdx < params.length) {
            int idx = messagePattern.indexOf(PLACEHOLDER, from);

            if (idx == -1) {
                break;
            }

            if (idx > 0 && messagePattern.charAt(idx - 1) == ESCAPE_CHAR) {
                sb.append(messagePattern, from, idx - 1).append(PLACEHOLDER);
            } else {
                sb.append(messagePattern, from, idx);

                appendParameter(sb, params[paramIdx++]);
            }

            from = idx + PLACEHOLDER.length();
        }

        sb.append(messagePattern, from, messagePattern.length());

        return sb.toString();
    }

    private static void appendParameter(StringBuilder sb, @Nullable Object param) {
        if (param == null) {
            sb.append("null");
        } else if (param instanceof Object[]) {
            sb.append(Arrays.deepToString((Object[]) param));
        } else if (param instanceof int[]) {
            sb.append(Arrays.toString((int[]) param));
        } else if (param instanceof long[]) {
            sb.append(Arrays.toString((long[]) param));
        } else if (param instanceof byte[]) {
            sb.append(Arrays.toString((byte[]) param));
        } else {
            sb.append(param);
        }
    }
}
