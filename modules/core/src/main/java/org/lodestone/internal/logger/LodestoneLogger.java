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

package org.lodestone.internal.logger;

/**
 * Logger facade over {@link System.Logger}. Message patterns use {@code {}} anchors which are substituted only when the level is
 * enabled.
 */
public interface LodestoneLogger {
    /**
     * Logs a message on the {@code INFO} level.
     *
     * @param msg Message pattern.
     * @param params Values for the anchors.
     */
    void info(String msg, Object... params);

    /**
     * Logs a message on the {@code DEBUG} level.
     *
     * @param msg Message pattern.
     * @param params Values for the anchors.
     */
    void debug(String msg, Object... params);

    /** Checks whether messages of the {@code DEBUG} level are logged. */
    boolean isDebugEnabled();
}
