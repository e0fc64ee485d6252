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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/** For {@link ByteArray} testing. */
public class ByteArrayTest {
    @Test
    void testEqualityByContent() {
        assertEquals(ByteArray.fromString("col"), new ByteArray(new byte[] {'c', 'o', 'l'}));
        assertEquals(ByteArray.fromString("col").hashCode(), ByteArray.fromString("col").hashCode());
        assertNotEquals(ByteArray.fromString("col"), ByteArray.fromString("COL"));
    }

    @Test
    void testUtf8Encoding() {
        assertEquals(5, ByteArray.fromString("été").bytes().length);
        assertEquals("été", ByteArray.fromString("été").toString());
    }

    @Test
    void testOrdering() {
        assertTrue(ByteArray.fromString("a").compareTo(ByteArray.fromString("b")) < 0);
        assertEquals(0, ByteArray.fromString("a").compareTo(ByteArray.fromString("a")));
    }
}
