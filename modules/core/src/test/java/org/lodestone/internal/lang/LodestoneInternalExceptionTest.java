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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.lodestone.lang.ErrorGroups.Common.INTERNAL_ERR;

import org.junit.jupiter.api.Test;
import org.lodestone.lang.ErrorGroups.Catalog;
import org.lodestone.lang.ErrorGroups.Index;

/**
 * Tests for {@link LodestoneInternalException}.
 */
public class LodestoneInternalExceptionTest {
    @Test
    public void testCodeParts() {
        var ex = new LodestoneInternalException(Index.INVALID_INDEX_TARGET_ERR, "Bad target");

        assertEquals(Index.INVALID_INDEX_TARGET_ERR, ex.code());
        assertEquals(Index.INDEX_ERR_GROUP.groupCode(), ex.groupCode());
        assertEquals((short) 4, ex.errorCode());
        assertEquals("IDX", ex.groupName());
    }

    @Test
    public void testToString() {
        var ex = new LodestoneInternalException(Catalog.VALIDATION_ERR, "Column not found", (Throwable) null);

        assertEquals(
                LodestoneInternalException.class.getName() + ": LDS-CATALOG-1 Column not found TraceId:"
                        + ex.traceId().toString().substring(0, 8),
                ex.toString()
        );
    }

    @Test
    public void testTraceIdInheritedFromCause() {
        var cause = new LodestoneInternalException(INTERNAL_ERR, "Unexpected error.");
        var ex = new LodestoneInternalException(Index.INVALID_INDEX_DEFINITION_ERR, "Wrapped", cause);

        assertEquals(cause.traceId(), ex.traceId());
        assertSame(cause, ex.getCause());
    }

    @Test
    public void testMessagePattern() {
        var ex = new LodestoneInternalException(Index.INVALID_INDEX_DEFINITION_ERR, "Index {} is broken ({})", "idx", "a");

        assertThat(ex.getMessage(), is("Index idx is broken (a)"));
        assertThat(ex.toString(), startsWith(LodestoneInternalException.class.getName() + ": LDS-IDX-1 Index idx is broken (a)"));
    }

    @Test
    public void testMessagePatternWithCause() {
        var cause = new IllegalStateException("boom");
        var ex = new LodestoneInternalException(Index.INVALID_INDEX_DEFINITION_ERR, "Index {} is broken", cause, "idx");

        assertThat(ex.getMessage(), is("Index idx is broken"));
        assertSame(cause, ex.getCause());
    }

    @Test
    public void testNewTraceIdWithoutTraceableCause() {
        var first = new LodestoneInternalException(INTERNAL_ERR, "First");
        var second = new LodestoneInternalException(INTERNAL_ERR, "Second", new IllegalStateException("boom"));

        assertNotEquals(first.traceId(), second.traceId());
    }
}
