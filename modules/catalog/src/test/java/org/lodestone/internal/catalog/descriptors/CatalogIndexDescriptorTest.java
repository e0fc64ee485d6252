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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.lodestone.internal.catalog.descriptors.CatalogIndexDescriptor.CUSTOM_INDEX_OPTION_NAME;
import static org.lodestone.internal.catalog.descriptors.CatalogIndexDescriptor.TARGET_OPTION_NAME;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.lodestone.internal.testframework.BaseLodestoneAbstractTest;

/** For {@link CatalogIndexDescriptor} testing. */
public class CatalogIndexDescriptorTest extends BaseLodestoneAbstractTest {
    @Test
    void testOptions() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put(TARGET_OPTION_NAME, "keys(tags)");
        options.put("extra", "1");

        CatalogIndexDescriptor index = new CatalogIndexDescriptor(10, "tags_idx", 1, options);

        options.put("late", "ignored");

        assertThat(index.option(TARGET_OPTION_NAME), is("keys(tags)"));
        assertThat(index.option("late"), nullValue());
        assertThat(index.options().keySet(), contains(TARGET_OPTION_NAME, "extra"));
        assertThat(index.tableId(), is(1));
        assertThat(index.isCustom(), is(false));

        assertThrows(UnsupportedOperationException.class, () -> index.options().put("x", "y"));
    }

    @Test
    void testCustomIndex() {
        CatalogIndexDescriptor index = new CatalogIndexDescriptor(
                11, "custom_idx", 1, Map.of(TARGET_OPTION_NAME, "v", CUSTOM_INDEX_OPTION_NAME, "org.example.VectorIndex"));

        assertThat(index.isCustom(), is(true));
    }
}
