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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** For {@link Loggers} and {@link LodestoneLoggerImpl} testing. */
@ExtendWith(MockitoExtension.class)
public class LodestoneLoggerImplTest {
    @Mock
    private Logger delegate;

    @Test
    void testMessageFormattedWhenLevelEnabled() {
        when(delegate.isLoggable(Level.DEBUG)).thenReturn(true);

        LodestoneLogger log = new LodestoneLoggerImpl(delegate);

        log.debug("Falling back to column name [target={}]", "a");

        verify(delegate).log(Level.DEBUG, "Falling back to column name [target=a]");
    }

    @Test
    void testInfoLevel() {
        when(delegate.isLoggable(Level.INFO)).thenReturn(true);

        new LodestoneLoggerImpl(delegate).info("Started [name={}, count={}]", "t", 2);

        verify(delegate).log(Level.INFO, "Started [name=t, count=2]");
    }

    @Test
    void testNothingLoggedWhenLevelDisabled() {
        LodestoneLogger log = new LodestoneLoggerImpl(delegate);

        log.debug("Never {}", "formatted");
        log.info("Never {}", "formatted");

        verify(delegate, never()).log(any(Level.class), anyString());
        assertFalse(log.isDebugEnabled());
    }

    @Test
    void testDebugCheckDelegated() {
        when(delegate.isLoggable(Level.DEBUG)).thenReturn(true);

        assertTrue(new LodestoneLoggerImpl(delegate).isDebugEnabled());
    }

    @Test
    void testForClass() {
        assertNotNull(Loggers.forClass(LodestoneLoggerImplTest.class));

        assertThrows(NullPointerException.class, () -> Loggers.forClass(null));
    }
}
