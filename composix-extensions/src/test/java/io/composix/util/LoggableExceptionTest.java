/*
 * LoggableExceptionTest.java
 *
 * This source file is part of the Composix open source project
 *
 * Copyright 2026 the Composix project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.composix.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LoggableException}.
 */
class LoggableExceptionTest {

    @Test
    void noLogInfo() {
        LoggableException e = new LoggableException("nothing attached");
        assertTrue(e.getLogInfo().isEmpty());
        assertEquals(0, e.exportLogInfo().length);
    }

    @Test
    void constructorKeysAndValues() {
        LoggableException e = new LoggableException("missing record", "key", 10L, "index", "byName");
        assertEquals(Map.of("key", 10L, "index", "byName"), e.getLogInfo());
        assertEquals("missing record", e.getMessage());
    }

    @Test
    void causeIsKept() {
        IllegalStateException cause = new IllegalStateException("inner");
        LoggableException e = new LoggableException("outer", cause);
        assertSame(cause, e.getCause());
        assertTrue(e.getLogInfo().isEmpty());
    }

    @Test
    void exportFollowsFirstAttachment() {
        LoggableException e = new LoggableException("ordered", "b", 2)
                .addLogInfo("a", 1)
                .addLogInfo("b", 3);
        assertArrayEquals(new Object[] {"b", 3, "a", 1}, e.exportLogInfo());
    }

    @Test
    void keysBecomeStrings() {
        LoggableException e = new LoggableException("typed keys", 7, "seven");
        assertEquals("seven", e.getLogInfo().get("7"));
    }

    @Test
    void unbalancedKeyValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("unbalanced", "a"));
        LoggableException e = new LoggableException("unbalanced");
        assertThrows(IllegalArgumentException.class, () -> e.addLogInfo("a", 1, "b"));
        assertTrue(e.getLogInfo().isEmpty());
    }

    @Test
    void logInfoIsReadOnly() {
        LoggableException e = new LoggableException("read only", "k", "v");
        assertThrows(UnsupportedOperationException.class, () -> e.getLogInfo().put("x", "y"));
    }
}
