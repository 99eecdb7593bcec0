/*
 * LoggableException.java
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

import io.composix.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unchecked exception with {@code key=value} pairs attached to its message. Composix log lines have a fixed title
 * and a set of such pairs, so a handler logs {@link #getMessage()} as the title and {@link #exportLogInfo()} as the
 * pairs, and every occurrence of a failure can be found by its title and grouped by its keys.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException {
    // insertion ordered; a key given twice keeps its first position and its last value
    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with a message and alternating log keys and values.
     *
     * @param msg error message
     * @param keyValues alternating keys and values
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    public LoggableException(@Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    /**
     * Attach alternating keys and values. Keys are turned into strings.
     *
     * @param keyValues alternating keys and values, as {@link #exportLogInfo()} returns them
     * @return this exception
     * @throws IllegalArgumentException if {@code keyValues} has an odd number of elements
     */
    @Nonnull
    public LoggableException addLogInfo(@Nonnull Object ... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("log info needs a value for every key, got " + keyValues.length + " elements");
        }
        if (keyValues.length == 0) {
            return this;
        }
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            logInfo.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return this;
    }

    /**
     * The attached pairs.
     * @return a read-only view in the order the keys were first attached
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        return logInfo == null ? Collections.emptyMap() : Collections.unmodifiableMap(logInfo);
    }

    /**
     * The attached pairs as alternating keys and values, ready for a log message.
     * @return a new array
     */
    @Nonnull
    public Object[] exportLogInfo() {
        final Map<String, Object> info = getLogInfo();
        final Object[] keyValues = new Object[2 * info.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : info.entrySet()) {
            keyValues[i++] = entry.getKey();
            keyValues[i++] = entry.getValue();
        }
        return keyValues;
    }
}
