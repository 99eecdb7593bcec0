/*
 * LogMessageKeys.java
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

package io.composix.collection.logging;

import io.composix.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Keys used in {@link KeyValueLogMessage}s and in the log info of Composix exceptions.
 * Keeping them in one place makes collisions and inconsistent spellings easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    TITLE("ttl"),
    // records and keys
    KEY,
    FIRST_KEY,
    NEXT_KEY,
    RECORD_COUNT("records"),
    // collection layout
    STORE_TYPE,
    INDEX_TYPE,
    SHALLOW_CLONEABLE,
    // mutations
    OPERATION,
    DELETED_COUNT("deleted"),
    UPDATED_COUNT("updated"),
    // grouping
    GROUP,
    GROUP_COUNT("groups"),
    // configuration
    PROPERTY_NAME,
    PROPERTY_VALUE;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
