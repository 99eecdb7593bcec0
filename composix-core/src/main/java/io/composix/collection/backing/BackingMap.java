/*
 * BackingMap.java
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

package io.composix.collection.backing;

import io.composix.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Minimal mutable map interface implemented both by wrappers of {@code java.util} maps and by holders of persistent
 * maps. Keys and values are never {@code null}.
 *
 * <p>
 * For a persistent implementation ({@link #isPersistent()}), {@link #copy()} takes constant time and the values are
 * shared between the copies. Callers that mutate values in place must copy them first.
 * </p>
 *
 * @param <K> key type
 * @param <V> value type
 */
@API(API.Status.INTERNAL)
public interface BackingMap<K, V> extends Iterable<Map.Entry<K, V>> {
    @Nullable
    V get(@Nonnull K key);

    default boolean containsKey(@Nonnull K key) {
        return get(key) != null;
    }

    void put(@Nonnull K key, @Nonnull V value);

    @Nullable
    V remove(@Nonnull K key);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Copy the map itself. The values are not copied.
     * @return a map holding the same entries
     */
    @Nonnull
    BackingMap<K, V> copy();

    boolean isPersistent();
}
