/*
 * Store.java
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

package io.composix.collection;

import io.composix.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Where a {@link Collection} keeps its records, by key. Records are never {@code null}.
 *
 * @param <T> record type
 * @see StoreType
 */
@API(API.Status.UNSTABLE)
public interface Store<T> extends Iterable<Map.Entry<Key, T>> {
    @Nullable
    T get(@Nonnull Key key);

    /**
     * Get a record that an index says exists.
     * @param key the key
     * @return the record
     * @throws IndexConsistencyException if there is no record for the key
     */
    @Nonnull
    default T getExisting(@Nonnull Key key) {
        final T record = get(key);
        if (record == null) {
            throw IndexConsistencyException.missingRecord(key);
        }
        return record;
    }

    default boolean containsKey(@Nonnull Key key) {
        return get(key) != null;
    }

    /**
     * Store a record.
     * @param key the key
     * @param record the record
     * @return the record previously stored under the key, if any
     */
    @Nullable
    T put(@Nonnull Key key, @Nonnull T record);

    @Nullable
    T remove(@Nonnull Key key);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    default void forEach(@Nonnull BiConsumer<? super Key, ? super T> action) {
        for (Map.Entry<Key, T> entry : this) {
            action.accept(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Create a store holding the same records. The records themselves are shared, not copied.
     * @return the copy
     */
    @Nonnull
    Store<T> copy();

    default boolean isShallowCloneable() {
        return this instanceof ShallowClone;
    }

    @Nonnull
    StoreType getType();
}
