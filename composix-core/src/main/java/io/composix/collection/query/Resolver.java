/*
 * Resolver.java
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

package io.composix.collection.query;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import io.composix.annotation.API;
import io.composix.collection.Key;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the keys of a query result into records. A resolver is handed to the callback of
 * {@link io.composix.collection.Collection#query}, so that queries returning nested or mixed results can resolve
 * exactly the parts they need while keeping the shape of their answer.
 *
 * @param <T> record type
 */
@API(API.Status.STABLE)
public interface Resolver<T> {
    /**
     * Get the record for a key returned by an index.
     * @param key the key
     * @return the record
     * @throws io.composix.collection.IndexConsistencyException if the collection holds no record for the key
     */
    @Nonnull
    T get(@Nonnull Key key);

    @Nonnull
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    default Optional<T> get(@Nonnull Optional<Key> key) {
        return key.map(this::get);
    }

    /**
     * Get the records for every key of a result, in order, repeats included.
     * @param result the query result
     * @return the records
     */
    @Nonnull
    default List<T> getAll(@Nonnull QueryResult result) {
        final ImmutableList.Builder<T> records = ImmutableList.builder();
        result.forEachKey(key -> records.add(get(key)));
        return records.build();
    }

    @Nonnull
    default List<Map.Entry<Key, T>> getWithKeys(@Nonnull QueryResult result) {
        final ImmutableList.Builder<Map.Entry<Key, T>> records = ImmutableList.builder();
        result.forEachKey(key -> records.add(Maps.immutableEntry(key, get(key))));
        return records.build();
    }
}
