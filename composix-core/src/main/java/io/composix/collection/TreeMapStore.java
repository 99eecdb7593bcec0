/*
 * TreeMapStore.java
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
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * {@link Store} over a {@link TreeMap}, iterating records in the order their keys were issued.
 *
 * @param <T> record type
 */
@API(API.Status.UNSTABLE)
public class TreeMapStore<T> implements Store<T> {
    @Nonnull
    private final NavigableMap<Key, T> records;

    public TreeMapStore() {
        this(new TreeMap<>());
    }

    private TreeMapStore(@Nonnull NavigableMap<Key, T> records) {
        this.records = records;
    }

    @Nullable
    @Override
    public T get(@Nonnull Key key) {
        return records.get(key);
    }

    @Nullable
    @Override
    public T put(@Nonnull Key key, @Nonnull T record) {
        return records.put(key, record);
    }

    @Nullable
    @Override
    public T remove(@Nonnull Key key) {
        return records.remove(key);
    }

    @Override
    public int size() {
        return records.size();
    }

    @Nonnull
    @Override
    public Iterator<Map.Entry<Key, T>> iterator() {
        return Collections.unmodifiableMap(records).entrySet().iterator();
    }

    @Nonnull
    @Override
    public TreeMapStore<T> copy() {
        return new TreeMapStore<>(new TreeMap<>(records));
    }

    @Nonnull
    @Override
    public StoreType getType() {
        return StoreType.ORDERED;
    }
}
