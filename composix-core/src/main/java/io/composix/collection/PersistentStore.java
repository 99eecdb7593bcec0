/*
 * PersistentStore.java
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

import clojure.lang.IPersistentMap;
import clojure.lang.PersistentHashMap;
import io.composix.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.Map;

/**
 * {@link Store} holding a Clojure {@link PersistentHashMap}. Copies take constant time and never observe each other's
 * changes.
 *
 * @param <T> record type
 */
@API(API.Status.UNSTABLE)
public class PersistentStore<T> implements Store<T>, ShallowClone {
    static {
        ClojureRuntime.load();
    }

    @Nonnull
    private IPersistentMap records;

    public PersistentStore() {
        this(PersistentHashMap.EMPTY);
    }

    private PersistentStore(@Nonnull IPersistentMap records) {
        this.records = records;
    }

    @Nullable
    @Override
    @SuppressWarnings("unchecked")
    public T get(@Nonnull Key key) {
        return (T)records.valAt(key);
    }

    @Nullable
    @Override
    public T put(@Nonnull Key key, @Nonnull T record) {
        final T existing = get(key);
        records = records.assoc(key, record);
        return existing;
    }

    @Nullable
    @Override
    public T remove(@Nonnull Key key) {
        final T existing = get(key);
        if (existing != null) {
            records = records.without(key);
        }
        return existing;
    }

    @Override
    public int size() {
        return records.count();
    }

    @Nonnull
    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Map.Entry<Key, T>> iterator() {
        return (Iterator<Map.Entry<Key, T>>)records.iterator();
    }

    @Nonnull
    @Override
    public PersistentStore<T> copy() {
        return new PersistentStore<>(records);
    }

    @Nonnull
    @Override
    public StoreType getType() {
        return StoreType.PERSISTENT;
    }
}
