/*
 * KeysIndex.java
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

package io.composix.collection.index;

import io.composix.annotation.API;
import io.composix.collection.IndexConsistencyException;
import io.composix.collection.Key;
import io.composix.collection.Seal;
import io.composix.collection.keyset.KeySet;
import io.composix.collection.keyset.KeySetFactory;
import io.composix.collection.query.DistinctKeys;

import javax.annotation.Nonnull;

/**
 * Index holding just the keys of the records it has seen. Mostly useful inside a {@link GroupedIndex}, to list the
 * members of each group.
 *
 * @param <T> record type, ignored
 */
@API(API.Status.STABLE)
public class KeysIndex<T> implements Index<T> {
    @Nonnull
    private final KeySet keys;

    protected KeysIndex(@Nonnull KeySet keys) {
        this.keys = keys;
    }

    @Nonnull
    public static <T> KeysIndex<T> create() {
        return create(KeySetFactory.HASH);
    }

    @Nonnull
    public static <T> KeysIndex<T> create(@Nonnull KeySetFactory keySets) {
        return new KeysIndex<>(keySets.create());
    }

    @Nonnull
    public static <T> KeysIndex<T> persistent() {
        return create(KeySetFactory.PERSISTENT);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        keys.add(op.getKey());
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        if (!keys.remove(op.getKey())) {
            throw IndexConsistencyException.unknownRemoval(this, op.getKey());
        }
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        // the key stays the same
    }

    @Nonnull
    public DistinctKeys all() {
        return DistinctKeys.copyOf(keys);
    }

    public boolean contains(@Nonnull Key key) {
        return keys.contains(key);
    }

    public int count() {
        return keys.count();
    }

    @Nonnull
    @Override
    public KeysIndex<T> copy() {
        return new KeysIndex<>(keys.copy());
    }

    @Override
    public boolean isShallowCloneable() {
        return keys.isShallowCloneable();
    }
}
