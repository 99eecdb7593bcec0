/*
 * HashTableIndex.java
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
import io.composix.collection.Key;
import io.composix.collection.Seal;
import io.composix.collection.backing.HashBackingMap;
import io.composix.collection.backing.KeySetMap;
import io.composix.collection.backing.PersistentHashBackingMap;
import io.composix.collection.keyset.KeySetFactory;
import io.composix.collection.query.DistinctKeys;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Index answering equality lookups on the value it sees. Values need consistent {@code equals} and
 * {@code hashCode}, and must not be {@code null}.
 *
 * @param <V> indexed value type
 */
@API(API.Status.STABLE)
public class HashTableIndex<V> implements Index<V> {
    @Nonnull
    private final KeySetMap<V> keysByValue;

    protected HashTableIndex(@Nonnull KeySetMap<V> keysByValue) {
        this.keysByValue = keysByValue;
    }

    @Nonnull
    public static <V> HashTableIndex<V> create() {
        return create(KeySetFactory.HASH);
    }

    @Nonnull
    public static <V> HashTableIndex<V> create(@Nonnull KeySetFactory keySets) {
        return new HashTableIndex<>(new KeySetMap<>(new HashBackingMap<>(), keySets));
    }

    /**
     * Create a hash table whose copies share structure.
     * @param <V> indexed value type
     * @return a new, empty index
     */
    @Nonnull
    public static <V> HashTableIndex<V> persistent() {
        return new HashTableIndex<>(new KeySetMap<>(new PersistentHashBackingMap<>(), KeySetFactory.PERSISTENT));
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<V> op) {
        keysByValue.add(op.getNewValue(), op.getKey());
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<V> op) {
        keysByValue.remove(op.getExistingValue(), op.getKey());
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<V> op) {
        if (!op.isUnchanged()) {
            Index.super.update(seal, op);
        }
    }

    /**
     * Get the key of some record with the given value.
     * @param value the value to look up
     * @return a matching key, or empty if no record has the value
     */
    @Nonnull
    public Optional<Key> getOne(@Nonnull V value) {
        return keysByValue.anyKey(value);
    }

    @Nonnull
    public DistinctKeys getAll(@Nonnull V value) {
        return keysByValue.keys(value);
    }

    public boolean contains(@Nonnull V value) {
        return keysByValue.contains(value);
    }

    /**
     * Count the distinct values currently indexed.
     * @return the number of distinct values
     */
    public int countDistinct() {
        return keysByValue.countDistinct();
    }

    @Nonnull
    public DistinctKeys all() {
        return keysByValue.allKeys();
    }

    @Nonnull
    @Override
    public HashTableIndex<V> copy() {
        return new HashTableIndex<>(keysByValue.copy());
    }

    @Override
    public boolean isShallowCloneable() {
        return keysByValue.isShallowCloneable();
    }
}
