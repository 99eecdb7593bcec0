/*
 * KeySetMap.java
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

import com.google.common.base.Preconditions;
import io.composix.annotation.API;
import io.composix.collection.IndexConsistencyException;
import io.composix.collection.Key;
import io.composix.collection.keyset.KeySet;
import io.composix.collection.keyset.KeySetFactory;
import io.composix.collection.keyset.KeySetView;
import io.composix.collection.query.DistinctKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each indexed value to the set of keys of the records that have it. This is the bookkeeping shared by every
 * leaf index; it works the same over mutable and persistent {@link BackingMap}s.
 *
 * <p>
 * A key set is created with the first key for its value and dropped with the last one, so every value in the map
 * has at least one key. When the backing map is persistent, key sets may be shared with copies of this map and are
 * therefore copied before being changed.
 * </p>
 *
 * @param <V> indexed value type
 */
@API(API.Status.INTERNAL)
public class KeySetMap<V> {
    @Nonnull
    private final BackingMap<V, KeySet> map;
    @Nonnull
    private final KeySetFactory keySets;

    public KeySetMap(@Nonnull BackingMap<V, KeySet> map, @Nonnull KeySetFactory keySets) {
        this.map = map;
        this.keySets = keySets;
    }

    public void add(@Nonnull V value, @Nonnull Key key) {
        Preconditions.checkNotNull(value, "indexed value must not be null");
        final KeySet existing = map.get(value);
        final KeySet keys = existing == null ? keySets.create() : writable(existing);
        keys.add(key);
        if (keys != existing) {
            map.put(value, keys);
        }
    }

    /**
     * Remove a key from the set of a value, dropping the value once no key is left.
     * @param value the indexed value
     * @param key the key of the record that had the value
     * @throws IndexConsistencyException if the key is not held for the value
     */
    public void remove(@Nonnull V value, @Nonnull Key key) {
        final KeySet existing = map.get(value);
        if (existing == null || !existing.contains(key)) {
            throw IndexConsistencyException.unknownRemoval(this, key);
        }
        if (existing.count() == 1) {
            map.remove(value);
            return;
        }
        final KeySet keys = writable(existing);
        keys.remove(key);
        if (keys != existing) {
            map.put(value, keys);
        }
    }

    @Nullable
    public KeySetView get(@Nonnull V value) {
        return map.get(value);
    }

    public boolean contains(@Nonnull V value) {
        return map.containsKey(value);
    }

    @Nonnull
    public DistinctKeys keys(@Nonnull V value) {
        final KeySet keys = map.get(value);
        return keys == null ? DistinctKeys.empty() : DistinctKeys.copyOf(keys);
    }

    @Nonnull
    public Optional<Key> anyKey(@Nonnull V value) {
        final KeySet keys = map.get(value);
        return keys == null ? Optional.empty() : Optional.of(keys.iterator().next());
    }

    /**
     * Get the keys held for any value.
     * @return every key in the map
     */
    @Nonnull
    public DistinctKeys allKeys() {
        final DistinctKeys.Builder builder = DistinctKeys.builder();
        for (Map.Entry<V, KeySet> entry : map) {
            builder.addAll(entry.getValue());
        }
        return builder.build();
    }

    public int countDistinct() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Create an independent copy. Constant time when the backing map is persistent; otherwise every key set is
     * copied as well.
     * @return the copy
     */
    @Nonnull
    public KeySetMap<V> copy() {
        return new KeySetMap<V>(deepCopy(map.copy(), map), keySets);
    }

    public boolean isShallowCloneable() {
        return map.isPersistent();
    }

    @Nonnull
    protected KeySetFactory getKeySets() {
        return keySets;
    }

    @Nonnull
    protected KeySet writable(@Nonnull KeySet keys) {
        return map.isPersistent() ? keys.copy() : keys;
    }

    @Nonnull
    protected static <V, M extends BackingMap<V, KeySet>> M deepCopy(@Nonnull M copy, @Nonnull BackingMap<V, KeySet> original) {
        if (!original.isPersistent()) {
            for (Map.Entry<V, KeySet> entry : original) {
                copy.put(entry.getKey(), entry.getValue().copy());
            }
        }
        return copy;
    }
}
