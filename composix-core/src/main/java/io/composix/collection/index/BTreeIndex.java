/*
 * BTreeIndex.java
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

import com.google.common.collect.Range;
import io.composix.annotation.API;
import io.composix.collection.CollectionArgumentException;
import io.composix.collection.Key;
import io.composix.collection.Seal;
import io.composix.collection.backing.PersistentTreeBackingMap;
import io.composix.collection.backing.SortedKeySetMap;
import io.composix.collection.backing.TreeBackingMap;
import io.composix.collection.keyset.KeySet;
import io.composix.collection.keyset.KeySetFactory;
import io.composix.collection.logging.LogMessageKeys;
import io.composix.collection.query.DistinctKeys;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Ordered index over comparable values. Besides equality lookups it answers range, minimum and maximum queries and,
 * for string values, prefix queries.
 *
 * @param <V> indexed value type
 */
@API(API.Status.STABLE)
public class BTreeIndex<V extends Comparable<? super V>> implements Index<V> {
    @Nonnull
    private final SortedKeySetMap<V> keysByValue;

    protected BTreeIndex(@Nonnull SortedKeySetMap<V> keysByValue) {
        this.keysByValue = keysByValue;
    }

    @Nonnull
    public static <V extends Comparable<? super V>> BTreeIndex<V> create() {
        return create(KeySetFactory.HASH);
    }

    @Nonnull
    public static <V extends Comparable<? super V>> BTreeIndex<V> create(@Nonnull KeySetFactory keySets) {
        return new BTreeIndex<>(new SortedKeySetMap<V>(new TreeBackingMap<V, KeySet>(), keySets));
    }

    @Nonnull
    public static <V extends Comparable<? super V>> BTreeIndex<V> persistent() {
        return new BTreeIndex<>(new SortedKeySetMap<V>(new PersistentTreeBackingMap<V, KeySet>(), KeySetFactory.PERSISTENT));
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

    public int countDistinct() {
        return keysByValue.countDistinct();
    }

    @Nonnull
    public DistinctKeys all() {
        return keysByValue.allKeys();
    }

    /**
     * Get the keys of records whose value lies within a range.
     * @param range the values to include
     * @return the matching keys, in ascending value order
     */
    @Nonnull
    public DistinctKeys range(@Nonnull Range<V> range) {
        return keysByValue.range(range);
    }

    /**
     * Get the keys of records whose value is at least {@code from} and less than {@code to}.
     * @param from inclusive lower end
     * @param to exclusive upper end
     * @return the matching keys, in ascending value order
     * @throws CollectionArgumentException if {@code from} is greater than {@code to}
     */
    @Nonnull
    public DistinctKeys range(@Nonnull V from, @Nonnull V to) {
        if (from.compareTo(to) > 0) {
            throw new CollectionArgumentException("range lower end is above its upper end",
                    LogMessageKeys.PROPERTY_NAME, "from", LogMessageKeys.PROPERTY_VALUE, from);
        }
        return range(Range.closedOpen(from, to));
    }

    @Nonnull
    public DistinctKeys rangeFrom(@Nonnull V from) {
        return range(Range.atLeast(from));
    }

    @Nonnull
    public DistinctKeys rangeTo(@Nonnull V to) {
        return range(Range.lessThan(to));
    }

    /**
     * Get the key of some record with the smallest value.
     * @return a key, or empty if the index is empty
     */
    @Nonnull
    public Optional<Key> minOne() {
        return keysByValue.minKey();
    }

    @Nonnull
    public Optional<Key> maxOne() {
        return keysByValue.maxKey();
    }

    @Nonnull
    public Optional<V> minValue() {
        return keysByValue.minValue();
    }

    @Nonnull
    public Optional<V> maxValue() {
        return keysByValue.maxValue();
    }

    /**
     * Get the keys of records whose value starts with a prefix. Only meaningful for an index over strings.
     * The empty prefix matches every record.
     * @param prefix the prefix
     * @return the matching keys, in ascending value order
     * @throws CollectionArgumentException if this index holds values that are not strings
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public DistinctKeys startsWith(@Nonnull String prefix) {
        final Optional<V> sample = keysByValue.minValue();
        if (sample.isPresent() && !(sample.get() instanceof String)) {
            throw new CollectionArgumentException("prefix query on an index over non-string values",
                    LogMessageKeys.INDEX_TYPE, sample.get().getClass().getSimpleName());
        }
        return range((Range<V>)(Range<?>)StringRanges.startingWith(prefix));
    }

    @Nonnull
    @Override
    public BTreeIndex<V> copy() {
        return new BTreeIndex<>(keysByValue.copy());
    }

    @Override
    public boolean isShallowCloneable() {
        return keysByValue.isShallowCloneable();
    }
}
