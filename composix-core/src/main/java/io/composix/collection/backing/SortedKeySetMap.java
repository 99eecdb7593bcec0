/*
 * SortedKeySetMap.java
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

import com.google.common.collect.Maps;
import com.google.common.collect.Range;
import io.composix.annotation.API;
import io.composix.collection.Key;
import io.composix.collection.keyset.KeySet;
import io.composix.collection.keyset.KeySetFactory;
import io.composix.collection.keyset.KeySetView;
import io.composix.collection.query.DistinctKeys;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link KeySetMap} over ordered values, adding range and extremum lookups.
 *
 * @param <V> indexed value type
 */
@API(API.Status.INTERNAL)
public class SortedKeySetMap<V extends Comparable<? super V>> extends KeySetMap<V> {
    @Nonnull
    private final SortedBackingMap<V, KeySet> sorted;

    public SortedKeySetMap(@Nonnull SortedBackingMap<V, KeySet> sorted, @Nonnull KeySetFactory keySets) {
        super(sorted, keySets);
        this.sorted = sorted;
    }

    /**
     * Get the keys of every value within a range.
     * @param range the values to include
     * @return the keys, grouped by value in ascending value order
     */
    @Nonnull
    public DistinctKeys range(@Nonnull Range<V> range) {
        final DistinctKeys.Builder builder = DistinctKeys.builder();
        for (Iterator<Map.Entry<V, KeySet>> iterator = sorted.range(range); iterator.hasNext(); ) {
            builder.addAll(iterator.next().getValue());
        }
        return builder.build();
    }

    /**
     * Iterate over the values within a range and their keys.
     * @param range the values to include
     * @return the matching entries in ascending value order
     */
    @Nonnull
    public Iterator<Map.Entry<V, KeySetView>> entries(@Nonnull Range<V> range) {
        final Iterator<Map.Entry<V, KeySet>> iterator = sorted.range(range);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public Map.Entry<V, KeySetView> next() {
                final Map.Entry<V, KeySet> entry = iterator.next();
                return Maps.immutableEntry(entry.getKey(), entry.getValue());
            }
        };
    }

    @Nonnull
    public Optional<V> minValue() {
        final Map.Entry<V, KeySet> first = sorted.first();
        return first == null ? Optional.empty() : Optional.of(first.getKey());
    }

    @Nonnull
    public Optional<V> maxValue() {
        final Map.Entry<V, KeySet> last = sorted.last();
        return last == null ? Optional.empty() : Optional.of(last.getKey());
    }

    @Nonnull
    public Optional<Key> minKey() {
        final Map.Entry<V, KeySet> first = sorted.first();
        return first == null ? Optional.empty() : Optional.of(first.getValue().iterator().next());
    }

    @Nonnull
    public Optional<Key> maxKey() {
        final Map.Entry<V, KeySet> last = sorted.last();
        return last == null ? Optional.empty() : Optional.of(last.getValue().iterator().next());
    }

    @Nonnull
    @Override
    public SortedKeySetMap<V> copy() {
        return new SortedKeySetMap<V>(deepCopy(sorted.copy(), sorted), getKeySets());
    }
}
