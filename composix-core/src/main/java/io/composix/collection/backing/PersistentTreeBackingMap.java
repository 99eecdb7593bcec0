/*
 * PersistentTreeBackingMap.java
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

import clojure.lang.ISeq;
import clojure.lang.PersistentTreeMap;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Range;
import io.composix.annotation.API;
import io.composix.collection.ClojureRuntime;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

/**
 * {@link SortedBackingMap} holding a Clojure {@link PersistentTreeMap}, a persistent red-black tree. Each mutation
 * replaces the held tree with a new version, so copies never observe each other's changes.
 *
 * @param <K> key type
 * @param <V> value type
 */
@API(API.Status.INTERNAL)
public class PersistentTreeBackingMap<K extends Comparable<? super K>, V> implements SortedBackingMap<K, V> {
    static {
        ClojureRuntime.load();
    }

    @Nonnull
    private PersistentTreeMap map;

    public PersistentTreeBackingMap() {
        this(new PersistentTreeMap(null, Comparator.<K>naturalOrder()));
    }

    private PersistentTreeBackingMap(@Nonnull PersistentTreeMap map) {
        this.map = map;
    }

    @Nullable
    @Override
    @SuppressWarnings("unchecked")
    public V get(@Nonnull K key) {
        return (V)map.valAt(key);
    }

    @Override
    public boolean containsKey(@Nonnull K key) {
        return map.containsKey(key);
    }

    @Override
    public void put(@Nonnull K key, @Nonnull V value) {
        map = (PersistentTreeMap)map.assoc(key, value);
    }

    @Nullable
    @Override
    public V remove(@Nonnull K key) {
        final V existing = get(key);
        if (existing != null) {
            map = (PersistentTreeMap)map.without(key);
        }
        return existing;
    }

    @Override
    public int size() {
        return map.count();
    }

    @Nullable
    @Override
    public Map.Entry<K, V> first() {
        return head(map.seq(true));
    }

    @Nullable
    @Override
    public Map.Entry<K, V> last() {
        return head(map.seq(false));
    }

    @Nonnull
    @Override
    public Iterator<Map.Entry<K, V>> range(@Nonnull Range<K> range) {
        final ISeq start = range.hasLowerBound() ? map.seqFrom(range.lowerEndpoint(), true) : map.seq(true);
        return new AbstractIterator<>() {
            @Nullable
            private ISeq seq = start;

            @Override
            protected Map.Entry<K, V> computeNext() {
                while (seq != null) {
                    final Map.Entry<K, V> entry = head(seq);
                    seq = seq.next();
                    final K key = entry.getKey();
                    if (range.contains(key)) {
                        return entry;
                    }
                    if (range.hasUpperBound() && key.compareTo(range.upperEndpoint()) >= 0) {
                        break;
                    }
                }
                return endOfData();
            }
        };
    }

    @Nonnull
    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return range(Range.all());
    }

    @Nonnull
    @Override
    public PersistentTreeBackingMap<K, V> copy() {
        return new PersistentTreeBackingMap<>(map);
    }

    @Override
    public boolean isPersistent() {
        return true;
    }

    @Nullable
    @SuppressWarnings("unchecked")
    private static <K, V> Map.Entry<K, V> head(@Nullable ISeq seq) {
        return seq == null ? null : (Map.Entry<K, V>)seq.first();
    }
}
