/*
 * TreeBackingMap.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * {@link SortedBackingMap} over a {@link TreeMap}.
 *
 * @param <K> key type
 * @param <V> value type
 */
@API(API.Status.INTERNAL)
public class TreeBackingMap<K extends Comparable<? super K>, V> implements SortedBackingMap<K, V> {
    @Nonnull
    private final NavigableMap<K, V> map;

    public TreeBackingMap() {
        this(new TreeMap<>());
    }

    private TreeBackingMap(@Nonnull NavigableMap<K, V> map) {
        this.map = map;
    }

    @Nullable
    @Override
    public V get(@Nonnull K key) {
        return map.get(key);
    }

    @Override
    public void put(@Nonnull K key, @Nonnull V value) {
        map.put(key, value);
    }

    @Nullable
    @Override
    public V remove(@Nonnull K key) {
        return map.remove(key);
    }

    @Override
    public int size() {
        return map.size();
    }

    @Nullable
    @Override
    public Map.Entry<K, V> first() {
        return map.firstEntry();
    }

    @Nullable
    @Override
    public Map.Entry<K, V> last() {
        return map.lastEntry();
    }

    @Nonnull
    @Override
    public Iterator<Map.Entry<K, V>> range(@Nonnull Range<K> range) {
        return Collections.unmodifiableMap(Maps.subMap(map, range)).entrySet().iterator();
    }

    @Nonnull
    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return Collections.unmodifiableMap(map).entrySet().iterator();
    }

    @Nonnull
    @Override
    public TreeBackingMap<K, V> copy() {
        return new TreeBackingMap<>(new TreeMap<>(map));
    }

    @Override
    public boolean isPersistent() {
        return false;
    }
}
