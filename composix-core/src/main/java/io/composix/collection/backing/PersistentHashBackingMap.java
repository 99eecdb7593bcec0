/*
 * PersistentHashBackingMap.java
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

import clojure.lang.IPersistentMap;
import clojure.lang.PersistentHashMap;
import io.composix.annotation.API;
import io.composix.collection.ClojureRuntime;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.Map;

/**
 * {@link BackingMap} holding a Clojure {@link PersistentHashMap}. Each mutation replaces the held map with a new
 * version, so copies never observe each other's changes.
 *
 * @param <K> key type
 * @param <V> value type
 */
@API(API.Status.INTERNAL)
public class PersistentHashBackingMap<K, V> implements BackingMap<K, V> {
    static {
        ClojureRuntime.load();
    }

    @Nonnull
    private IPersistentMap map;

    public PersistentHashBackingMap() {
        this(PersistentHashMap.EMPTY);
    }

    private PersistentHashBackingMap(@Nonnull IPersistentMap map) {
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
        map = map.assoc(key, value);
    }

    @Nullable
    @Override
    public V remove(@Nonnull K key) {
        final V existing = get(key);
        if (existing != null) {
            map = map.without(key);
        }
        return existing;
    }

    @Override
    public int size() {
        return map.count();
    }

    @Nonnull
    @Override
    @SuppressWarnings("unchecked")
    public Iterator<Map.Entry<K, V>> iterator() {
        return (Iterator<Map.Entry<K, V>>)map.iterator();
    }

    @Nonnull
    @Override
    public PersistentHashBackingMap<K, V> copy() {
        return new PersistentHashBackingMap<>(map);
    }

    @Override
    public boolean isPersistent() {
        return true;
    }
}
