/*
 * TreeKeySet.java
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

package io.composix.collection.keyset;

import io.composix.annotation.API;
import io.composix.collection.Key;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.Iterator;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * {@link KeySet} backed by a {@link TreeSet}, so that keys are iterated from oldest to newest.
 */
@API(API.Status.UNSTABLE)
public class TreeKeySet implements KeySet {
    @Nonnull
    private final NavigableSet<Key> keys;

    public TreeKeySet() {
        this(new TreeSet<>());
    }

    private TreeKeySet(@Nonnull NavigableSet<Key> keys) {
        this.keys = keys;
    }

    @Override
    public boolean add(@Nonnull Key key) {
        return keys.add(key);
    }

    @Override
    public boolean remove(@Nonnull Key key) {
        return keys.remove(key);
    }

    @Override
    public boolean contains(@Nonnull Key key) {
        return keys.contains(key);
    }

    @Override
    public int count() {
        return keys.size();
    }

    @Nonnull
    @Override
    public Iterator<Key> iterator() {
        return Collections.unmodifiableNavigableSet(keys).iterator();
    }

    @Nonnull
    @Override
    public TreeKeySet copy() {
        return new TreeKeySet(new TreeSet<>(keys));
    }

    @Override
    public String toString() {
        return keys.toString();
    }
}
