/*
 * LongKeySet.java
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
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import javax.annotation.Nonnull;
import java.util.Iterator;

/**
 * {@link KeySet} that stores raw key identifiers in a fastutil {@link LongOpenHashSet}, avoiding one boxed
 * {@link Key} per entry. Suited to indexes with few distinct values and many keys per value.
 */
@API(API.Status.UNSTABLE)
public class LongKeySet implements KeySet {
    @Nonnull
    private final LongOpenHashSet ids;

    public LongKeySet() {
        this(new LongOpenHashSet());
    }

    private LongKeySet(@Nonnull LongOpenHashSet ids) {
        this.ids = ids;
    }

    @Override
    public boolean add(@Nonnull Key key) {
        return ids.add(key.getId());
    }

    @Override
    public boolean remove(@Nonnull Key key) {
        return ids.remove(key.getId());
    }

    @Override
    public boolean contains(@Nonnull Key key) {
        return ids.contains(key.getId());
    }

    @Override
    public int count() {
        return ids.size();
    }

    @Nonnull
    @Override
    public Iterator<Key> iterator() {
        final LongIterator iterator = ids.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public Key next() {
                return Key.unsafeOf(iterator.nextLong());
            }
        };
    }

    @Nonnull
    @Override
    public LongKeySet copy() {
        return new LongKeySet(new LongOpenHashSet(ids));
    }

    @Override
    public String toString() {
        return ids.toString();
    }
}
