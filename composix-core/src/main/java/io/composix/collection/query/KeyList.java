/*
 * KeyList.java
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

package io.composix.collection.query;

import com.google.common.collect.ImmutableList;
import io.composix.annotation.API;
import io.composix.collection.Key;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * An immutable list of keys that may contain repeats, typically the concatenation of several query results.
 * Such a result can be read or deleted through a collection, but must be made {@link #distinct()} before it can be
 * used to update or take records.
 */
@API(API.Status.STABLE)
public final class KeyList implements QueryResult, Iterable<Key> {
    @Nonnull
    private final ImmutableList<Key> keys;

    private KeyList(@Nonnull ImmutableList<Key> keys) {
        this.keys = keys;
    }

    /**
     * Concatenate query results, keeping repeats.
     * @param results the results to concatenate, in order
     * @return the keys of every result
     */
    @Nonnull
    public static KeyList of(@Nonnull QueryResult... results) {
        final ImmutableList.Builder<Key> builder = ImmutableList.builder();
        for (QueryResult result : results) {
            result.forEachKey(builder::add);
        }
        return new KeyList(builder.build());
    }

    @Nonnull
    public static KeyList copyOf(@Nonnull Iterable<Key> keys) {
        return new KeyList(ImmutableList.copyOf(keys));
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Nonnull
    public DistinctKeys distinct() {
        return DistinctKeys.copyOf(keys);
    }

    @Override
    public void forEachKey(@Nonnull Consumer<? super Key> action) {
        keys.forEach(action);
    }

    @Nonnull
    @Override
    public List<Key> keys() {
        return keys;
    }

    @Nonnull
    @Override
    public Iterator<Key> iterator() {
        return keys.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return keys.equals(((KeyList)o).keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "KeyList" + keys;
    }
}
