/*
 * DistinctKeys.java
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

import com.google.common.collect.ImmutableSet;
import io.composix.annotation.API;
import io.composix.collection.Key;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An immutable snapshot of distinct keys. Leaf indexes answer multi-key queries with one of these, so that the
 * answer stays valid while the collection is mutated on the strength of it.
 */
@API(API.Status.STABLE)
public final class DistinctKeys implements DistinctQueryResult, Iterable<Key> {
    private static final DistinctKeys EMPTY = new DistinctKeys(ImmutableSet.of());

    @Nonnull
    private final ImmutableSet<Key> keys;

    private DistinctKeys(@Nonnull ImmutableSet<Key> keys) {
        this.keys = keys;
    }

    @Nonnull
    public static DistinctKeys empty() {
        return EMPTY;
    }

    @Nonnull
    public static DistinctKeys of(@Nonnull Key... keys) {
        return copyOf(ImmutableSet.copyOf(keys));
    }

    @Nonnull
    public static DistinctKeys copyOf(@Nonnull Iterable<Key> keys) {
        final ImmutableSet<Key> set = ImmutableSet.copyOf(keys);
        return set.isEmpty() ? EMPTY : new DistinctKeys(set);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public boolean contains(@Nonnull Key key) {
        return keys.contains(key);
    }

    /**
     * Get some key of the result.
     * @return the first key in iteration order, or empty if there are none
     */
    @Nonnull
    public Optional<Key> first() {
        return keys.isEmpty() ? Optional.empty() : Optional.of(keys.iterator().next());
    }

    @Nonnull
    public DistinctKeys union(@Nonnull DistinctKeys other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new DistinctKeys(ImmutableSet.<Key>builder().addAll(keys).addAll(other.keys).build());
    }

    @Override
    public void forEachKey(@Nonnull Consumer<? super Key> action) {
        keys.forEach(action);
    }

    @Nonnull
    @Override
    public List<Key> keys() {
        return keys.asList();
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
        return keys.equals(((DistinctKeys)o).keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "DistinctKeys" + keys;
    }

    /**
     * Accumulates keys, dropping repeats.
     */
    public static final class Builder {
        @Nonnull
        private final ImmutableSet.Builder<Key> keys = ImmutableSet.builder();

        private Builder() {
        }

        @Nonnull
        public Builder add(@Nonnull Key key) {
            keys.add(key);
            return this;
        }

        @Nonnull
        public Builder addAll(@Nonnull Iterable<Key> moreKeys) {
            keys.addAll(moreKeys);
            return this;
        }

        @Nonnull
        public DistinctKeys build() {
            return copyOf(keys.build());
        }
    }
}
