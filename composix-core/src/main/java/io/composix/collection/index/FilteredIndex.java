/*
 * FilteredIndex.java
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

import io.composix.annotation.API;
import io.composix.collection.Seal;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Forwards to its inner index only the records that pass a filter, optionally projecting them at the same time.
 *
 * <p>
 * An update is split four ways, depending on whether the old and the new record pass:
 * both pass, forwarded as an update; only the old one passes, forwarded as a removal; only the new one passes,
 * forwarded as an insertion; neither passes, dropped.
 * </p>
 *
 * @param <T> record type
 * @param <U> type of the values the inner index sees
 * @param <I> inner index type
 */
@API(API.Status.STABLE)
public class FilteredIndex<T, U, I extends Index<U>> implements Index<T> {
    @Nonnull
    private final Function<? super T, Optional<U>> filter;
    @Nonnull
    private final I inner;

    protected FilteredIndex(@Nonnull Function<? super T, Optional<U>> filter, @Nonnull I inner) {
        this.filter = filter;
        this.inner = inner;
    }

    /**
     * Create an index that forwards the projection of every record for which the projection is present.
     * @param filter projects a record, or returns empty to leave it out
     * @param inner the inner index
     * @param <T> record type
     * @param <U> projected type
     * @param <I> inner index type
     * @return the filtered index
     */
    @Nonnull
    public static <T, U, I extends Index<U>> FilteredIndex<T, U, I> of(@Nonnull Function<? super T, Optional<U>> filter,
                                                                        @Nonnull I inner) {
        return new FilteredIndex<>(filter, inner);
    }

    /**
     * Create an index that forwards the records matching a predicate unchanged.
     * @param predicate selects the records to forward
     * @param inner the inner index
     * @param <T> record type
     * @param <I> inner index type
     * @return the filtered index
     */
    @Nonnull
    public static <T, I extends Index<T>> FilteredIndex<T, T, I> where(@Nonnull Predicate<? super T> predicate,
                                                                        @Nonnull I inner) {
        return new FilteredIndex<T, T, I>(record -> predicate.test(record) ? Optional.of(record) : Optional.empty(), inner);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        final Optional<U> newValue = filter.apply(op.getNewValue());
        if (newValue.isPresent()) {
            inner.insert(seal, new Insert<>(op.getKey(), newValue.get()));
        }
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        final Optional<U> existingValue = filter.apply(op.getExistingValue());
        if (existingValue.isPresent()) {
            inner.remove(seal, new Remove<>(op.getKey(), existingValue.get()));
        }
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        final Optional<U> newValue = filter.apply(op.getNewValue());
        final Optional<U> existingValue = filter.apply(op.getExistingValue());
        if (newValue.isPresent() && existingValue.isPresent()) {
            inner.update(seal, new Update<>(op.getKey(), newValue.get(), existingValue.get()));
        } else if (existingValue.isPresent()) {
            inner.remove(seal, new Remove<>(op.getKey(), existingValue.get()));
        } else if (newValue.isPresent()) {
            inner.insert(seal, new Insert<>(op.getKey(), newValue.get()));
        }
    }

    @Nonnull
    public I inner() {
        return inner;
    }

    @Nonnull
    @Override
    public FilteredIndex<T, U, I> copy() {
        return new FilteredIndex<>(filter, Index.copyOf(inner));
    }

    @Override
    public boolean isShallowCloneable() {
        return inner.isShallowCloneable();
    }
}
