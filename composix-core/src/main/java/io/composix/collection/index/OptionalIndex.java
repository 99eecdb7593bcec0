/*
 * OptionalIndex.java
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
import javax.annotation.Nullable;
import java.util.Optional;

/**
 * An index that may or may not be there, decided when the collection is built. When absent, every operation is
 * dropped; when present, every operation is forwarded.
 *
 * @param <T> record type
 * @param <I> inner index type
 */
@API(API.Status.STABLE)
public class OptionalIndex<T, I extends Index<T>> implements Index<T> {
    @Nullable
    private final I inner;

    protected OptionalIndex(@Nullable I inner) {
        this.inner = inner;
    }

    @Nonnull
    public static <T, I extends Index<T>> OptionalIndex<T, I> of(@Nonnull I inner) {
        return new OptionalIndex<>(inner);
    }

    @Nonnull
    public static <T, I extends Index<T>> OptionalIndex<T, I> absent() {
        return new OptionalIndex<>(null);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        if (inner != null) {
            inner.insert(seal, op);
        }
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        if (inner != null) {
            inner.remove(seal, op);
        }
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        if (inner != null) {
            inner.update(seal, op);
        }
    }

    @Nonnull
    public Optional<I> get() {
        return Optional.ofNullable(inner);
    }

    @Nonnull
    @Override
    public OptionalIndex<T, I> copy() {
        return inner == null ? this : new OptionalIndex<>(Index.copyOf(inner));
    }

    @Override
    public boolean isShallowCloneable() {
        return inner == null || inner.isShallowCloneable();
    }
}
