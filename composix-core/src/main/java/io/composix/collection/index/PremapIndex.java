/*
 * PremapIndex.java
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
import java.util.function.Function;

/**
 * Feeds its inner index a value derived from each record, such as one of its fields.
 *
 * <p>
 * The function must be pure: given equal records it must return equal values, every time it is called. Both sides
 * of an update are mapped and forwarded as an update.
 * </p>
 *
 * @param <T> record type
 * @param <U> derived value type
 * @param <I> inner index type
 */
@API(API.Status.STABLE)
public class PremapIndex<T, U, I extends Index<U>> implements Index<T> {
    @Nonnull
    private final Function<? super T, ? extends U> function;
    @Nonnull
    private final I inner;

    protected PremapIndex(@Nonnull Function<? super T, ? extends U> function, @Nonnull I inner) {
        this.function = function;
        this.inner = inner;
    }

    @Nonnull
    public static <T, U, I extends Index<U>> PremapIndex<T, U, I> of(@Nonnull Function<? super T, ? extends U> function,
                                                                      @Nonnull I inner) {
        return new PremapIndex<>(function, inner);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        inner.insert(seal, op.map(function));
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        inner.remove(seal, op.map(function));
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        inner.update(seal, op.map(function));
    }

    @Nonnull
    public I inner() {
        return inner;
    }

    @Nonnull
    @Override
    public PremapIndex<T, U, I> copy() {
        return new PremapIndex<>(function, Index.copyOf(inner));
    }

    @Override
    public boolean isShallowCloneable() {
        return inner.isShallowCloneable();
    }
}
