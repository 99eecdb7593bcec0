/*
 * Index.java
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
import io.composix.collection.ShallowClone;

import javax.annotation.Nonnull;

/**
 * A secondary index over the records of a {@link io.composix.collection.Collection}.
 *
 * <p>
 * The collection tells its index about every change, in the order the changes happen. An index is told about an
 * insertion after the record is stored, and about a removal or replacement while the old record is still stored.
 * Indexes never look into the store themselves; everything they know comes from the operations they are given.
 * </p>
 *
 * <p>
 * The mutating methods take a {@link Seal}, which only the collection can supply. Combinators pass on the seal they
 * receive. Query methods are specific to each index type and are reached from the callbacks of
 * {@link io.composix.collection.Collection#query} and friends.
 * </p>
 *
 * @param <T> the type of value this index sees
 */
@API(API.Status.STABLE)
public interface Index<T> {
    void insert(@Nonnull Seal seal, @Nonnull Insert<T> op);

    void remove(@Nonnull Seal seal, @Nonnull Remove<T> op);

    /**
     * Replace a value. By default this is a {@link #remove} of the old value followed by an {@link #insert} of the
     * new one; indexes override it when they can do better.
     *
     * @param seal proof that the caller is the owning collection
     * @param op the replacement
     */
    default void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        remove(seal, op.asRemove());
        insert(seal, op.asInsert());
    }

    /**
     * Create an independent copy of this index. Implementations return their own type.
     * @return the copy
     */
    @Nonnull
    Index<T> copy();

    /**
     * Whether {@link #copy()} is cheap and shares structure with this index.
     * @return {@code true} if copying this index is cheap
     */
    default boolean isShallowCloneable() {
        return this instanceof ShallowClone;
    }

    /**
     * Copy an index keeping its static type.
     * @param index the index to copy
     * @param <I> the type of the index
     * @return the copy
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    static <I extends Index<?>> I copyOf(@Nonnull I index) {
        return (I)index.copy();
    }
}
