/*
 * AggregateIndex.java
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

package io.composix.collection.aggregate;

import io.composix.annotation.API;
import io.composix.collection.Seal;
import io.composix.collection.ShallowClone;
import io.composix.collection.index.Index;
import io.composix.collection.index.Insert;
import io.composix.collection.index.Remove;
import io.composix.collection.index.Update;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * An aggregate defined by functions over an immutable state: one to fold in an inserted value, one to take out a
 * removed value and one to read the answer out of the state. An update takes out the old value and folds in the new
 * one unless a dedicated update function is given.
 *
 * <pre>{@code
 * AggregateIndex<Integer, Integer, Integer> max = AggregateIndex.of(0,
 *         (state, value) -> Math.max(state, value),
 *         (state, value) -> state, // removals cannot shrink a max
 *         state -> state);
 * }</pre>
 *
 * <p>
 * The state is replaced, never mutated, so copies of this index share it safely.
 * </p>
 *
 * @param <T> type of the aggregated values
 * @param <S> state type, which must be immutable
 * @param <Q> answer type
 */
@API(API.Status.UNSTABLE)
public class AggregateIndex<T, S, Q> implements Index<T>, ShallowClone {
    @Nonnull
    private final BiFunction<? super S, ? super T, ? extends S> onInsert;
    @Nonnull
    private final BiFunction<? super S, ? super T, ? extends S> onRemove;
    @Nullable
    private final UpdateFunction<S, T> onUpdate;
    @Nonnull
    private final Function<? super S, ? extends Q> query;
    @Nonnull
    private S state;

    protected AggregateIndex(@Nonnull S state,
                             @Nonnull BiFunction<? super S, ? super T, ? extends S> onInsert,
                             @Nonnull BiFunction<? super S, ? super T, ? extends S> onRemove,
                             @Nullable UpdateFunction<S, T> onUpdate,
                             @Nonnull Function<? super S, ? extends Q> query) {
        this.state = state;
        this.onInsert = onInsert;
        this.onRemove = onRemove;
        this.onUpdate = onUpdate;
        this.query = query;
    }

    @Nonnull
    public static <T, S, Q> AggregateIndex<T, S, Q> of(@Nonnull S initialState,
                                                       @Nonnull BiFunction<? super S, ? super T, ? extends S> onInsert,
                                                       @Nonnull BiFunction<? super S, ? super T, ? extends S> onRemove,
                                                       @Nonnull Function<? super S, ? extends Q> query) {
        return new AggregateIndex<>(initialState, onInsert, onRemove, null, query);
    }

    /**
     * Create an index like this one that handles updates with a dedicated function.
     * @param onUpdate computes the state after replacing a value
     * @return a new index with this index's current state
     */
    @Nonnull
    public AggregateIndex<T, S, Q> withUpdate(@Nonnull UpdateFunction<S, T> onUpdate) {
        return new AggregateIndex<>(state, onInsert, onRemove, onUpdate, query);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        state = onInsert.apply(state, op.getNewValue());
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        state = onRemove.apply(state, op.getExistingValue());
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        if (onUpdate == null) {
            state = onInsert.apply(onRemove.apply(state, op.getExistingValue()), op.getNewValue());
        } else {
            state = onUpdate.apply(state, op.getNewValue(), op.getExistingValue());
        }
    }

    @Nonnull
    public Q get() {
        return query.apply(state);
    }

    @Nonnull
    public S getState() {
        return state;
    }

    @Nonnull
    @Override
    public AggregateIndex<T, S, Q> copy() {
        return new AggregateIndex<>(state, onInsert, onRemove, onUpdate, query);
    }

    /**
     * Computes the state after a value is replaced.
     * @param <S> state type
     * @param <T> value type
     */
    @FunctionalInterface
    public interface UpdateFunction<S, T> {
        @Nonnull
        S apply(@Nonnull S state, @Nonnull T newValue, @Nonnull T existingValue);
    }
}
