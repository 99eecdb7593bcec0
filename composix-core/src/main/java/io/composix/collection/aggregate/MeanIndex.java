/*
 * MeanIndex.java
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
import io.composix.collection.IndexConsistencyException;
import io.composix.collection.Seal;
import io.composix.collection.ShallowClone;
import io.composix.collection.index.Index;
import io.composix.collection.index.Insert;
import io.composix.collection.index.Remove;
import io.composix.collection.index.Update;

import javax.annotation.Nonnull;
import java.util.OptionalDouble;

/**
 * Arithmetic mean of the values it sees, kept as a running sum and count.
 *
 * @param <N> numeric type
 */
@API(API.Status.STABLE)
public class MeanIndex<N extends Number> implements Index<N>, ShallowClone {
    private double sum;
    private long count;

    protected MeanIndex(double sum, long count) {
        this.sum = sum;
        this.count = count;
    }

    @Nonnull
    public static <N extends Number> MeanIndex<N> create() {
        return new MeanIndex<>(0.0, 0L);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<N> op) {
        sum += op.getNewValue().doubleValue();
        count++;
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<N> op) {
        if (count == 0L) {
            throw IndexConsistencyException.unknownRemoval(this, op.getKey());
        }
        count--;
        sum = count == 0L ? 0.0 : sum - op.getExistingValue().doubleValue();
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<N> op) {
        sum = sum - op.getExistingValue().doubleValue() + op.getNewValue().doubleValue();
    }

    /**
     * Get the mean.
     * @return the mean of the values, or {@code 0.0} if there are none
     */
    public double get() {
        return count == 0L ? 0.0 : sum / count;
    }

    @Nonnull
    public OptionalDouble getOptional() {
        return count == 0L ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    }

    public long getCount() {
        return count;
    }

    @Nonnull
    @Override
    public MeanIndex<N> copy() {
        return new MeanIndex<>(sum, count);
    }
}
