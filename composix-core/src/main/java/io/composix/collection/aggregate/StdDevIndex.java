/*
 * StdDevIndex.java
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

/**
 * Sample standard deviation of the values it sees, maintained with Welford's online algorithm extended to removals.
 *
 * <p>
 * The state is the number of values {@code n}, their mean {@code m} and the sum of squared differences from the
 * mean {@code s}. Removing the last value resets the state exactly. Removals can make {@code s} drift slightly below
 * zero through rounding, so it is clamped at zero. Over very long streams of high-variance updates the result can
 * drift from a freshly computed deviation.
 * </p>
 *
 * @param <N> numeric type
 */
@API(API.Status.STABLE)
public class StdDevIndex<N extends Number> implements Index<N>, ShallowClone {
    private long count;
    private double mean;
    private double sumOfSquares;

    protected StdDevIndex(long count, double mean, double sumOfSquares) {
        this.count = count;
        this.mean = mean;
        this.sumOfSquares = sumOfSquares;
    }

    @Nonnull
    public static <N extends Number> StdDevIndex<N> create() {
        return new StdDevIndex<>(0L, 0.0, 0.0);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<N> op) {
        add(op.getNewValue().doubleValue());
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<N> op) {
        if (count == 0L) {
            throw IndexConsistencyException.unknownRemoval(this, op.getKey());
        }
        subtract(op.getExistingValue().doubleValue());
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<N> op) {
        if (count == 0L) {
            throw IndexConsistencyException.unknownRemoval(this, op.getKey());
        }
        if (count == 1L) {
            mean = op.getNewValue().doubleValue();
            sumOfSquares = 0.0;
            return;
        }
        subtract(op.getExistingValue().doubleValue());
        add(op.getNewValue().doubleValue());
    }

    private void add(double x) {
        count++;
        final double oldMean = mean;
        mean += (x - oldMean) / count;
        sumOfSquares += (x - oldMean) * (x - mean);
    }

    private void subtract(double x) {
        if (count <= 1L) {
            count = 0L;
            mean = 0.0;
            sumOfSquares = 0.0;
            return;
        }
        final double newMean = (count * mean - x) / (count - 1);
        sumOfSquares = Math.max(0.0, sumOfSquares - (x - mean) * (x - newMean));
        mean = newMean;
        count--;
    }

    /**
     * Get the sample standard deviation.
     * @return the standard deviation, or {@code 0.0} with fewer than two values
     */
    public double get() {
        return count < 2L ? 0.0 : Math.sqrt(sumOfSquares / (count - 1));
    }

    /**
     * Get the sample variance.
     * @return the variance, or {@code 0.0} with fewer than two values
     */
    public double getVariance() {
        return count < 2L ? 0.0 : sumOfSquares / (count - 1);
    }

    public double getMean() {
        return mean;
    }

    public long getCount() {
        return count;
    }

    @Nonnull
    @Override
    public StdDevIndex<N> copy() {
        return new StdDevIndex<>(count, mean, sumOfSquares);
    }
}
