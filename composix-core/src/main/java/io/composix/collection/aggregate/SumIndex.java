/*
 * SumIndex.java
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
import java.math.BigDecimal;
import java.util.function.BinaryOperator;

/**
 * Sums the values it sees. Integral sums throw {@link ArithmeticException} on overflow.
 *
 * @param <N> numeric type
 */
@API(API.Status.STABLE)
public class SumIndex<N> implements Index<N>, ShallowClone {
    /** Sums of {@code Integer}s. */
    public static final Arithmetic<Integer> INTEGERS = new Arithmetic<>(0, Math::addExact, Math::subtractExact);
    /** Sums of {@code Long}s. */
    public static final Arithmetic<Long> LONGS = new Arithmetic<>(0L, Math::addExact, Math::subtractExact);
    /** Sums of {@code Double}s. */
    public static final Arithmetic<Double> DOUBLES = new Arithmetic<>(0.0, Double::sum, (a, b) -> a - b);
    /** Sums of {@code BigDecimal}s. */
    public static final Arithmetic<BigDecimal> BIG_DECIMALS = new Arithmetic<>(BigDecimal.ZERO, BigDecimal::add, BigDecimal::subtract);

    @Nonnull
    private final Arithmetic<N> arithmetic;
    @Nonnull
    private N sum;

    protected SumIndex(@Nonnull Arithmetic<N> arithmetic, @Nonnull N sum) {
        this.arithmetic = arithmetic;
        this.sum = sum;
    }

    @Nonnull
    public static <N> SumIndex<N> of(@Nonnull Arithmetic<N> arithmetic) {
        return new SumIndex<>(arithmetic, arithmetic.zero);
    }

    @Nonnull
    public static SumIndex<Integer> ofIntegers() {
        return of(INTEGERS);
    }

    @Nonnull
    public static SumIndex<Long> ofLongs() {
        return of(LONGS);
    }

    @Nonnull
    public static SumIndex<Double> ofDoubles() {
        return of(DOUBLES);
    }

    @Nonnull
    public static SumIndex<BigDecimal> ofBigDecimals() {
        return of(BIG_DECIMALS);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<N> op) {
        sum = arithmetic.add.apply(sum, op.getNewValue());
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<N> op) {
        sum = arithmetic.subtract.apply(sum, op.getExistingValue());
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<N> op) {
        sum = arithmetic.add.apply(arithmetic.subtract.apply(sum, op.getExistingValue()), op.getNewValue());
    }

    @Nonnull
    public N get() {
        return sum;
    }

    @Nonnull
    @Override
    public SumIndex<N> copy() {
        return new SumIndex<>(arithmetic, sum);
    }

    /**
     * Addition and subtraction over a numeric type.
     * @param <N> numeric type
     */
    public static final class Arithmetic<N> {
        @Nonnull
        private final N zero;
        @Nonnull
        private final BinaryOperator<N> add;
        @Nonnull
        private final BinaryOperator<N> subtract;

        public Arithmetic(@Nonnull N zero, @Nonnull BinaryOperator<N> add,
                          @Nonnull BinaryOperator<N> subtract) {
            this.zero = zero;
            this.add = add;
            this.subtract = subtract;
        }
    }
}
