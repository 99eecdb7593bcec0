/*
 * AggregatesTest.java
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

import io.composix.collection.Collection;
import io.composix.collection.IndexConsistencyException;
import io.composix.collection.Key;
import io.composix.collection.TestSeals;
import io.composix.collection.index.Remove;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link CountIndex}, {@link SumIndex}, {@link MeanIndex} and {@link BooleanIndex}.
 */
public class AggregatesTest {

    @Test
    public void count() {
        final Collection<String, CountIndex<String>> words = Collection.create(CountIndex.<String>create());
        final Key key = words.insert("a");
        words.insertAll(List.of("b", "c"));
        words.adjustByKey(key, word -> "z");
        assertThat(words.<Long>queryValue(CountIndex::get)).isEqualTo(3L);
        words.deleteByKey(key);
        assertThat(words.<Long>queryValue(CountIndex::get)).isEqualTo(2L);
    }

    @Test
    public void countCannotGoNegative() {
        final CountIndex<String> count = CountIndex.create();
        assertThatThrownBy(() -> count.remove(TestSeals.seal(), new Remove<>(Key.unsafeOf(0L), "a")))
                .isInstanceOf(IndexConsistencyException.class);
    }

    @Test
    public void sums() {
        final Collection<Integer, SumIndex<Integer>> ints = Collection.create(SumIndex.ofIntegers());
        final Key key = ints.insert(5);
        ints.insertAll(List.of(7, -2));
        ints.adjustByKey(key, value -> 10);
        assertThat(ints.<Integer>queryValue(SumIndex::get)).isEqualTo(15);
        ints.deleteByKey(key);
        assertThat(ints.<Integer>queryValue(SumIndex::get)).isEqualTo(5);

        final Collection<BigDecimal, SumIndex<BigDecimal>> money = Collection.create(SumIndex.ofBigDecimals());
        money.insertAll(List.of(new BigDecimal("0.10"), new BigDecimal("0.20")));
        assertThat(money.<BigDecimal>queryValue(SumIndex::get)).isEqualByComparingTo("0.30");

        final Collection<Double, SumIndex<Double>> doubles = Collection.create(SumIndex.ofDoubles());
        doubles.insertAll(List.of(1.5, 2.25));
        assertThat(doubles.<Double>queryValue(SumIndex::get)).isCloseTo(3.75, within(1e-12));
    }

    @Test
    public void integralSumsDetectOverflow() {
        final Collection<Long, SumIndex<Long>> longs = Collection.create(SumIndex.ofLongs());
        longs.insert(Long.MAX_VALUE);
        assertThatThrownBy(() -> longs.insert(1L)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    public void mean() {
        final Collection<Integer, MeanIndex<Integer>> numbers = Collection.create(MeanIndex.<Integer>create());
        assertThat(numbers.<Double>queryValue(MeanIndex::get)).isZero();
        assertThat(numbers.<OptionalDouble>queryValue(MeanIndex::getOptional)).isEqualTo(OptionalDouble.empty());
        final Key two = numbers.insert(2);
        numbers.insertAll(List.of(4, 9));
        assertThat(numbers.<Double>queryValue(MeanIndex::get)).isCloseTo(5.0, within(1e-12));
        numbers.adjustByKey(two, value -> 5);
        assertThat(numbers.<Double>queryValue(MeanIndex::get)).isCloseTo(6.0, within(1e-12));
        numbers.deleteByKey(two);
        assertThat(numbers.<Double>queryValue(MeanIndex::get)).isCloseTo(6.5, within(1e-12));
        assertThat(numbers.<Long>queryValue(MeanIndex::getCount)).isEqualTo(2L);
        assertThat(numbers.queryValue(MeanIndex::getOptional).getAsDouble()).isCloseTo(6.5, within(1e-12));
    }

    @Test
    public void booleans() {
        final Collection<Boolean, BooleanIndex> flags = Collection.create(BooleanIndex.create());
        assertThat(flags.<Boolean>queryValue(BooleanIndex::all)).isTrue();
        assertThat(flags.<Boolean>queryValue(BooleanIndex::any)).isFalse();
        final Key first = flags.insert(true);
        flags.insert(false);
        assertThat(flags.<Boolean>queryValue(BooleanIndex::all)).isFalse();
        assertThat(flags.<Boolean>queryValue(BooleanIndex::any)).isTrue();
        flags.adjustByKey(first, value -> false);
        assertThat(flags.<Boolean>queryValue(BooleanIndex::any)).isFalse();
        assertThat(flags.<Long>queryValue(BooleanIndex::falseCount)).isEqualTo(2L);
        assertThat(flags.<Long>queryValue(BooleanIndex::totalCount)).isEqualTo(2L);
        flags.deleteByKey(first);
        assertThat(flags.<Long>queryValue(BooleanIndex::trueCount)).isZero();
        assertThat(flags.<Long>queryValue(BooleanIndex::falseCount)).isEqualTo(1L);
    }

    @Test
    public void customAggregate() {
        final AggregateIndex<Integer, Integer, Boolean> anyNegative = AggregateIndex.of(0,
                (negatives, value) -> value < 0 ? negatives + 1 : negatives,
                (negatives, value) -> value < 0 ? negatives - 1 : negatives,
                negatives -> negatives > 0);
        final Collection<Integer, AggregateIndex<Integer, Integer, Boolean>> numbers = Collection.create(anyNegative);
        final Key key = numbers.insert(-3);
        numbers.insert(4);
        assertThat(numbers.<Boolean>queryValue(AggregateIndex::get)).isTrue();
        numbers.adjustByKey(key, value -> 3);
        assertThat(numbers.<Boolean>queryValue(AggregateIndex::get)).isFalse();
        assertThat(numbers.<Integer>queryValue(AggregateIndex::getState)).isZero();

        final Collection<Integer, AggregateIndex<Integer, Integer, Boolean>> copy = numbers.copy();
        copy.insert(-1);
        assertThat(copy.<Boolean>queryValue(AggregateIndex::get)).isTrue();
        assertThat(numbers.<Boolean>queryValue(AggregateIndex::get)).isFalse();
    }

    @Test
    public void customUpdateFunction() {
        final AggregateIndex<Integer, Long, Long> updates = AggregateIndex.<Integer, Long, Long>of(0L,
                (state, value) -> state,
                (state, value) -> state,
                state -> state)
                .withUpdate((state, newValue, existingValue) -> state + 1);
        final Collection<Integer, AggregateIndex<Integer, Long, Long>> numbers = Collection.create(updates);
        final Key key = numbers.insert(1);
        numbers.adjustByKey(key, value -> 2);
        numbers.adjustByKey(key, value -> 3);
        assertThat(numbers.<Long>queryValue(AggregateIndex::get)).isEqualTo(2L);
    }
}
