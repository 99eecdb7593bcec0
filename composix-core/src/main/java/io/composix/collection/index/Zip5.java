/*
 * Zip5.java
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

import com.google.common.collect.ImmutableList;
import io.composix.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Five indexes over the same records, maintained together.
 *
 * @param <T> record type
 * @see Zip
 */
@API(API.Status.STABLE)
public class Zip5<T, A extends Index<T>, B extends Index<T>, C extends Index<T>, D extends Index<T>, E extends Index<T>> extends CompositeIndex<T> {
    @Nonnull
    private final A first;
    @Nonnull
    private final B second;
    @Nonnull
    private final C third;
    @Nonnull
    private final D fourth;
    @Nonnull
    private final E fifth;
    @Nonnull
    private final List<Index<T>> members;

    public Zip5(@Nonnull A first, @Nonnull B second, @Nonnull C third, @Nonnull D fourth, @Nonnull E fifth) {
        this.first = first;
        this.second = second;
        this.third = third;
        this.fourth = fourth;
        this.fifth = fifth;
        this.members = ImmutableList.of(first, second, third, fourth, fifth);
    }

    @Nonnull
    public A first() {
        return first;
    }

    @Nonnull
    public B second() {
        return second;
    }

    @Nonnull
    public C third() {
        return third;
    }

    @Nonnull
    public D fourth() {
        return fourth;
    }

    @Nonnull
    public E fifth() {
        return fifth;
    }

    @Nonnull
    @Override
    protected List<Index<T>> members() {
        return members;
    }

    @Nonnull
    @Override
    public Zip5<T, A, B, C, D, E> copy() {
        return new Zip5<>(Index.copyOf(first), Index.copyOf(second), Index.copyOf(third), Index.copyOf(fourth), Index.copyOf(fifth));
    }
}
