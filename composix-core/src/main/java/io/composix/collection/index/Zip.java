/*
 * Zip.java
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

import javax.annotation.Nonnull;

/**
 * Factories for positional composite indexes. Each member sees every operation, in argument order, and is reached
 * through {@code first()}, {@code second()} and so on. For more members, or for members with meaningful names,
 * extend {@link CompositeIndex} instead.
 */
@API(API.Status.STABLE)
public final class Zip {
    private Zip() {
    }

    @Nonnull
    public static <T, A extends Index<T>, B extends Index<T>> Zip2<T, A, B> of(@Nonnull A first, @Nonnull B second) {
        return new Zip2<>(first, second);
    }

    @Nonnull
    public static <T, A extends Index<T>, B extends Index<T>, C extends Index<T>> Zip3<T, A, B, C> of(@Nonnull A first, @Nonnull B second, @Nonnull C third) {
        return new Zip3<>(first, second, third);
    }

    @Nonnull
    public static <T, A extends Index<T>, B extends Index<T>, C extends Index<T>, D extends Index<T>> Zip4<T, A, B, C, D> of(@Nonnull A first, @Nonnull B second, @Nonnull C third, @Nonnull D fourth) {
        return new Zip4<>(first, second, third, fourth);
    }

    @Nonnull
    public static <T, A extends Index<T>, B extends Index<T>, C extends Index<T>, D extends Index<T>, E extends Index<T>> Zip5<T, A, B, C, D, E> of(@Nonnull A first, @Nonnull B second, @Nonnull C third, @Nonnull D fourth, @Nonnull E fifth) {
        return new Zip5<>(first, second, third, fourth, fifth);
    }
}
