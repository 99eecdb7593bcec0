/*
 * Remove.java
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
import io.composix.collection.Key;

import javax.annotation.Nonnull;
import java.util.function.Function;

/**
 * A record is about to be removed. The existing value is still the one the index was last told about.
 *
 * @param <T> the type of value the index sees
 */
@API(API.Status.STABLE)
public final class Remove<T> {
    @Nonnull
    private final Key key;
    @Nonnull
    private final T existingValue;

    public Remove(@Nonnull Key key, @Nonnull T existingValue) {
        this.key = key;
        this.existingValue = existingValue;
    }

    @Nonnull
    public Key getKey() {
        return key;
    }

    @Nonnull
    public T getExistingValue() {
        return existingValue;
    }

    @Nonnull
    public <U> Remove<U> map(@Nonnull Function<? super T, ? extends U> function) {
        return new Remove<>(key, function.apply(existingValue));
    }

    @Override
    public String toString() {
        return "Remove(" + key + ", " + existingValue + ")";
    }
}
