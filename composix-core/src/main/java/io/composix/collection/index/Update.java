/*
 * Update.java
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
import java.util.Objects;
import java.util.function.Function;

/**
 * The record under a key is about to be replaced.
 *
 * @param <T> the type of value the index sees
 */
@API(API.Status.STABLE)
public final class Update<T> {
    @Nonnull
    private final Key key;
    @Nonnull
    private final T newValue;
    @Nonnull
    private final T existingValue;

    public Update(@Nonnull Key key, @Nonnull T newValue, @Nonnull T existingValue) {
        this.key = key;
        this.newValue = newValue;
        this.existingValue = existingValue;
    }

    @Nonnull
    public Key getKey() {
        return key;
    }

    @Nonnull
    public T getNewValue() {
        return newValue;
    }

    @Nonnull
    public T getExistingValue() {
        return existingValue;
    }

    /**
     * Whether the old and new values are equal, in which case most indexes have nothing to do.
     * @return {@code true} if the values are equal
     */
    public boolean isUnchanged() {
        return Objects.equals(newValue, existingValue);
    }

    @Nonnull
    public Remove<T> asRemove() {
        return new Remove<>(key, existingValue);
    }

    @Nonnull
    public Insert<T> asInsert() {
        return new Insert<>(key, newValue);
    }

    /**
     * The same operation on derived values. Both the old and the new value are mapped.
     * @param function maps the values
     * @param <U> derived value type
     * @return the operation as seen by an index over derived values
     */
    @Nonnull
    public <U> Update<U> map(@Nonnull Function<? super T, ? extends U> function) {
        return new Update<>(key, function.apply(newValue), function.apply(existingValue));
    }

    @Override
    public String toString() {
        return "Update(" + key + ", " + existingValue + " -> " + newValue + ")";
    }
}
