/*
 * TrivialIndex.java
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
 * An index that keeps nothing. Useful as a placeholder, for example as the inner index of a
 * {@link GroupedIndex} whose groups only need to be counted.
 *
 * @param <T> record type, ignored
 */
@API(API.Status.STABLE)
public final class TrivialIndex<T> implements Index<T>, ShallowClone {

    @Nonnull
    public static <T> TrivialIndex<T> create() {
        return new TrivialIndex<>();
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        // nothing to keep
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        // nothing to keep
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        // nothing to keep
    }

    @Nonnull
    @Override
    public TrivialIndex<T> copy() {
        return this;
    }
}
