/*
 * QueryResult.java
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

package io.composix.collection.query;

import com.google.common.collect.ImmutableList;
import io.composix.annotation.API;
import io.composix.collection.Key;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A query answer made of keys. The same key may appear more than once unless the result is also a
 * {@link DistinctQueryResult}.
 */
@API(API.Status.STABLE)
public interface QueryResult {
    /**
     * Visit every key of the result, repeats included.
     * @param action called once per key occurrence
     */
    void forEachKey(@Nonnull Consumer<? super Key> action);

    /**
     * Collect the keys of the result, in visiting order, repeats included.
     * @return the keys
     */
    @Nonnull
    default List<Key> keys() {
        final ImmutableList.Builder<Key> builder = ImmutableList.builder();
        forEachKey(builder::add);
        return builder.build();
    }

    /**
     * Turn an optional key into a result with zero or one keys.
     * @param key the optional key
     * @return a distinct result
     */
    @Nonnull
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    static DistinctQueryResult of(@Nonnull Optional<Key> key) {
        return key.isPresent() ? key.get() : DistinctKeys.empty();
    }
}
