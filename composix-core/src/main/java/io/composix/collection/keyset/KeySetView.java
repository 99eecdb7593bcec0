/*
 * KeySetView.java
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

package io.composix.collection.keyset;

import io.composix.annotation.API;
import io.composix.collection.Key;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only side of a {@link KeySet}.
 */
@API(API.Status.UNSTABLE)
public interface KeySetView extends Iterable<Key> {
    boolean contains(@Nonnull Key key);

    int count();

    default boolean isEmpty() {
        return count() == 0;
    }

    @Nonnull
    @Override
    Iterator<Key> iterator();

    @Nonnull
    default Stream<Key> stream() {
        return StreamSupport.stream(Spliterators.spliterator(iterator(), count(), Spliterator.DISTINCT | Spliterator.NONNULL), false);
    }
}
