/*
 * IndexList.java
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
 * Any number of indexes of the same type over the same records, maintained together and addressed by position.
 *
 * @param <T> record type
 * @param <I> member index type
 */
@API(API.Status.STABLE)
public class IndexList<T, I extends Index<T>> extends CompositeIndex<T> {
    @Nonnull
    private final ImmutableList<I> members;

    protected IndexList(@Nonnull ImmutableList<I> members) {
        this.members = members;
    }

    @Nonnull
    public static <T, I extends Index<T>> IndexList<T, I> of(@Nonnull List<I> members) {
        return new IndexList<>(ImmutableList.copyOf(members));
    }

    @Nonnull
    @SafeVarargs
    public static <T, I extends Index<T>> IndexList<T, I> of(@Nonnull I... members) {
        return new IndexList<>(ImmutableList.copyOf(members));
    }

    @Nonnull
    public I get(int position) {
        return members.get(position);
    }

    public int size() {
        return members.size();
    }

    @Nonnull
    @Override
    protected List<I> members() {
        return members;
    }

    @Nonnull
    @Override
    public IndexList<T, I> copy() {
        final ImmutableList.Builder<I> copies = ImmutableList.builderWithExpectedSize(members.size());
        for (I member : members) {
            copies.add(Index.copyOf(member));
        }
        return new IndexList<>(copies.build());
    }
}
