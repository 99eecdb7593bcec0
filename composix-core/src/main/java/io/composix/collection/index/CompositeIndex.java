/*
 * CompositeIndex.java
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

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Base class for an index made of several member indexes over the same records. Every operation goes to every
 * member, in the order {@link #members()} lists them.
 *
 * <p>
 * Applications usually extend this with one named field per member, which keeps queries readable:
 * </p>
 *
 * <pre>{@code
 * class PersonIndex extends CompositeIndex<Person> {
 *     final PremapIndex<Person, String, HashTableIndex<String>> byName;
 *     final PremapIndex<Person, Integer, BTreeIndex<Integer>> byAge;
 *
 *     protected List<Index<Person>> members() {
 *         return List.of(byName, byAge);
 *     }
 *     ...
 * }
 * }</pre>
 *
 * @param <T> record type
 * @see Zip
 * @see IndexList
 */
@API(API.Status.STABLE)
public abstract class CompositeIndex<T> implements Index<T> {

    /**
     * The member indexes, always in the same order.
     * @return the members
     */
    @Nonnull
    protected abstract List<? extends Index<T>> members();

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        for (Index<T> member : members()) {
            member.insert(seal, op);
        }
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        for (Index<T> member : members()) {
            member.remove(seal, op);
        }
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        for (Index<T> member : members()) {
            member.update(seal, op);
        }
    }

    @Nonnull
    @Override
    public abstract CompositeIndex<T> copy();

    @Override
    public boolean isShallowCloneable() {
        for (Index<T> member : members()) {
            if (!member.isShallowCloneable()) {
                return false;
            }
        }
        return true;
    }
}
