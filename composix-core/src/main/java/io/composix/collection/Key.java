/*
 * Key.java
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

package io.composix.collection;

import io.composix.annotation.API;
import io.composix.collection.query.DistinctQueryResult;

import javax.annotation.Nonnull;
import java.util.function.Consumer;

/**
 * Opaque identifier of a record within one {@link Collection}.
 *
 * <p>
 * Keys are handed out by the collection from a strictly increasing counter and never reused, so a key keeps pointing
 * at the same logical record for as long as that record exists. A key is only meaningful to the collection that
 * issued it (and to its copies).
 * </p>
 *
 * <p>
 * A single key is also the simplest {@link DistinctQueryResult}.
 * </p>
 */
@API(API.Status.STABLE)
public final class Key implements Comparable<Key>, DistinctQueryResult {
    private final long id;

    private Key(long id) {
        this.id = id;
    }

    /**
     * Wrap a raw identifier. Only collections, stores and key sets that keep identifiers in unboxed form should
     * need this.
     * @param id the raw identifier
     * @return the key with that identifier
     */
    @Nonnull
    @API(API.Status.INTERNAL)
    public static Key unsafeOf(long id) {
        return new Key(id);
    }

    public long getId() {
        return id;
    }

    @Override
    public void forEachKey(@Nonnull Consumer<? super Key> action) {
        action.accept(this);
    }

    @Override
    public int compareTo(@Nonnull Key other) {
        return Long.compare(id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id == ((Key)o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Key(" + id + ")";
    }
}
