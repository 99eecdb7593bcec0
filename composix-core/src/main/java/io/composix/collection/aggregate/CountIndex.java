/*
 * CountIndex.java
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

package io.composix.collection.aggregate;

import io.composix.annotation.API;
import io.composix.collection.IndexConsistencyException;
import io.composix.collection.Seal;
import io.composix.collection.ShallowClone;
import io.composix.collection.index.Index;
import io.composix.collection.index.Insert;
import io.composix.collection.index.Remove;
import io.composix.collection.index.Update;

import javax.annotation.Nonnull;

/**
 * Counts the records it sees.
 *
 * @param <T> record type, ignored
 */
@API(API.Status.STABLE)
public class CountIndex<T> implements Index<T>, ShallowClone {
    private long count;

    protected CountIndex(long count) {
        this.count = count;
    }

    @Nonnull
    public static <T> CountIndex<T> create() {
        return new CountIndex<>(0L);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<T> op) {
        count++;
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<T> op) {
        if (count == 0L) {
            throw IndexConsistencyException.unknownRemoval(this, op.getKey());
        }
        count--;
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<T> op) {
        // an update does not change the number of records
    }

    public long get() {
        return count;
    }

    @Nonnull
    @Override
    public CountIndex<T> copy() {
        return new CountIndex<>(count);
    }
}
