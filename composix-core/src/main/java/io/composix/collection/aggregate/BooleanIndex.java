/*
 * BooleanIndex.java
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
 * Counts true and false values, answering "all" and "any" questions in constant time.
 */
@API(API.Status.STABLE)
public class BooleanIndex implements Index<Boolean>, ShallowClone {
    private long trueCount;
    private long falseCount;

    protected BooleanIndex(long trueCount, long falseCount) {
        this.trueCount = trueCount;
        this.falseCount = falseCount;
    }

    @Nonnull
    public static BooleanIndex create() {
        return new BooleanIndex(0L, 0L);
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<Boolean> op) {
        if (op.getNewValue()) {
            trueCount++;
        } else {
            falseCount++;
        }
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<Boolean> op) {
        if (op.getExistingValue()) {
            if (trueCount == 0L) {
                throw IndexConsistencyException.unknownRemoval(this, op.getKey());
            }
            trueCount--;
        } else {
            if (falseCount == 0L) {
                throw IndexConsistencyException.unknownRemoval(this, op.getKey());
            }
            falseCount--;
        }
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<Boolean> op) {
        if (!op.isUnchanged()) {
            Index.super.update(seal, op);
        }
    }

    /**
     * Whether every value is true. Holds vacuously when there are no values.
     * @return {@code true} if no value is false
     */
    public boolean all() {
        return falseCount == 0L;
    }

    /**
     * Whether some value is true.
     * @return {@code true} if at least one value is true
     */
    public boolean any() {
        return trueCount > 0L;
    }

    public long trueCount() {
        return trueCount;
    }

    public long falseCount() {
        return falseCount;
    }

    public long totalCount() {
        return trueCount + falseCount;
    }

    @Nonnull
    @Override
    public BooleanIndex copy() {
        return new BooleanIndex(trueCount, falseCount);
    }
}
