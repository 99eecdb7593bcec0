/*
 * KeySet.java
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
import io.composix.collection.ShallowClone;

import javax.annotation.Nonnull;

/**
 * A mutable set of keys. Leaf indexes keep one per distinct indexed value.
 *
 * @see KeySetFactory
 */
@API(API.Status.UNSTABLE)
public interface KeySet extends KeySetView {
    /**
     * Add a key.
     * @param key the key to add
     * @return {@code true} if the key was not already present
     */
    boolean add(@Nonnull Key key);

    /**
     * Remove a key.
     * @param key the key to remove
     * @return {@code true} if the key was present
     */
    boolean remove(@Nonnull Key key);

    /**
     * Create a copy that can be mutated independently of this set.
     * @return the copy
     */
    @Nonnull
    KeySet copy();

    default boolean isShallowCloneable() {
        return this instanceof ShallowClone;
    }
}
