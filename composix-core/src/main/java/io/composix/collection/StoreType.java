/*
 * StoreType.java
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

import javax.annotation.Nonnull;

/**
 * The built-in {@link Store} implementations.
 */
@API(API.Status.STABLE)
public enum StoreType {
    /** {@link HashMapStore}: records come back in no particular order. */
    HASH,
    /** {@link TreeMapStore}: records come back in key order, that is, oldest first. */
    ORDERED,
    /** {@link PersistentStore}: copies share structure, as needed by {@link Collection#shallowClone()}. */
    PERSISTENT;

    @Nonnull
    <T> Store<T> newStore() {
        switch (this) {
            case ORDERED:
                return new TreeMapStore<>();
            case PERSISTENT:
                return new PersistentStore<>();
            case HASH:
            default:
                return new HashMapStore<>();
        }
    }
}
