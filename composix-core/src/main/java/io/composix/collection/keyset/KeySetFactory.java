/*
 * KeySetFactory.java
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

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * The available {@link KeySet} implementations.
 */
@API(API.Status.UNSTABLE)
public enum KeySetFactory {
    /** {@link HashKeySet}. */
    HASH(HashKeySet::new),
    /** {@link TreeKeySet}: keys come back in the order they were issued. */
    TREE(TreeKeySet::new),
    /** {@link LongKeySet}: unboxed identifiers. */
    LONG(LongKeySet::new),
    /** {@link PersistentKeySet}: constant time copies. */
    PERSISTENT(PersistentKeySet::new);

    @Nonnull
    private final Supplier<KeySet> supplier;

    KeySetFactory(@Nonnull Supplier<KeySet> supplier) {
        this.supplier = supplier;
    }

    @Nonnull
    public KeySet create() {
        return supplier.get();
    }
}
