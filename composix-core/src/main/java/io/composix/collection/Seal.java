/*
 * Seal.java
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

/**
 * Capability required by every mutating method of {@link io.composix.collection.index.Index}.
 *
 * <p>
 * The only instance lives in this package and is passed down by {@link Collection}. Combinators forward the seal
 * they were given to their inner indexes. Code outside of the collection cannot obtain a seal and so cannot change an
 * index behind the collection's back.
 * </p>
 */
@API(API.Status.STABLE)
public final class Seal {
    static final Seal INSTANCE = new Seal();

    private Seal() {
    }

    @Override
    public String toString() {
        return "Seal";
    }
}
