/*
 * ShallowClone.java
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
 * Marker for indexes, stores and key sets whose copies share structure with the original, so that copying them is
 * cheap (constant or amortized constant time) and mutating one copy never affects another.
 *
 * <p>
 * Types that are only sometimes cheap to copy, such as combinators whose cost depends on their inner indexes, do not
 * carry the marker and answer {@code isShallowCloneable()} instead.
 * </p>
 *
 * @see Collection#shallowClone()
 */
@API(API.Status.STABLE)
public interface ShallowClone {
}
