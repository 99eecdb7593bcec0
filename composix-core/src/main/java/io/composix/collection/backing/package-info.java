/*
 * package-info.java
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

/**
 * Map abstractions with mutable and persistent implementations.
 *
 * <p>
 * Leaf indexes are written once against {@link io.composix.collection.backing.KeySetMap}, which runs over any
 * {@link io.composix.collection.backing.BackingMap}. Choosing a persistent backing map is all it takes to get a
 * variant of an index whose copies share structure.
 * </p>
 */
package io.composix.collection.backing;
