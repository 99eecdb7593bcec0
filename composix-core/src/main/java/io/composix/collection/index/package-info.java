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
 * The {@link io.composix.collection.index.Index} contract, leaf indexes and index combinators.
 *
 * <p>
 * Leaf indexes ({@link io.composix.collection.index.HashTableIndex}, {@link io.composix.collection.index.BTreeIndex},
 * {@link io.composix.collection.index.KeysIndex}, {@link io.composix.collection.index.SuffixTreeIndex}) keep keys
 * by value. Combinators transform what their inner indexes see:
 * {@link io.composix.collection.index.PremapIndex} maps each record to a derived value,
 * {@link io.composix.collection.index.FilteredIndex} forwards only matching records,
 * {@link io.composix.collection.index.GroupedIndex} keeps one inner index per group, and
 * {@link io.composix.collection.index.CompositeIndex} fans every operation out to several indexes.
 * </p>
 */
package io.composix.collection.index;
