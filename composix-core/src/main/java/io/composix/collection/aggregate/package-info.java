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
 * Indexes that maintain a running aggregate of the values they see instead of keeping keys.
 *
 * <p>
 * Aggregates are cheap to copy and are always {@link io.composix.collection.ShallowClone}. Combined with
 * {@link io.composix.collection.index.GroupedIndex} they give per-group aggregates, and combined with
 * {@link io.composix.collection.index.FilteredIndex} they give aggregates over a subset.
 * </p>
 */
package io.composix.collection.aggregate;
