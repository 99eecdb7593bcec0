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
 * In-memory collections whose secondary indexes are maintained automatically.
 *
 * <p>
 * A {@link io.composix.collection.Collection} owns its records and assigns each one an opaque
 * {@link io.composix.collection.Key}. A single {@link io.composix.collection.index.Index}, usually a tree of
 * combinators over leaf indexes, is told about every insert, update and removal, and is then queried through the
 * collection. Queries return keys, which the collection resolves back into records.
 * </p>
 *
 * <p>
 * Indexes are only ever mutated by the collection that owns them. Every mutating index method takes a
 * {@link io.composix.collection.Seal}, which application code cannot create.
 * </p>
 */
package io.composix.collection;
