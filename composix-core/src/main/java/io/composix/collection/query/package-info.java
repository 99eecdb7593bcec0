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
 * Results of index queries and their resolution into records.
 *
 * <p>
 * Indexes answer queries with keys. A {@link io.composix.collection.query.QueryResult} is anything built from keys;
 * a {@link io.composix.collection.query.DistinctQueryResult} additionally promises that no key appears twice,
 * which is what bulk updates and removals through a collection require. A
 * {@link io.composix.collection.query.Resolver} turns keys into the records they identify.
 * </p>
 */
package io.composix.collection.query;
