/*
 * DistinctQueryResult.java
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

package io.composix.collection.query;

import io.composix.annotation.API;

/**
 * Marker for a {@link QueryResult} in which every key appears at most once.
 *
 * <p>
 * Operations that change or take every record of a result, such as
 * {@link io.composix.collection.Collection#update} and {@link io.composix.collection.Collection#take}, only accept
 * distinct results, so that no record is visited twice.
 * </p>
 */
@API(API.Status.STABLE)
public interface DistinctQueryResult extends QueryResult {
}
