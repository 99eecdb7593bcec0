/*
 * SortedBackingMap.java
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

package io.composix.collection.backing;

import com.google.common.collect.Range;
import io.composix.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.Map;

/**
 * A {@link BackingMap} ordered by the natural order of its keys.
 *
 * @param <K> key type
 * @param <V> value type
 */
@API(API.Status.INTERNAL)
public interface SortedBackingMap<K extends Comparable<? super K>, V> extends BackingMap<K, V> {
    @Nullable
    Map.Entry<K, V> first();

    @Nullable
    Map.Entry<K, V> last();

    /**
     * Iterate, in ascending key order, over the entries whose keys lie within a range.
     * @param range the keys to include
     * @return an iterator over the matching entries
     */
    @Nonnull
    Iterator<Map.Entry<K, V>> range(@Nonnull Range<K> range);

    @Nonnull
    @Override
    SortedBackingMap<K, V> copy();
}
