/*
 * SuffixTreeIndex.java
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

package io.composix.collection.index;

import io.composix.annotation.API;
import io.composix.collection.Key;
import io.composix.collection.Seal;
import io.composix.collection.backing.PersistentTreeBackingMap;
import io.composix.collection.backing.SortedKeySetMap;
import io.composix.collection.backing.TreeBackingMap;
import io.composix.collection.keyset.KeySet;
import io.composix.collection.keyset.KeySetFactory;
import io.composix.collection.keyset.KeySetView;
import io.composix.collection.query.DistinctKeys;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Substring index over strings.
 *
 * <p>
 * Every suffix of every indexed string is kept in sorted order, pointing at the keys of the strings that have it.
 * A string contains a pattern exactly when one of its suffixes starts with the pattern, so a substring query is a
 * prefix range scan over the suffixes. The empty string is kept under its one (empty) suffix.
 * </p>
 *
 * <p>
 * Positions are UTF-16 code units, so matching agrees with {@link String#contains} and {@link String#endsWith}.
 * Space is quadratic in the length of the indexed strings; this index suits short fields such as names and titles.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class SuffixTreeIndex implements Index<String> {
    @Nonnull
    private final SortedKeySetMap<String> keysBySuffix;

    protected SuffixTreeIndex(@Nonnull SortedKeySetMap<String> keysBySuffix) {
        this.keysBySuffix = keysBySuffix;
    }

    @Nonnull
    public static SuffixTreeIndex create() {
        return new SuffixTreeIndex(new SortedKeySetMap<String>(new TreeBackingMap<String, KeySet>(), KeySetFactory.HASH));
    }

    @Nonnull
    public static SuffixTreeIndex persistent() {
        return new SuffixTreeIndex(new SortedKeySetMap<String>(new PersistentTreeBackingMap<String, KeySet>(), KeySetFactory.PERSISTENT));
    }

    @Override
    public void insert(@Nonnull Seal seal, @Nonnull Insert<String> op) {
        final String value = op.getNewValue();
        if (value.isEmpty()) {
            keysBySuffix.add(value, op.getKey());
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            keysBySuffix.add(value.substring(i), op.getKey());
        }
    }

    @Override
    public void remove(@Nonnull Seal seal, @Nonnull Remove<String> op) {
        final String value = op.getExistingValue();
        if (value.isEmpty()) {
            keysBySuffix.remove(value, op.getKey());
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            keysBySuffix.remove(value.substring(i), op.getKey());
        }
    }

    @Override
    public void update(@Nonnull Seal seal, @Nonnull Update<String> op) {
        if (!op.isUnchanged()) {
            Index.super.update(seal, op);
        }
    }

    /**
     * Get the keys of every string containing a pattern. The empty pattern matches every string.
     * @param pattern the substring to look for
     * @return the matching keys
     */
    @Nonnull
    public DistinctKeys containsGetAll(@Nonnull String pattern) {
        return keysBySuffix.range(StringRanges.startingWith(pattern));
    }

    /**
     * Get the key of some string containing a pattern.
     * @param pattern the substring to look for
     * @return a matching key, or empty if no string contains the pattern
     */
    @Nonnull
    public Optional<Key> containsGetOne(@Nonnull String pattern) {
        final Iterator<Map.Entry<String, KeySetView>> entries = keysBySuffix.entries(StringRanges.startingWith(pattern));
        if (!entries.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(entries.next().getValue().iterator().next());
    }

    /**
     * Get the keys of every string ending with a suffix. The empty suffix matches every string.
     * @param suffix the ending to look for
     * @return the matching keys
     */
    @Nonnull
    public DistinctKeys endsWith(@Nonnull String suffix) {
        if (suffix.isEmpty()) {
            return keysBySuffix.allKeys();
        }
        return keysBySuffix.keys(suffix);
    }

    /**
     * Count the distinct suffixes held.
     * @return the number of distinct suffixes
     */
    public int countSuffixes() {
        return keysBySuffix.countDistinct();
    }

    @Nonnull
    @Override
    public SuffixTreeIndex copy() {
        return new SuffixTreeIndex(keysBySuffix.copy());
    }

    @Override
    public boolean isShallowCloneable() {
        return keysBySuffix.isShallowCloneable();
    }
}
