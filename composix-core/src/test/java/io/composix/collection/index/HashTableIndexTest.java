/*
 * HashTableIndexTest.java
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

import io.composix.collection.Collection;
import io.composix.collection.IndexConsistencyException;
import io.composix.collection.Key;
import io.composix.collection.TestSeals;
import io.composix.collection.keyset.KeySetFactory;
import io.composix.collection.query.DistinctKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HashTableIndex}.
 */
public class HashTableIndexTest {

    @ParameterizedTest
    @EnumSource(KeySetFactory.class)
    public void lookups(KeySetFactory keySets) {
        final Collection<String, HashTableIndex<String>> words = Collection.create(HashTableIndex.create(keySets));
        final Key a1 = words.insert("a");
        final Key b = words.insert("b");
        final Key a2 = words.insert("a");

        assertEquals(DistinctKeys.of(a1, a2), words.queryValue(ix -> ix.getAll("a")));
        assertEquals(DistinctKeys.of(b), words.queryValue(ix -> ix.getAll("b")));
        assertTrue(words.queryValue(ix -> ix.getAll("c")).isEmpty());
        assertTrue(words.queryValue(ix -> ix.getOne("a")).isPresent());
        assertEquals(Optional.empty(), words.<Optional<Key>>queryValue(ix -> ix.getOne("c")));
        assertEquals(2, words.<Integer>queryValue(HashTableIndex::countDistinct));
        assertEquals(DistinctKeys.of(a1, a2, b), words.queryValue(HashTableIndex::all));

        words.deleteByKey(a1);
        assertEquals(Optional.of(a2), words.<Optional<Key>>queryValue(ix -> ix.getOne("a")));
        words.deleteByKey(a2);
        assertFalse(words.<Boolean>queryValue(ix -> ix.contains("a")));
        assertEquals(1, words.<Integer>queryValue(HashTableIndex::countDistinct));
    }

    @Test
    public void updateMovesKeyBetweenValues() {
        final Collection<String, HashTableIndex<String>> words = Collection.create(HashTableIndex.create());
        final Key key = words.insert("old");
        words.adjustByKey(key, word -> "new");
        assertFalse(words.<Boolean>queryValue(ix -> ix.contains("old")));
        assertEquals(List.of("new"), words.queryAll(ix -> ix.getAll("new")));
        // an unchanged value is a no-op rather than a remove and insert
        words.adjustByKey(key, word -> "new");
        assertEquals(List.of("new"), words.queryAll(ix -> ix.getAll("new")));
    }

    @Test
    public void removingUnknownEntryIsFatal() {
        final HashTableIndex<String> index = HashTableIndex.create();
        index.insert(TestSeals.seal(), new Insert<>(Key.unsafeOf(1L), "x"));
        assertThrows(IndexConsistencyException.class, () -> index.remove(TestSeals.seal(), new Remove<>(Key.unsafeOf(2L), "x")));
        assertThrows(IndexConsistencyException.class, () -> index.remove(TestSeals.seal(), new Remove<>(Key.unsafeOf(1L), "y")));
        assertTrue(index.contains("x"));
    }

    @Test
    public void persistentCopiesShareNothingObservable() {
        final HashTableIndex<String> index = HashTableIndex.persistent();
        assertTrue(index.isShallowCloneable());
        assertFalse(HashTableIndex.create().isShallowCloneable());
        index.insert(TestSeals.seal(), new Insert<>(Key.unsafeOf(1L), "x"));
        index.insert(TestSeals.seal(), new Insert<>(Key.unsafeOf(2L), "x"));

        final HashTableIndex<String> copy = index.copy();
        copy.remove(TestSeals.seal(), new Remove<>(Key.unsafeOf(1L), "x"));
        copy.insert(TestSeals.seal(), new Insert<>(Key.unsafeOf(3L), "y"));

        assertEquals(DistinctKeys.of(Key.unsafeOf(1L), Key.unsafeOf(2L)), index.getAll("x"));
        assertFalse(index.contains("y"));
        assertEquals(DistinctKeys.of(Key.unsafeOf(2L)), copy.getAll("x"));
        assertEquals(DistinctKeys.of(Key.unsafeOf(3L)), copy.getAll("y"));
    }
}
